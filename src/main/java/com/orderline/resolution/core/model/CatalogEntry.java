package com.orderline.resolution.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A sellable product in the catalog.
 *
 * <p>The canonical name may embed a packaging descriptor in parentheses, for example
 * {@code "Carrots (10kg bag)"}. The parenthetical content becomes the base descriptors
 * ({@code {"10kg", "bag"}}) and the remainder becomes the core name ({@code "carrots"}).</p>
 */
public class CatalogEntry {

    private static final Pattern PARENTHETICAL = Pattern.compile("\\(([^)]*)\\)");
    private static final Pattern PARENTHETICAL_WITH_SPACE = Pattern.compile("\\s*\\([^)]*\\)");

    private final String id;
    private final String canonicalName;
    private final String coreName;
    private final String unit;
    private final Set<String> baseDescriptors;
    private final BigDecimal basePrice;
    private final boolean active;
    private final String category;
    private final MarketVolatility volatility;

    private CatalogEntry(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.canonicalName = builder.canonicalName.trim();
        this.coreName = coreNameOf(this.canonicalName);
        this.unit = builder.unit.trim().toLowerCase(Locale.ROOT);
        this.baseDescriptors = builder.baseDescriptors != null
                ? normalizeAll(builder.baseDescriptors)
                : descriptorsOf(this.canonicalName);
        this.basePrice = builder.basePrice != null ? builder.basePrice : BigDecimal.ZERO;
        this.active = builder.active;
        this.category = builder.category;
        this.volatility = builder.volatility != null ? builder.volatility : MarketVolatility.STABLE;
    }

    public String getId() {
        return id;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    /**
     * Lowercased name without any parenthetical descriptors.
     */
    public String getCoreName() {
        return coreName;
    }

    public String getUnit() {
        return unit;
    }

    public Set<String> getBaseDescriptors() {
        return baseDescriptors;
    }

    public BigDecimal getBasePrice() {
        return basePrice;
    }

    public boolean isActive() {
        return active;
    }

    public String getCategory() {
        return category;
    }

    public MarketVolatility getVolatility() {
        return volatility;
    }

    /**
     * Strips parenthetical descriptors and lowercases the remainder.
     */
    public static String coreNameOf(String canonicalName) {
        if (canonicalName == null) {
            return "";
        }
        return PARENTHETICAL_WITH_SPACE.matcher(canonicalName).replaceAll("")
                .trim()
                .replaceAll("\\s+", " ")
                .toLowerCase(Locale.ROOT);
    }

    /**
     * Extracts the words inside every parenthetical of the given name.
     */
    public static Set<String> descriptorsOf(String canonicalName) {
        Set<String> descriptors = new LinkedHashSet<>();
        if (canonicalName == null) {
            return Collections.unmodifiableSet(descriptors);
        }
        Matcher matcher = PARENTHETICAL.matcher(canonicalName);
        while (matcher.find()) {
            for (String word : matcher.group(1).split("[\\s,]+")) {
                if (!word.isBlank()) {
                    descriptors.add(word.toLowerCase(Locale.ROOT));
                }
            }
        }
        return Collections.unmodifiableSet(descriptors);
    }

    private static Set<String> normalizeAll(Set<String> values) {
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CatalogEntry that = (CatalogEntry) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CatalogEntry{" +
                "id='" + id + '\'' +
                ", canonicalName='" + canonicalName + '\'' +
                ", unit='" + unit + '\'' +
                ", basePrice=" + basePrice +
                ", active=" + active +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String canonicalName;
        private String unit;
        private Set<String> baseDescriptors;
        private BigDecimal basePrice;
        private boolean active = true;
        private String category;
        private MarketVolatility volatility;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        /**
         * Overrides the descriptors otherwise parsed from the canonical name.
         */
        public Builder baseDescriptors(Set<String> baseDescriptors) {
            this.baseDescriptors = baseDescriptors;
            return this;
        }

        public Builder basePrice(BigDecimal basePrice) {
            this.basePrice = basePrice;
            return this;
        }

        public Builder basePrice(String basePrice) {
            this.basePrice = new BigDecimal(basePrice);
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder volatility(MarketVolatility volatility) {
            this.volatility = volatility;
            return this;
        }

        public CatalogEntry build() {
            Objects.requireNonNull(canonicalName, "canonicalName is required");
            Objects.requireNonNull(unit, "unit is required");
            if (canonicalName.isBlank()) {
                throw new IllegalArgumentException("canonicalName must not be blank");
            }
            if (basePrice != null && basePrice.signum() < 0) {
                throw new IllegalArgumentException("basePrice must be >= 0");
            }
            return new CatalogEntry(this);
        }
    }
}
