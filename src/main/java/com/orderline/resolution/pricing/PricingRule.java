package com.orderline.resolution.pricing;

import com.orderline.resolution.core.model.MarketVolatility;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Markup rule for one customer segment, valid within an effective-date window.
 * Administered outside this library and read through a {@link PricingRuleStore}.
 */
public class PricingRule {
    private final String id;
    private final String name;
    private final String customerSegment;
    private final BigDecimal baseMarkupPct;
    private final BigDecimal volatilityAdjustmentPct;
    private final BigDecimal minimumMarginPct;
    private final Map<String, BigDecimal> categoryAdjustments;
    private final BigDecimal trendMultiplier;
    private final BigDecimal seasonalAdjustmentPct;
    private final boolean active;
    private final LocalDate effectiveFrom;
    private final LocalDate effectiveUntil;

    private PricingRule(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = builder.name != null ? builder.name : builder.customerSegment;
        this.customerSegment = builder.customerSegment.toLowerCase(Locale.ROOT);
        this.baseMarkupPct = builder.baseMarkupPct;
        this.volatilityAdjustmentPct = builder.volatilityAdjustmentPct;
        this.minimumMarginPct = builder.minimumMarginPct;
        this.categoryAdjustments = Map.copyOf(builder.categoryAdjustments);
        this.trendMultiplier = builder.trendMultiplier;
        this.seasonalAdjustmentPct = builder.seasonalAdjustmentPct;
        this.active = builder.active;
        this.effectiveFrom = builder.effectiveFrom;
        this.effectiveUntil = builder.effectiveUntil;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCustomerSegment() {
        return customerSegment;
    }

    public BigDecimal getBaseMarkupPct() {
        return baseMarkupPct;
    }

    public BigDecimal getVolatilityAdjustmentPct() {
        return volatilityAdjustmentPct;
    }

    public BigDecimal getMinimumMarginPct() {
        return minimumMarginPct;
    }

    public Map<String, BigDecimal> getCategoryAdjustments() {
        return categoryAdjustments;
    }

    public BigDecimal getTrendMultiplier() {
        return trendMultiplier;
    }

    public BigDecimal getSeasonalAdjustmentPct() {
        return seasonalAdjustmentPct;
    }

    public boolean isActive() {
        return active;
    }

    public LocalDate getEffectiveFrom() {
        return effectiveFrom;
    }

    public LocalDate getEffectiveUntil() {
        return effectiveUntil;
    }

    /**
     * Active, started on or before {@code date}, and not ended before it.
     * A missing end date means open-ended.
     */
    public boolean isEffective(LocalDate date) {
        if (!active) {
            return false;
        }
        if (date.isBefore(effectiveFrom)) {
            return false;
        }
        return effectiveUntil == null || !date.isAfter(effectiveUntil);
    }

    /**
     * Pricing context for a product of the given category and volatility.
     * Categories without an adjustment contribute zero.
     */
    public PricingContext toContext(String category, MarketVolatility volatility) {
        BigDecimal categoryAdjustment = category != null
                ? categoryAdjustments.getOrDefault(category.toLowerCase(Locale.ROOT), BigDecimal.ZERO)
                : BigDecimal.ZERO;
        return new PricingContext(customerSegment, volatility, baseMarkupPct, volatilityAdjustmentPct,
                categoryAdjustment, minimumMarginPct, trendMultiplier, seasonalAdjustmentPct);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PricingRule that = (PricingRule) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "PricingRule{" +
                "name='" + name + '\'' +
                ", segment='" + customerSegment + '\'' +
                ", baseMarkupPct=" + baseMarkupPct +
                ", minimumMarginPct=" + minimumMarginPct +
                ", effectiveFrom=" + effectiveFrom +
                ", effectiveUntil=" + effectiveUntil +
                ", active=" + active +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String customerSegment;
        private BigDecimal baseMarkupPct;
        private BigDecimal volatilityAdjustmentPct = BigDecimal.ZERO;
        private BigDecimal minimumMarginPct;
        private final Map<String, BigDecimal> categoryAdjustments = new HashMap<>();
        private BigDecimal trendMultiplier = BigDecimal.ONE;
        private BigDecimal seasonalAdjustmentPct = BigDecimal.ZERO;
        private boolean active = true;
        private LocalDate effectiveFrom = LocalDate.MIN;
        private LocalDate effectiveUntil;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder customerSegment(String customerSegment) {
            this.customerSegment = customerSegment;
            return this;
        }

        public Builder baseMarkupPct(BigDecimal baseMarkupPct) {
            this.baseMarkupPct = baseMarkupPct;
            return this;
        }

        public Builder volatilityAdjustmentPct(BigDecimal volatilityAdjustmentPct) {
            this.volatilityAdjustmentPct = volatilityAdjustmentPct;
            return this;
        }

        public Builder minimumMarginPct(BigDecimal minimumMarginPct) {
            this.minimumMarginPct = minimumMarginPct;
            return this;
        }

        public Builder categoryAdjustment(String category, BigDecimal adjustmentPct) {
            this.categoryAdjustments.put(category.toLowerCase(Locale.ROOT), adjustmentPct);
            return this;
        }

        public Builder categoryAdjustments(Map<String, BigDecimal> adjustments) {
            adjustments.forEach(this::categoryAdjustment);
            return this;
        }

        public Builder trendMultiplier(BigDecimal trendMultiplier) {
            this.trendMultiplier = trendMultiplier;
            return this;
        }

        public Builder seasonalAdjustmentPct(BigDecimal seasonalAdjustmentPct) {
            this.seasonalAdjustmentPct = seasonalAdjustmentPct;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder effectiveFrom(LocalDate effectiveFrom) {
            this.effectiveFrom = effectiveFrom;
            return this;
        }

        public Builder effectiveUntil(LocalDate effectiveUntil) {
            this.effectiveUntil = effectiveUntil;
            return this;
        }

        public PricingRule build() {
            Objects.requireNonNull(customerSegment, "customerSegment is required");
            Objects.requireNonNull(baseMarkupPct, "baseMarkupPct is required");
            Objects.requireNonNull(minimumMarginPct, "minimumMarginPct is required");
            Objects.requireNonNull(effectiveFrom, "effectiveFrom is required");
            if (effectiveUntil != null && effectiveUntil.isBefore(effectiveFrom)) {
                throw new IllegalArgumentException("effectiveUntil must not be before effectiveFrom");
            }
            return new PricingRule(this);
        }
    }
}
