package com.orderline.resolution.core.model;

import java.util.Locale;

/**
 * Categorical tier of recent price-change magnitude for a product.
 */
public enum MarketVolatility {
    STABLE,
    VOLATILE,
    HIGHLY_VOLATILE,
    EXTREMELY_VOLATILE;

    /**
     * Returns true when the volatility markup adjustment applies.
     */
    public boolean attractsAdjustment() {
        return this != STABLE;
    }

    /**
     * Lenient parser accepting {@code "highly_volatile"}, {@code "Highly Volatile"} and similar.
     * Null or blank yields {@link #STABLE}.
     */
    public static MarketVolatility fromString(String value) {
        if (value == null || value.isBlank()) {
            return STABLE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_'));
    }
}
