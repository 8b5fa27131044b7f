package com.orderline.resolution.stock;

import java.math.BigDecimal;

/**
 * Procurement urgency of a shortfall.
 */
public enum Urgency {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    /**
     * Nothing missing is LOW; nothing in stock is URGENT; missing half or more is HIGH.
     */
    public static Urgency assess(BigDecimal requested, BigDecimal available, BigDecimal shortfall) {
        if (shortfall.signum() <= 0) {
            return LOW;
        }
        if (available.signum() <= 0) {
            return URGENT;
        }
        if (shortfall.multiply(BigDecimal.valueOf(2)).compareTo(requested) >= 0) {
            return HIGH;
        }
        return MEDIUM;
    }
}
