package com.orderline.resolution.core.model;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Objects;

/**
 * Aggregate stock for one product across its lots.
 */
public record StockPosition(String productId, BigDecimal availableQuantity, BigDecimal reservedQuantity, String unit) {

    public StockPosition {
        Objects.requireNonNull(productId, "productId is required");
        availableQuantity = availableQuantity != null ? availableQuantity : BigDecimal.ZERO;
        reservedQuantity = reservedQuantity != null ? reservedQuantity : BigDecimal.ZERO;
        if (availableQuantity.signum() < 0 || reservedQuantity.signum() < 0) {
            throw new IllegalArgumentException("stock quantities must be >= 0");
        }
    }

    public static StockPosition empty(String productId, String unit) {
        return new StockPosition(productId, BigDecimal.ZERO, BigDecimal.ZERO, unit);
    }

    /**
     * Sums the given lots. Units of the first lot are reported.
     */
    public static StockPosition of(String productId, Collection<StockLot> lots) {
        BigDecimal available = BigDecimal.ZERO;
        BigDecimal reserved = BigDecimal.ZERO;
        String unit = null;
        for (StockLot lot : lots) {
            available = available.add(lot.available());
            reserved = reserved.add(lot.reserved());
            if (unit == null) {
                unit = lot.unit();
            }
        }
        return new StockPosition(productId, available, reserved, unit);
    }

    public boolean hasAvailable() {
        return availableQuantity.signum() > 0;
    }
}
