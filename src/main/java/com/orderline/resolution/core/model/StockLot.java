package com.orderline.resolution.core.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * One physical lot of finished stock for a product.
 * Every mutation produces a new instance with an incremented version.
 *
 * @param lotId     lot identifier
 * @param productId owning catalog entry
 * @param unit      unit the quantities are expressed in
 * @param available quantity free for reservation, never negative
 * @param reserved  quantity held by open reservations, never negative
 * @param version   optimistic concurrency version
 */
public record StockLot(
        String lotId,
        String productId,
        String unit,
        BigDecimal available,
        BigDecimal reserved,
        long version
) {
    public StockLot {
        Objects.requireNonNull(lotId, "lotId is required");
        Objects.requireNonNull(productId, "productId is required");
        Objects.requireNonNull(unit, "unit is required");
        unit = unit.toLowerCase(Locale.ROOT);
        available = available != null ? available : BigDecimal.ZERO;
        reserved = reserved != null ? reserved : BigDecimal.ZERO;
        if (available.signum() < 0) {
            throw new IllegalArgumentException("available must be >= 0 for lot " + lotId);
        }
        if (reserved.signum() < 0) {
            throw new IllegalArgumentException("reserved must be >= 0 for lot " + lotId);
        }
    }

    public static StockLot of(String lotId, String productId, String unit, BigDecimal available) {
        return new StockLot(lotId, productId, unit, available, BigDecimal.ZERO, 0L);
    }

    /**
     * Moves {@code quantity} from available to reserved.
     */
    public StockLot reserve(BigDecimal quantity) {
        if (available.compareTo(quantity) < 0) {
            throw new IllegalStateException("Lot " + lotId + " has only " + available + " available");
        }
        return new StockLot(lotId, productId, unit, available.subtract(quantity), reserved.add(quantity), version + 1);
    }

    /**
     * Moves {@code quantity} from reserved back to available.
     */
    public StockLot release(BigDecimal quantity) {
        if (reserved.compareTo(quantity) < 0) {
            throw new IllegalStateException("Lot " + lotId + " has only " + reserved + " reserved");
        }
        return new StockLot(lotId, productId, unit, available.add(quantity), reserved.subtract(quantity), version + 1);
    }

    /**
     * Removes {@code quantity} from reserved permanently.
     */
    public StockLot sell(BigDecimal quantity) {
        if (reserved.compareTo(quantity) < 0) {
            throw new IllegalStateException("Lot " + lotId + " has only " + reserved + " reserved");
        }
        return new StockLot(lotId, productId, unit, available, reserved.subtract(quantity), version + 1);
    }

    public BigDecimal total() {
        return available.add(reserved);
    }
}
