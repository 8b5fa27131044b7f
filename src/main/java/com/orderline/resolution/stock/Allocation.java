package com.orderline.resolution.stock;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Quantity drawn from one lot, in the lot's own unit.
 *
 * @param lotId       lot drawn from
 * @param quantity    quantity drawn, positive
 * @param unit        unit of the lot
 * @param lotVersion  version of the lot the allocation was planned against
 */
public record Allocation(String lotId, BigDecimal quantity, String unit, long lotVersion) {

    public Allocation {
        Objects.requireNonNull(lotId, "lotId is required");
        Objects.requireNonNull(quantity, "quantity is required");
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("allocation quantity must be > 0");
        }
    }
}
