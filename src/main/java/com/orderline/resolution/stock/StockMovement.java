package com.orderline.resolution.stock;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Stock effect of a reservation on one lot, for the inventory ledger.
 *
 * @param reference the reservation id
 */
public record StockMovement(
        StockMovementType type,
        String productId,
        String lotId,
        BigDecimal quantity,
        String unit,
        String reference,
        Instant timestamp
) {
    static StockMovement of(StockMovementType type, String productId, Allocation allocation, String reference) {
        return new StockMovement(type, productId, allocation.lotId(), allocation.quantity(),
                allocation.unit(), reference, Instant.now());
    }
}
