package com.orderline.resolution.stock;

/**
 * Receives stock movements after they have been applied.
 */
@FunctionalInterface
public interface StockMovementListener {

    void onMovement(StockMovement movement);
}
