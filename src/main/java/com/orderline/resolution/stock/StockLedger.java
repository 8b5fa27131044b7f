package com.orderline.resolution.stock;

import com.orderline.resolution.core.model.StockLot;
import com.orderline.resolution.core.model.StockPosition;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Store of finished-stock lots. Receiving and production own the on-hand quantities
 * ({@link #receive}); reservations only move quantities between available and reserved,
 * through {@link #replaceAll}.
 */
public interface StockLedger {

    /**
     * Lots of the product in receiving order.
     */
    List<StockLot> lotsFor(String productId);

    Optional<StockLot> findLot(String lotId);

    /**
     * Records an inventory snapshot for a lot: sets its available quantity and keeps
     * whatever is reserved. An existing lot gets a new version.
     *
     * @return the stored lot
     */
    StockLot receive(String lotId, String productId, String unit, BigDecimal available);

    /**
     * Atomically replaces the given lots, provided every one of them still has the
     * version of its {@code expected} counterpart.
     *
     * @param expected lots as read when planning
     * @param updated  replacement lots, same order and ids
     * @return false if any lot changed in the meantime; nothing is written then
     */
    boolean replaceAll(List<StockLot> expected, List<StockLot> updated);

    default StockPosition position(String productId) {
        return StockPosition.of(productId, lotsFor(productId));
    }
}
