package com.orderline.resolution.stock;

import com.orderline.resolution.core.model.FulfillmentMethod;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Tentative hold on stock for one confirmed order line. Converted into a sale or
 * released back to available stock.
 */
public record Reservation(
        String id,
        String productId,
        BigDecimal quantity,
        String unit,
        FulfillmentMethod method,
        List<Allocation> allocations,
        BigDecimal shortfall,
        ReservationStatus status,
        Instant createdAt,
        Instant updatedAt
) {
    public Reservation {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(productId, "productId is required");
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(status, "status is required");
        allocations = allocations != null ? List.copyOf(allocations) : List.of();
        shortfall = shortfall != null ? shortfall : BigDecimal.ZERO;
    }

    public Reservation withStatus(ReservationStatus newStatus) {
        return new Reservation(id, productId, quantity, unit, method, allocations, shortfall,
                newStatus, createdAt, Instant.now());
    }

    public boolean isOpen() {
        return status == ReservationStatus.RESERVED;
    }
}
