package com.orderline.resolution.stock;

import com.orderline.resolution.core.model.FulfillmentMethod;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * How a requested quantity can be served from current stock.
 *
 * @param productId       product planned for
 * @param requested       requested quantity in {@code unit}
 * @param unit            requested unit
 * @param method          fulfillment method
 * @param allocations     lots to draw from, in drawing order
 * @param reservable      quantity the allocations cover, in {@code unit}
 * @param shortfall       {@code requested - reservable}, zero when fully covered
 */
public record FulfillmentPlan(
        String productId,
        BigDecimal requested,
        String unit,
        FulfillmentMethod method,
        List<Allocation> allocations,
        BigDecimal reservable,
        BigDecimal shortfall
) {
    public FulfillmentPlan {
        Objects.requireNonNull(productId, "productId is required");
        Objects.requireNonNull(method, "method is required");
        allocations = allocations != null ? List.copyOf(allocations) : List.of();
        reservable = reservable != null ? reservable : BigDecimal.ZERO;
        shortfall = shortfall != null ? shortfall : BigDecimal.ZERO;
    }

    public boolean isFullyCovered() {
        return shortfall.signum() == 0;
    }

    public boolean hasAllocations() {
        return !allocations.isEmpty();
    }
}
