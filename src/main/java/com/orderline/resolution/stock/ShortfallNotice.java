package com.orderline.resolution.stock;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Quantity a reservation could not cover, handed to procurement.
 */
public record ShortfallNotice(
        String productId,
        BigDecimal requested,
        BigDecimal available,
        BigDecimal shortfall,
        String unit,
        Urgency urgency,
        String reservationId,
        Instant createdAt
) {
    public static ShortfallNotice of(FulfillmentPlan plan, String reservationId) {
        return new ShortfallNotice(plan.productId(), plan.requested(), plan.reservable(), plan.shortfall(),
                plan.unit(), Urgency.assess(plan.requested(), plan.reservable(), plan.shortfall()),
                reservationId, Instant.now());
    }
}
