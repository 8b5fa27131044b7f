package com.orderline.resolution.rest.dto;

import com.orderline.resolution.core.model.ResolvedOrderLine;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a confirmed order line.
 */
public record OrderLineResponse(
        String id,
        String parsedLineId,
        String productId,
        String productName,
        BigDecimal quantity,
        String unit,
        BigDecimal unitPrice,
        BigDecimal lineTotal,
        double confidence,
        String fulfillmentMethod,
        BigDecimal shortfall,
        String reservationId,
        String status,
        Instant updatedAt
) {
    public static OrderLineResponse from(ResolvedOrderLine line) {
        return new OrderLineResponse(
                line.getId(),
                line.getParsedLineId(),
                line.getProductId(),
                line.getProductName(),
                line.getQuantity(),
                line.getUnit(),
                line.getUnitPrice(),
                line.getEffectiveTotal(),
                line.getConfidence(),
                line.getFulfillmentMethod().name(),
                line.getShortfall(),
                line.getReservationId(),
                line.getStatus().name(),
                line.getUpdatedAt()
        );
    }
}
