package com.orderline.resolution.core.model;

import java.math.BigDecimal;

/**
 * Fields extracted from one supplier invoice line. Explicit quantity and unit override
 * whatever the description parses to; the unit price becomes the cost basis.
 */
public record InvoiceLine(String description, BigDecimal quantity, String unit, BigDecimal unitPrice) {

    public InvoiceLine {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description is required");
        }
        if (quantity != null && quantity.signum() < 0) {
            throw new IllegalArgumentException("quantity must be >= 0");
        }
        if (unitPrice != null && unitPrice.signum() < 0) {
            throw new IllegalArgumentException("unitPrice must be >= 0");
        }
    }
}
