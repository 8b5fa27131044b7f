package com.orderline.resolution.rest.dto;

import com.orderline.resolution.core.model.InvoiceLine;

import java.math.BigDecimal;

/**
 * Request DTO for a supplier invoice line. Quantity, unit and unit price are optional.
 */
public record InvoiceLineRequest(String description, BigDecimal quantity, String unit, BigDecimal unitPrice) {

    public InvoiceLine toInvoiceLine() {
        return new InvoiceLine(description, quantity, unit, unitPrice);
    }
}
