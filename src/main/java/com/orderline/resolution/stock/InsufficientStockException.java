package com.orderline.resolution.stock;

import java.math.BigDecimal;

/**
 * Thrown at reservation time when stock cannot cover a request and the caller does not
 * accept a shortfall. Never raised while suggesting matches.
 */
public class InsufficientStockException extends RuntimeException {

    private final String productId;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientStockException(String productId, BigDecimal requested, BigDecimal available) {
        super("Insufficient stock for product " + productId + ": requested " + requested
                + ", available " + available);
        this.productId = productId;
        this.requested = requested;
        this.available = available;
    }

    public String getProductId() {
        return productId;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
