package com.orderline.resolution.stock;

/**
 * Thrown when stock kept changing underneath a reservation even after a fresh re-plan.
 */
public class ConcurrentReservationConflictException extends RuntimeException {

    private final String productId;

    public ConcurrentReservationConflictException(String productId) {
        super("Stock changed for product " + productId + ", please reselect");
        this.productId = productId;
    }

    public String getProductId() {
        return productId;
    }
}
