package com.orderline.resolution.lock;

/**
 * Thrown when a product's stock lock cannot be acquired within the configured timeout,
 * or the waiting thread is interrupted.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String productId;

    public LockAcquisitionException(String productId, long timeoutMs) {
        super("Failed to lock stock of product '" + productId + "' within " + timeoutMs + "ms");
        this.productId = productId;
    }

    public LockAcquisitionException(String productId, InterruptedException cause) {
        super("Interrupted while locking stock of product: " + productId, cause);
        this.productId = productId;
    }

    public String getProductId() {
        return productId;
    }
}
