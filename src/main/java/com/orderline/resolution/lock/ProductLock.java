package com.orderline.resolution.lock;

import java.util.function.Supplier;

/**
 * Per-product lock serializing stock mutations for the same product.
 * Different products never block each other.
 */
public interface ProductLock {

    /**
     * Acquires the lock for the product.
     *
     * @param productId the product whose stock is about to change
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    void lock(String productId);

    /**
     * Releases the lock if the current thread holds it.
     */
    void unlock(String productId);

    /**
     * Runs the action while holding the product's lock.
     */
    default <T> T withLock(String productId, Supplier<T> action) {
        lock(productId);
        try {
            return action.get();
        } finally {
            unlock(productId);
        }
    }
}
