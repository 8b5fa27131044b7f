package com.orderline.resolution.lock;

/**
 * Configuration for product locks.
 *
 * @param timeoutMs maximum time to wait for a product's lock
 * @param fair      whether waiting threads acquire the lock in arrival order
 */
public record LockConfig(long timeoutMs, boolean fair) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout, fair ordering.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, true);
    }
}
