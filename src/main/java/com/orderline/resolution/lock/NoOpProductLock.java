package com.orderline.resolution.lock;

/**
 * Lock that never blocks. Stock consistency then rests on the ledger's lot-version
 * checks alone.
 */
public class NoOpProductLock implements ProductLock {

    @Override
    public void lock(String productId) {
        // no-op
    }

    @Override
    public void unlock(String productId) {
        // no-op
    }
}
