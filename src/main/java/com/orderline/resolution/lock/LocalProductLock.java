package com.orderline.resolution.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process product lock backed by one {@link ReentrantLock} per product id.
 * The default for single-JVM deployments.
 */
public class LocalProductLock implements ProductLock {
    private static final Logger log = LoggerFactory.getLogger(LocalProductLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalProductLock() {
        this(LockConfig.defaults());
    }

    public LocalProductLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String productId) {
        ReentrantLock lock = locks.computeIfAbsent(productId, k -> new ReentrantLock(config.fair()));
        try {
            if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(productId, config.timeoutMs());
            }
            log.trace("lock.acquired product={}", productId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(productId, e);
        }
    }

    @Override
    public void unlock(String productId) {
        ReentrantLock lock = locks.get(productId);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.trace("lock.released product={}", productId);
        }
    }

    /**
     * True when some thread currently holds the product's lock.
     */
    public boolean isLocked(String productId) {
        ReentrantLock lock = locks.get(productId);
        return lock != null && lock.isLocked();
    }
}
