package com.orderline.resolution.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProductLock Tests")
class ProductLockTest {

    @Nested
    @DisplayName("NoOpProductLock")
    class NoOpTests {

        @Test
        @DisplayName("Runs the action without blocking")
        void runsAction() {
            NoOpProductLock lock = new NoOpProductLock();
            assertEquals("done", lock.withLock("p-1", () -> "done"));
            assertDoesNotThrow(() -> lock.unlock("never-locked"));
        }
    }

    @Nested
    @DisplayName("LocalProductLock")
    class LocalTests {

        @Test
        @DisplayName("Lock is released after the action, even when it throws")
        void releasedAfterAction() {
            LocalProductLock lock = new LocalProductLock();

            assertThrows(IllegalStateException.class, () -> lock.withLock("p-1", () -> {
                assertTrue(lock.isLocked("p-1"));
                throw new IllegalStateException("boom");
            }));
            assertFalse(lock.isLocked("p-1"));
        }

        @Test
        @DisplayName("Same thread may lock the same product again")
        void reentrant() {
            LocalProductLock lock = new LocalProductLock();

            String result = lock.withLock("p-1", () -> lock.withLock("p-1", () -> "nested"));

            assertEquals("nested", result);
            assertFalse(lock.isLocked("p-1"));
        }

        @Test
        @DisplayName("Waiting for a held product times out")
        void timesOut() throws Exception {
            LocalProductLock lock = new LocalProductLock(new LockConfig(100, true));
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(1);
            ExecutorService executor = Executors.newSingleThreadExecutor();

            try {
                Future<?> holder = executor.submit(() -> {
                    lock.lock("p-1");
                    try {
                        held.countDown();
                        done.await(5, TimeUnit.SECONDS);
                    } finally {
                        lock.unlock("p-1");
                    }
                    return null;
                });
                assertTrue(held.await(5, TimeUnit.SECONDS));

                LockAcquisitionException e = assertThrows(LockAcquisitionException.class, () -> lock.lock("p-1"));
                assertEquals("p-1", e.getProductId());

                done.countDown();
                holder.get(5, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Different products never block each other")
        void differentProducts() throws Exception {
            LocalProductLock lock = new LocalProductLock(new LockConfig(100, false));
            ExecutorService executor = Executors.newSingleThreadExecutor();

            try {
                lock.lock("p-1");
                Future<String> other = executor.submit(() -> lock.withLock("p-2", () -> "locked p-2"));
                assertEquals("locked p-2", other.get(5, TimeUnit.SECONDS));
            } finally {
                lock.unlock("p-1");
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Timeout must be positive")
        void invalidConfig() {
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(0, true));
            assertEquals(5000, LockConfig.defaults().timeoutMs());
        }
    }
}
