package com.fbo.reconciliation.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LocalLocationLockTest {

    @Test
    @DisplayName("Should acquire and release a location")
    void testAcquireRelease() {
        LocalLocationLock lock = new LocalLocationLock();
        assertTrue(lock.tryLock("KSFO"));
        assertDoesNotThrow(() -> lock.unlock("KSFO"));
    }

    @Test
    @DisplayName("Should be re-entrant for the owning thread")
    void testReentrant() {
        LocalLocationLock lock = new LocalLocationLock();
        assertTrue(lock.tryLock("KSFO"));
        assertTrue(lock.tryLock("ksfo"));
        lock.unlock("KSFO");
        lock.unlock("KSFO");
    }

    @Test
    @DisplayName("Unlocking a location that is not held is a no-op")
    void testUnlockNotHeld() {
        LocalLocationLock lock = new LocalLocationLock();
        assertDoesNotThrow(() -> lock.unlock("KJFK"));
    }

    @Test
    @DisplayName("Should time out when another thread holds the same location")
    void testTimeout() throws Exception {
        LocalLocationLock lock = new LocalLocationLock(new LockConfig(100));
        lock.tryLock("KSFO");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> contender = executor.submit(() -> lock.tryLock(" ksfo "));
            Exception e = assertThrows(Exception.class, () -> contender.get(5, TimeUnit.SECONDS));
            assertInstanceOf(LockAcquisitionException.class, e.getCause());
        } finally {
            lock.unlock("KSFO");
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Different locations should not block each other")
    void testDifferentLocations() throws Exception {
        LocalLocationLock lock = new LocalLocationLock(new LockConfig(100));
        lock.tryLock("KSFO");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> other = executor.submit(() -> {
                boolean acquired = lock.tryLock("KJFK");
                lock.unlock("KJFK");
                return acquired;
            });
            assertTrue(other.get(5, TimeUnit.SECONDS));
        } finally {
            lock.unlock("KSFO");
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should serialize critical sections on one location")
    void testMutualExclusion() throws Exception {
        LocalLocationLock lock = new LocalLocationLock();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < 50; j++) {
                        lock.tryLock("KSFO");
                        try {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            inside.decrementAndGet();
                        } finally {
                            lock.unlock("KSFO");
                        }
                    }
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, maxInside.get());
    }

    @Test
    @DisplayName("Config should reject non-positive timeouts")
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> new LockConfig(0));
        assertEquals(30_000, LockConfig.defaults().timeoutMs());
    }
}
