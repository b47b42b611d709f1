package com.fbo.reconciliation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link LocationLock} backed by one {@link ReentrantLock} per location code.
 * Locks are re-entrant, so a thread already holding a location may nest operations on it.
 */
public class LocalLocationLock implements LocationLock {
    private static final Logger log = LoggerFactory.getLogger(LocalLocationLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalLocationLock() {
        this(LockConfig.defaults());
    }

    public LocalLocationLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String locationCode) {
        String key = key(locationCode);
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            boolean acquired = lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for location '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.trace("Lock acquired: {}", key);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for location: " + key, e);
        }
    }

    @Override
    public void unlock(String locationCode) {
        String key = key(locationCode);
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.trace("Lock released: {}", key);
        }
    }

    private static String key(String locationCode) {
        return locationCode.trim().toUpperCase(Locale.ROOT);
    }
}
