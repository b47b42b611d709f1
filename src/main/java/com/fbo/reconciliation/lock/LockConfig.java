package com.fbo.reconciliation.lock;

/**
 * Configuration for location locks.
 *
 * @param timeoutMs maximum time to wait for a location lock
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 30s timeout, long enough to cover one remote fetch.
     */
    public static LockConfig defaults() {
        return new LockConfig(30_000);
    }
}
