package com.fbo.reconciliation.cache;

/**
 * Configuration for the remote fetch cache.
 *
 * @param maxSize    maximum number of cached locations
 * @param ttlSeconds time-to-live in seconds for each cached fetch
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 500 locations, 60s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(500, 60, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
