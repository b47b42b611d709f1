package com.fbo.reconciliation.cache;

import com.fbo.reconciliation.core.model.FacilityRecord;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Caffeine-backed {@link RemoteFetchCache} with size bound and write TTL.
 */
public class CaffeineRemoteFetchCache implements RemoteFetchCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineRemoteFetchCache.class);

    private final Cache<String, List<FacilityRecord>> cache;

    public CaffeineRemoteFetchCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineRemoteFetchCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    /**
     * Builds the cache described by {@code config}, or a no-op cache when it is disabled.
     */
    public static RemoteFetchCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineRemoteFetchCache(config) : new NoOpRemoteFetchCache();
    }

    @Override
    public Optional<List<FacilityRecord>> get(String locationCode) {
        return Optional.ofNullable(cache.getIfPresent(key(locationCode)));
    }

    @Override
    public void put(String locationCode, List<FacilityRecord> records) {
        cache.put(key(locationCode), List.copyOf(records));
    }

    @Override
    public void invalidate(String locationCode) {
        cache.invalidate(key(locationCode));
        log.debug("Invalidated cached fetch for {}", locationCode);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cached fetches");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    private static String key(String locationCode) {
        return locationCode.trim().toUpperCase(Locale.ROOT);
    }
}
