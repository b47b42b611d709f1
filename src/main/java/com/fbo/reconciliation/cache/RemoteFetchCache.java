package com.fbo.reconciliation.cache;

import com.fbo.reconciliation.core.model.FacilityRecord;

import java.util.List;
import java.util.Optional;

/**
 * Short-lived cache of raw, not yet reconciled remote query results, keyed by location code.
 * Merged data never lives here; it lives in the local store.
 */
public interface RemoteFetchCache {

    Optional<List<FacilityRecord>> get(String locationCode);

    void put(String locationCode, List<FacilityRecord> records);

    /**
     * Drops the cached fetch for one location, e.g. after a local push changed the remote side.
     */
    void invalidate(String locationCode);

    /**
     * Drops every cached fetch. Called when a new bundled dataset version is imported so stale
     * remote copies of since-fixed duplicates are not replayed.
     */
    void invalidateAll();

    CacheStats getStats();
}
