package com.fbo.reconciliation.cache;

import com.fbo.reconciliation.core.model.FacilityRecord;

import java.util.List;
import java.util.Optional;

/**
 * Cache that never holds anything. Every sync goes to the remote store.
 */
public class NoOpRemoteFetchCache implements RemoteFetchCache {

    @Override
    public Optional<List<FacilityRecord>> get(String locationCode) {
        return Optional.empty();
    }

    @Override
    public void put(String locationCode, List<FacilityRecord> records) {
    }

    @Override
    public void invalidate(String locationCode) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
