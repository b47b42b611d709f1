package com.fbo.reconciliation.store;

import com.fbo.reconciliation.core.model.FacilityRecord;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link LocalStore}.
 * Suitable for testing and for callers that persist elsewhere.
 */
public class InMemoryLocalStore implements LocalStore {

    private final ConcurrentMap<String, List<FacilityRecord>> collections = new ConcurrentHashMap<>();
    private volatile StoreMetadata metadata = StoreMetadata.initial();

    @Override
    public List<FacilityRecord> get(String locationCode) {
        return collections.getOrDefault(key(locationCode), List.of());
    }

    @Override
    public void replace(String locationCode, List<FacilityRecord> records) {
        collections.put(key(locationCode), List.copyOf(records));
    }

    @Override
    public Set<String> locationCodes() {
        return Set.copyOf(collections.keySet());
    }

    @Override
    public StoreMetadata metadata() {
        return metadata;
    }

    @Override
    public void updateMetadata(StoreMetadata metadata) {
        this.metadata = metadata;
    }

    @Override
    public void clear() {
        collections.clear();
        metadata = StoreMetadata.initial();
    }

    static String key(String locationCode) {
        return locationCode.trim().toUpperCase(Locale.ROOT);
    }
}
