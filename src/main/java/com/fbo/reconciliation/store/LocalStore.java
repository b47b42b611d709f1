package com.fbo.reconciliation.store;

import com.fbo.reconciliation.core.model.FacilityRecord;

import java.util.List;
import java.util.Set;

/**
 * Durable mapping from location code to that location's merged facility collection.
 *
 * <p>Collections are only ever swapped whole through {@link #replace}; a reader sees either the
 * previous collection or the new one, never a partially merged state.</p>
 */
public interface LocalStore {

    /**
     * Returns the stored collection for a location, or an empty list.
     *
     * @param locationCode the airport identifier (case-insensitive)
     */
    List<FacilityRecord> get(String locationCode);

    /**
     * Atomically replaces the collection stored for a location.
     *
     * @param locationCode the airport identifier (case-insensitive)
     * @param records      the new collection
     * @throws LocalStoreException if the collection cannot be persisted
     */
    void replace(String locationCode, List<FacilityRecord> records);

    /**
     * Returns every location code that has a stored collection.
     */
    Set<String> locationCodes();

    StoreMetadata metadata();

    void updateMetadata(StoreMetadata metadata);

    /**
     * Removes every collection and resets the metadata.
     */
    void clear();
}
