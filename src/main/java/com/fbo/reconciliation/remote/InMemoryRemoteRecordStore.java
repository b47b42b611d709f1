package com.fbo.reconciliation.remote;

import com.fbo.reconciliation.core.model.FacilityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link RemoteRecordStore}.
 * Suitable for testing and offline deployments. Can be switched into a failing mode to
 * simulate an unreachable backend.
 */
public class InMemoryRemoteRecordStore implements RemoteRecordStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRemoteRecordStore.class);

    private final ConcurrentMap<String, FacilityRecord> records = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    @Override
    public List<FacilityRecord> query(String locationCode) {
        checkAvailable();
        String code = locationCode.trim().toUpperCase(Locale.ROOT);
        return records.values().stream()
                .filter(r -> code.equals(r.getLocationCode()))
                .sorted(Comparator.comparing(FacilityRecord::getName))
                .toList();
    }

    @Override
    public String save(FacilityRecord record) {
        checkAvailable();
        return store(record);
    }

    @Override
    public void delete(String remoteIdentifier) {
        checkAvailable();
        records.remove(remoteIdentifier);
    }

    /**
     * Seeds a record as if another user had saved it, regardless of availability.
     */
    public String put(FacilityRecord record) {
        return store(record);
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int size() {
        return records.size();
    }

    private String store(FacilityRecord record) {
        String id = record.getRemoteIdentifier() != null
                ? record.getRemoteIdentifier() : UUID.randomUUID().toString();
        records.put(id, FacilityRecord.builder(record)
                .remoteIdentifier(id)
                .pendingUpload(false)
                .build());
        log.debug("Saved remote record {} ({} / {})", id, record.getLocationCode(), record.getName());
        return id;
    }

    private void checkAvailable() {
        if (!available) {
            throw new RemoteUnavailableException("Remote record store is unavailable");
        }
    }
}
