package com.fbo.reconciliation.remote;

import com.fbo.reconciliation.core.model.FacilityRecord;

import java.util.List;

/**
 * The collaborative backend, seen as a record store with predicate query, insert/update and
 * delete. Calls may be slow and may fail; any {@link RuntimeException} they throw is treated
 * as a transient transport failure by callers.
 */
public interface RemoteRecordStore {

    /**
     * Returns every record the backend holds for a location.
     *
     * @throws RemoteUnavailableException if the backend cannot be reached
     */
    List<FacilityRecord> query(String locationCode);

    /**
     * Inserts a record, or updates it when it already carries a remote identifier.
     *
     * @return the remote identifier assigned to (or kept by) the record
     * @throws RemoteUnavailableException if the backend cannot be reached
     */
    String save(FacilityRecord record);

    /**
     * Deletes the record with the given remote identifier.
     *
     * @throws RemoteUnavailableException if the backend cannot be reached
     */
    void delete(String remoteIdentifier);
}
