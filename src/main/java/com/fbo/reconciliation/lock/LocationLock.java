package com.fbo.reconciliation.lock;

/**
 * Mutual exclusion keyed by location code. Held around every read-reconcile-write cycle of a
 * location so that two reconciliations never start from the same stale collection.
 */
public interface LocationLock {

    /**
     * Acquires the lock for a location, waiting up to the configured timeout.
     *
     * @param locationCode the airport identifier
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    boolean tryLock(String locationCode);

    /**
     * Releases the lock for a location. A no-op if the calling thread does not hold it.
     */
    void unlock(String locationCode);
}
