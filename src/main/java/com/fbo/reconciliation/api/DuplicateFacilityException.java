package com.fbo.reconciliation.api;

import com.fbo.reconciliation.core.model.FacilityRecord;

/**
 * Thrown when a new facility's name collides with an unverified record somebody else created
 * at the same location.
 */
public class DuplicateFacilityException extends RuntimeException {

    private final transient FacilityRecord existing;

    public DuplicateFacilityException(String message, FacilityRecord existing) {
        super(message);
        this.existing = existing;
    }

    /**
     * The stored record the new facility collided with.
     */
    public FacilityRecord getExisting() {
        return existing;
    }
}
