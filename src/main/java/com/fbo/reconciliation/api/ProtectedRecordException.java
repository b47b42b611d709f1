package com.fbo.reconciliation.api;

/**
 * Thrown when an interactive delete targets a verified record, or a record whose duplicate
 * group is represented by a verified one. The store is left unchanged.
 */
public class ProtectedRecordException extends RuntimeException {

    public ProtectedRecordException(String message) {
        super(message);
    }
}
