package com.fbo.reconciliation.store;

/**
 * Runtime exception thrown when the local store cannot be read or written.
 */
public class LocalStoreException extends RuntimeException {

    public LocalStoreException(String message) {
        super(message);
    }

    public LocalStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
