package com.fbo.reconciliation.remote;

/**
 * Runtime exception for transport-level failures of the remote record store:
 * unreachable backend, timeout or malformed response.
 */
public class RemoteUnavailableException extends RuntimeException {

    public RemoteUnavailableException(String message) {
        super(message);
    }

    public RemoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
