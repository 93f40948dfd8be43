package com.leadflow.backend.exceptions;

/**
 * Malformed, unknown or expired tracking token. Logged, never shown to the remote caller.
 */
public class TrackingException extends RuntimeException {

    public TrackingException(String message) {
        super(message);
    }

    public TrackingException(String message, Throwable cause) {
        super(message, cause);
    }
}
