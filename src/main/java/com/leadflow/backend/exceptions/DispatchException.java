package com.leadflow.backend.exceptions;

/**
 * Thrown when a single tracked email could not be handed to the transport.
 * The enrollment that produced it stays at its current step.
 */
public class DispatchException extends RuntimeException {

    private final Long leadId;
    private final Long trackedEmailId;

    public DispatchException(Long leadId, Long trackedEmailId, String message) {
        super(message);
        this.leadId = leadId;
        this.trackedEmailId = trackedEmailId;
    }

    public DispatchException(Long leadId, Long trackedEmailId, String message, Throwable cause) {
        super(message, cause);
        this.leadId = leadId;
        this.trackedEmailId = trackedEmailId;
    }

    public Long getLeadId() {
        return leadId;
    }

    public Long getTrackedEmailId() {
        return trackedEmailId;
    }
}
