package com.leadflow.backend.exceptions;

/**
 * Thrown when the inactivity scan cannot read the lead store.
 * The enclosing workflow run is recorded as failed.
 */
public class DetectionException extends RuntimeException {

    private final Long workflowId;

    public DetectionException(Long workflowId, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
    }

    public Long getWorkflowId() {
        return workflowId;
    }
}
