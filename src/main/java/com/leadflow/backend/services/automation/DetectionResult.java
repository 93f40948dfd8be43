package com.leadflow.backend.services.automation;

/**
 * detected: leads that matched the inactivity query. enrolled: enrollments actually created.
 */
public record DetectionResult(int detected, int enrolled) {

    public boolean lostRaces() {
        return enrolled < detected;
    }
}
