package com.leadflow.backend.dto.automation;

import com.leadflow.backend.enums.RunStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Outcome of one workflow run. Not persisted on its own: it is folded into the
 * JobExecution row and the owner notification.
 */
@Data
@Builder
public class WorkflowExecutionResult {
    private Long workflowId;
    private String workflowName;
    private int leadsDetected;
    private int leadsEnrolled;
    private int emailsSent;
    private int emailsFailed;
    private RunStatus status;
    private String errorMessage;
    private OffsetDateTime executedAt;
    private Duration duration;

    /**
     * enrolled / detected as a percentage, 0 when nothing was detected.
     */
    public double getEnrollmentRate() {
        if (leadsDetected == 0) {
            return 0.0;
        }
        return (double) leadsEnrolled / leadsDetected * 100.0;
    }

    public Long getDurationSeconds() {
        return duration != null ? Math.round(duration.toMillis() / 1000.0) : null;
    }
}
