package com.leadflow.backend.dto.automation;

import com.leadflow.backend.models.automation.JobExecution;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class JobExecutionDto {
    private Long id;
    private Long jobId;
    private Long workflowId;
    private String status;
    private String trigger;
    private Long totalExecutions;
    private Long successfulExecutions;
    private Long failedExecutions;
    private Integer leadsDetected;
    private Integer leadsEnrolled;
    private Integer emailsSent;
    private Integer emailsFailed;
    private String errorMessage;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private Long durationMs;

    public static JobExecutionDto fromEntity(JobExecution execution) {
        return JobExecutionDto.builder()
                .id(execution.getId())
                .jobId(execution.getJobId())
                .workflowId(execution.getWorkflowId())
                .status(execution.getStatus().getCode())
                .trigger(execution.getTrigger().name())
                .totalExecutions(execution.getTotalExecutions())
                .successfulExecutions(execution.getSuccessfulExecutions())
                .failedExecutions(execution.getFailedExecutions())
                .leadsDetected(execution.getLeadsDetected())
                .leadsEnrolled(execution.getLeadsEnrolled())
                .emailsSent(execution.getEmailsSent())
                .emailsFailed(execution.getEmailsFailed())
                .errorMessage(execution.getErrorMessage())
                .startedAt(execution.getStartedAt())
                .completedAt(execution.getCompletedAt())
                .durationMs(execution.getDurationMs())
                .build();
    }
}
