package com.leadflow.backend.dto.automation;

import com.leadflow.backend.models.automation.NotificationPreferences;
import com.leadflow.backend.models.automation.ReengagementWorkflow;
import com.leadflow.backend.models.automation.ScheduledJob;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class WorkflowDto {
    private Long id;
    private String name;
    private String description;
    private Integer inactivityDays;
    private Long sequenceId;
    private Boolean isActive;
    private OffsetDateTime lastRunAt;
    private String ownerEmail;
    private String ownerName;
    private NotificationPreferences notificationPreferences;
    private Long jobId;
    private String cronExpression;
    private String scheduleDescription;
    private Long totalExecutions;
    private Long successfulExecutions;
    private Long failedExecutions;
    private String lastStatus;
    private OffsetDateTime createdAt;

    public static WorkflowDto from(ReengagementWorkflow workflow, ScheduledJob job, String scheduleDescription) {
        WorkflowDtoBuilder builder = WorkflowDto.builder()
                .id(workflow.getId())
                .name(workflow.getName())
                .description(workflow.getDescription())
                .inactivityDays(workflow.getInactivityDays())
                .sequenceId(workflow.getSequenceId())
                .isActive(workflow.getIsActive())
                .lastRunAt(workflow.getLastRunAt())
                .ownerEmail(workflow.getOwnerEmail())
                .ownerName(workflow.getOwnerName())
                .notificationPreferences(workflow.preferencesOrDefault())
                .createdAt(workflow.getCreatedAt());

        if (job != null) {
            builder.jobId(job.getId())
                    .cronExpression(job.getCronExpression())
                    .scheduleDescription(scheduleDescription)
                    .totalExecutions(job.getTotalExecutions())
                    .successfulExecutions(job.getSuccessfulExecutions())
                    .failedExecutions(job.getFailedExecutions())
                    .lastStatus(job.getLastStatus() != null ? job.getLastStatus().getCode() : null);
        }
        return builder.build();
    }
}
