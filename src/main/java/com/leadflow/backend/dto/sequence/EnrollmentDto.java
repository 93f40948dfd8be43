package com.leadflow.backend.dto.sequence;

import com.leadflow.backend.models.sequence.SequenceEnrollment;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class EnrollmentDto {
    private Long id;
    private Long leadId;
    private Long sequenceId;
    private Long workflowId;
    private String status;
    private Integer currentStepIndex;
    private OffsetDateTime enrolledAt;
    private OffsetDateTime nextStepDueAt;
    private OffsetDateTime lastEmailSentAt;
    private OffsetDateTime completedAt;
    private Integer failedAttempts;
    private String lastError;
    private String cancelReason;

    public static EnrollmentDto fromEntity(SequenceEnrollment enrollment) {
        return EnrollmentDto.builder()
                .id(enrollment.getId())
                .leadId(enrollment.getLeadId())
                .sequenceId(enrollment.getSequenceId())
                .workflowId(enrollment.getWorkflowId())
                .status(enrollment.getStatus().name())
                .currentStepIndex(enrollment.getCurrentStepIndex())
                .enrolledAt(enrollment.getEnrolledAt())
                .nextStepDueAt(enrollment.getNextStepDueAt())
                .lastEmailSentAt(enrollment.getLastEmailSentAt())
                .completedAt(enrollment.getCompletedAt())
                .failedAttempts(enrollment.getFailedAttempts())
                .lastError(enrollment.getLastError())
                .cancelReason(enrollment.getCancelReason())
                .build();
    }
}
