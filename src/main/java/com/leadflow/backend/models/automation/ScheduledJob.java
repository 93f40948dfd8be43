package com.leadflow.backend.models.automation;

import com.leadflow.backend.enums.RunStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * Cron schedule and cumulative run counters for one workflow.
 * Counters are only ever incremented. runInProgress is the per-job advisory lock.
 */
@Entity
@Table(name = "scheduled_jobs", uniqueConstraints = {
        @UniqueConstraint(name = "uk_scheduled_jobs_workflow", columnNames = "workflow_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false)
    private Long workflowId;

    @NotBlank
    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "total_executions", nullable = false)
    @Builder.Default
    private Long totalExecutions = 0L;

    @Column(name = "successful_executions", nullable = false)
    @Builder.Default
    private Long successfulExecutions = 0L;

    @Column(name = "failed_executions", nullable = false)
    @Builder.Default
    private Long failedExecutions = 0L;

    @Column(name = "partial_executions", nullable = false)
    @Builder.Default
    private Long partialExecutions = 0L;

    @Column(name = "last_run_at")
    private OffsetDateTime lastRunAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_status", length = 20)
    private RunStatus lastStatus;

    @Column(name = "run_in_progress", nullable = false)
    @Builder.Default
    private Boolean runInProgress = false;

    @Column(name = "run_started_at")
    private OffsetDateTime runStartedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isEnabled() {
        return Boolean.TRUE.equals(isActive);
    }

    public void recordOutcome(RunStatus status, OffsetDateTime at) {
        totalExecutions = totalExecutions + 1;
        switch (status) {
            case SUCCESS -> successfulExecutions = successfulExecutions + 1;
            case FAILED -> failedExecutions = failedExecutions + 1;
            case PARTIAL -> partialExecutions = partialExecutions + 1;
        }
        lastRunAt = at;
        lastStatus = status;
    }
}
