package com.leadflow.backend.models.automation;

import com.leadflow.backend.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * Append-only record of one run. The execution counters are a snapshot of the
 * job's cumulative counters right after this run was counted.
 */
@Entity
@Table(name = "job_executions", indexes = {
        @Index(name = "idx_job_executions_job_started", columnList = "job_id, started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Column(name = "workflow_id", nullable = false)
    private Long workflowId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RunStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_trigger", nullable = false, length = 20)
    @Builder.Default
    private Trigger trigger = Trigger.SCHEDULED;

    @Column(name = "total_executions", nullable = false)
    private Long totalExecutions;

    @Column(name = "successful_executions", nullable = false)
    private Long successfulExecutions;

    @Column(name = "failed_executions", nullable = false)
    private Long failedExecutions;

    @Column(name = "leads_detected", nullable = false)
    @Builder.Default
    private Integer leadsDetected = 0;

    @Column(name = "leads_enrolled", nullable = false)
    @Builder.Default
    private Integer leadsEnrolled = 0;

    @Column(name = "emails_sent", nullable = false)
    @Builder.Default
    private Integer emailsSent = 0;

    @Column(name = "emails_failed", nullable = false)
    @Builder.Default
    private Integer emailsFailed = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    public enum Trigger {
        SCHEDULED, MANUAL
    }
}
