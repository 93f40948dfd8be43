package com.leadflow.backend.models.sequence;

import com.leadflow.backend.enums.EnrollmentStatus;
import com.leadflow.backend.enums.SequenceTriggerType;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * A lead's progress through one sequence.
 *
 * activeLock is TRUE while the enrollment is ACTIVE and NULL afterwards, so the unique
 * constraint on (lead_id, sequence_id, active_lock) allows any number of finished
 * enrollments but only one active one per lead and sequence.
 */
@Entity
@Table(name = "sequence_enrollments",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_enrollment_active",
                        columnNames = {"lead_id", "sequence_id", "active_lock"})
        },
        indexes = {
                @Index(name = "idx_enrollment_due", columnList = "sequence_id, status, next_step_due_at")
        })
public class SequenceEnrollment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "lead_id", nullable = false)
    private Long leadId;

    @NotNull
    @Column(name = "sequence_id", nullable = false)
    private Long sequenceId;

    @Column(name = "workflow_id")
    private Long workflowId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", length = 30)
    private SequenceTriggerType source;

    /**
     * 0-based index of the next step to send.
     */
    @Min(0)
    @Column(name = "current_step_index", nullable = false)
    private Integer currentStepIndex = 0;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EnrollmentStatus status = EnrollmentStatus.ACTIVE;

    @Column(name = "active_lock")
    private Boolean activeLock = Boolean.TRUE;

    @Column(name = "enrolled_at", nullable = false)
    private OffsetDateTime enrolledAt;

    @Column(name = "next_step_due_at")
    private OffsetDateTime nextStepDueAt;

    @Column(name = "last_email_sent_at")
    private OffsetDateTime lastEmailSentAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "failed_attempts", nullable = false)
    private Integer failedAttempts = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "cancel_reason")
    private String cancelReason;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    // Constructors
    public SequenceEnrollment() {}

    public SequenceEnrollment(Long leadId, Long sequenceId, OffsetDateTime enrolledAt) {
        this.leadId = leadId;
        this.sequenceId = sequenceId;
        this.enrolledAt = enrolledAt;
        this.nextStepDueAt = enrolledAt;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getLeadId() {
        return leadId;
    }

    public void setLeadId(Long leadId) {
        this.leadId = leadId;
    }

    public Long getSequenceId() {
        return sequenceId;
    }

    public void setSequenceId(Long sequenceId) {
        this.sequenceId = sequenceId;
    }

    public Long getWorkflowId() {
        return workflowId;
    }

    public void setWorkflowId(Long workflowId) {
        this.workflowId = workflowId;
    }

    public SequenceTriggerType getSource() {
        return source;
    }

    public void setSource(SequenceTriggerType source) {
        this.source = source;
    }

    public Integer getCurrentStepIndex() {
        return currentStepIndex;
    }

    public void setCurrentStepIndex(Integer currentStepIndex) {
        this.currentStepIndex = currentStepIndex;
    }

    public EnrollmentStatus getStatus() {
        return status;
    }

    public void setStatus(EnrollmentStatus status) {
        this.status = status;
        this.activeLock = status.isActive() ? Boolean.TRUE : null;
    }

    public Boolean getActiveLock() {
        return activeLock;
    }

    public OffsetDateTime getEnrolledAt() {
        return enrolledAt;
    }

    public void setEnrolledAt(OffsetDateTime enrolledAt) {
        this.enrolledAt = enrolledAt;
    }

    public OffsetDateTime getNextStepDueAt() {
        return nextStepDueAt;
    }

    public void setNextStepDueAt(OffsetDateTime nextStepDueAt) {
        this.nextStepDueAt = nextStepDueAt;
    }

    public OffsetDateTime getLastEmailSentAt() {
        return lastEmailSentAt;
    }

    public void setLastEmailSentAt(OffsetDateTime lastEmailSentAt) {
        this.lastEmailSentAt = lastEmailSentAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public Integer getFailedAttempts() {
        return failedAttempts;
    }

    public void setFailedAttempts(Integer failedAttempts) {
        this.failedAttempts = failedAttempts;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public String getCancelReason() {
        return cancelReason;
    }

    public void setCancelReason(String cancelReason) {
        this.cancelReason = cancelReason;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    // Helper methods
    public boolean isActive() {
        return status.isActive();
    }

    public boolean isDue(OffsetDateTime now) {
        return isActive() && nextStepDueAt != null && !now.isBefore(nextStepDueAt);
    }

    public void advanceTo(int nextIndex, OffsetDateTime sentAt, OffsetDateTime nextDueAt) {
        this.currentStepIndex = nextIndex;
        this.lastEmailSentAt = sentAt;
        this.nextStepDueAt = nextDueAt;
        this.lastError = null;
    }

    public void markCompleted(OffsetDateTime at) {
        setStatus(EnrollmentStatus.COMPLETED);
        this.completedAt = at;
        this.nextStepDueAt = null;
    }

    public void markCanceled(OffsetDateTime at, String reason) {
        setStatus(EnrollmentStatus.CANCELED);
        this.completedAt = at;
        this.nextStepDueAt = null;
        this.cancelReason = reason;
    }

    public void recordFailure(String error) {
        this.failedAttempts = (failedAttempts != null ? failedAttempts : 0) + 1;
        this.lastError = error;
    }

    @Override
    public String toString() {
        return "SequenceEnrollment{" +
                "id=" + id +
                ", leadId=" + leadId +
                ", sequenceId=" + sequenceId +
                ", currentStepIndex=" + currentStepIndex +
                ", status=" + status +
                ", nextStepDueAt=" + nextStepDueAt +
                '}';
    }
}
