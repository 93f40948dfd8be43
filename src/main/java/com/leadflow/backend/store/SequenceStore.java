package com.leadflow.backend.store;

import com.leadflow.backend.enums.SequenceTriggerType;
import com.leadflow.backend.models.sequence.EmailSequence;
import com.leadflow.backend.models.sequence.SequenceEnrollment;
import com.leadflow.backend.models.sequence.SequenceStep;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Sequences, their steps and enrollments.
 */
public interface SequenceStore {

    Optional<EmailSequence> findSequence(Long sequenceId);

    /**
     * Steps ordered by stepOrder.
     */
    List<SequenceStep> findSteps(Long sequenceId);

    List<EmailSequence> findActiveByTrigger(Long userId, SequenceTriggerType triggerType);

    boolean hasActiveEnrollment(Long leadId, Long sequenceId);

    /**
     * Inserts a new active enrollment. Returns empty when the lead already has an active
     * enrollment in that sequence, including when a concurrent insert won the race.
     */
    Optional<SequenceEnrollment> createEnrollment(SequenceEnrollment enrollment);

    Optional<SequenceEnrollment> findEnrollment(Long enrollmentId);

    List<SequenceEnrollment> findDueEnrollments(Long sequenceId, OffsetDateTime now);

    /**
     * Sequences holding due ACTIVE enrollments that no active workflow targets.
     */
    List<Long> findUnscheduledSequencesWithDueEnrollments(OffsetDateTime now);

    /**
     * Takes the current step of an enrollment for one sender by pushing nextStepDueAt to leaseUntil.
     * Succeeds only while the enrollment is ACTIVE, still at stepIndex and due at now, so at most one
     * concurrent caller wins a given step.
     */
    boolean claimStep(Long enrollmentId, int stepIndex, OffsetDateTime now, OffsetDateTime leaseUntil);

    SequenceEnrollment saveEnrollment(SequenceEnrollment enrollment);

    /**
     * Appends a step after the current last one. Existing steps are never modified.
     */
    SequenceStep appendStep(Long sequenceId, SequenceStep step);
}
