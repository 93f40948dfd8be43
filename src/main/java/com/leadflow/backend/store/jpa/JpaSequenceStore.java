package com.leadflow.backend.store.jpa;

import com.leadflow.backend.enums.EnrollmentStatus;
import com.leadflow.backend.enums.SequenceTriggerType;
import com.leadflow.backend.models.sequence.EmailSequence;
import com.leadflow.backend.models.sequence.SequenceEnrollment;
import com.leadflow.backend.models.sequence.SequenceStep;
import com.leadflow.backend.repositories.sequence.EmailSequenceRepository;
import com.leadflow.backend.repositories.sequence.SequenceEnrollmentRepository;
import com.leadflow.backend.repositories.sequence.SequenceStepRepository;
import com.leadflow.backend.store.SequenceStore;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional
@Slf4j
public class JpaSequenceStore implements SequenceStore {

    private final EmailSequenceRepository sequenceRepository;
    private final SequenceStepRepository stepRepository;
    private final SequenceEnrollmentRepository enrollmentRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<EmailSequence> findSequence(Long sequenceId) {
        return sequenceRepository.findById(sequenceId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SequenceStep> findSteps(Long sequenceId) {
        return stepRepository.findBySequenceIdOrderByStepOrderAsc(sequenceId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<EmailSequence> findActiveByTrigger(Long userId, SequenceTriggerType triggerType) {
        return sequenceRepository.findByUserIdAndTriggerTypeAndIsActiveTrue(userId, triggerType);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasActiveEnrollment(Long leadId, Long sequenceId) {
        return enrollmentRepository.existsByLeadIdAndSequenceIdAndStatus(leadId, sequenceId, EnrollmentStatus.ACTIVE);
    }

    /**
     * Runs outside any caller transaction so the unique-constraint violation of a lost race
     * rolls back only this insert.
     */
    @Override
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Optional<SequenceEnrollment> createEnrollment(SequenceEnrollment enrollment) {
        try {
            return Optional.of(enrollmentRepository.saveAndFlush(enrollment));
        } catch (DataIntegrityViolationException e) {
            log.info("Lead {} already has an active enrollment in sequence {}",
                    enrollment.getLeadId(), enrollment.getSequenceId());
            return Optional.empty();
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SequenceEnrollment> findEnrollment(Long enrollmentId) {
        return enrollmentRepository.findById(enrollmentId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SequenceEnrollment> findDueEnrollments(Long sequenceId, OffsetDateTime now) {
        return enrollmentRepository.findDue(sequenceId, EnrollmentStatus.ACTIVE, now);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> findUnscheduledSequencesWithDueEnrollments(OffsetDateTime now) {
        return enrollmentRepository.findUnscheduledSequencesWithDue(EnrollmentStatus.ACTIVE, now);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean claimStep(Long enrollmentId, int stepIndex, OffsetDateTime now, OffsetDateTime leaseUntil) {
        return enrollmentRepository.claimStep(enrollmentId, EnrollmentStatus.ACTIVE, stepIndex, now, leaseUntil) == 1;
    }

    @Override
    public SequenceEnrollment saveEnrollment(SequenceEnrollment enrollment) {
        return enrollmentRepository.save(enrollment);
    }

    @Override
    public SequenceStep appendStep(Long sequenceId, SequenceStep step) {
        EmailSequence sequence = sequenceRepository.findById(sequenceId)
                .orElseThrow(() -> new EntityNotFoundException("Sequence not found: " + sequenceId));

        int nextOrder = stepRepository.findMaxStepOrder(sequenceId) + 1;
        step.setId(null);
        step.setSequence(sequence);
        step.setStepOrder(nextOrder);
        return stepRepository.save(step);
    }
}
