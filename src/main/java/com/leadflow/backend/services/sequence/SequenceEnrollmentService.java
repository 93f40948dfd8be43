package com.leadflow.backend.services.sequence;

import com.leadflow.backend.dto.sequence.AppendStepRequest;
import com.leadflow.backend.enums.EnrollmentStatus;
import com.leadflow.backend.enums.LeadStatus;
import com.leadflow.backend.enums.SequenceTriggerType;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.models.sequence.EmailSequence;
import com.leadflow.backend.models.sequence.SequenceEnrollment;
import com.leadflow.backend.models.sequence.SequenceStep;
import com.leadflow.backend.store.LeadStore;
import com.leadflow.backend.store.SequenceStore;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Operator and status-driven enrollment operations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SequenceEnrollmentService {

    private final SequenceStore sequenceStore;
    private final LeadStore leadStore;
    private final Clock clock;

    /**
     * Enrolls a lead by hand. The first step becomes due after its own delay.
     *
     * @throws IllegalStateException when the lead already has an active enrollment in the sequence
     */
    public SequenceEnrollment manualEnroll(Long sequenceId, Long leadId, Long userId) {
        EmailSequence sequence = getOwnedSequence(sequenceId, userId);
        Lead lead = getOwnedLead(leadId, userId);

        if (lead.getStatus() != null && lead.getStatus().isClosed()) {
            throw new IllegalStateException("Cannot enroll a " + lead.getStatus().getDisplayName().toLowerCase() + " lead");
        }

        return enroll(sequence, lead, SequenceTriggerType.MANUAL, OffsetDateTime.now(clock))
                .orElseThrow(() -> new IllegalStateException(
                        "Lead " + leadId + " already has an active enrollment in sequence " + sequenceId));
    }

    public SequenceEnrollment cancel(Long enrollmentId, Long userId, String reason) {
        SequenceEnrollment enrollment = sequenceStore.findEnrollment(enrollmentId)
                .orElseThrow(() -> new EntityNotFoundException("Enrollment not found: " + enrollmentId));
        getOwnedSequence(enrollment.getSequenceId(), userId);

        if (enrollment.getStatus() != EnrollmentStatus.ACTIVE) {
            log.debug("Enrollment {} already {}", enrollmentId, enrollment.getStatus());
            return enrollment;
        }

        enrollment.markCanceled(OffsetDateTime.now(clock), reason != null ? reason : "Canceled by user");
        log.info("Enrollment {} canceled by user {}", enrollmentId, userId);
        return sequenceStore.saveEnrollment(enrollment);
    }

    public SequenceStep appendStep(Long sequenceId, Long userId, AppendStepRequest request) {
        getOwnedSequence(sequenceId, userId);

        SequenceStep step = SequenceStep.builder()
                .delayDays(request.getDelayDays() != null ? request.getDelayDays() : 0)
                .delayHours(request.getDelayHours() != null ? request.getDelayHours() : 0)
                .templateId(request.getTemplateId())
                .subject(request.getSubject())
                .body(request.getBody())
                .build();

        SequenceStep saved = sequenceStore.appendStep(sequenceId, step);
        log.info("Appended step {} to sequence {}", saved.getStepOrder(), sequenceId);
        return saved;
    }

    /**
     * Enrolls the lead into every active STATUS_CHANGE sequence of its owner whose condition
     * matches the new status. Returns the enrollments created.
     */
    public List<SequenceEnrollment> enrollOnStatusChange(Lead lead, LeadStatus newStatus) {
        List<SequenceEnrollment> created = new ArrayList<>();
        if (newStatus.isClosed()) {
            return created;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        for (EmailSequence sequence : sequenceStore.findActiveByTrigger(lead.getUserId(), SequenceTriggerType.STATUS_CHANGE)) {
            boolean matches = sequence.getTriggerCondition() == null
                    || sequence.getTriggerCondition().matchesStatus(newStatus);
            if (!matches) {
                continue;
            }
            enroll(sequence, lead, SequenceTriggerType.STATUS_CHANGE, now).ifPresent(e -> {
                created.add(e);
                log.info("Lead {} enrolled in sequence {} on status {}", lead.getId(), sequence.getId(), newStatus);
            });
        }
        return created;
    }

    private Optional<SequenceEnrollment> enroll(EmailSequence sequence, Lead lead,
                                                SequenceTriggerType source, OffsetDateTime now) {
        if (sequenceStore.hasActiveEnrollment(lead.getId(), sequence.getId())) {
            return Optional.empty();
        }

        List<SequenceStep> steps = sequenceStore.findSteps(sequence.getId());
        SequenceEnrollment enrollment = new SequenceEnrollment(lead.getId(), sequence.getId(), now);
        enrollment.setSource(source);
        if (!steps.isEmpty()) {
            enrollment.setNextStepDueAt(now.plus(steps.get(0).getDelay()));
        }
        return sequenceStore.createEnrollment(enrollment);
    }

    private EmailSequence getOwnedSequence(Long sequenceId, Long userId) {
        return sequenceStore.findSequence(sequenceId)
                .filter(s -> userId == null || userId.equals(s.getUserId()))
                .orElseThrow(() -> new EntityNotFoundException("Sequence not found: " + sequenceId));
    }

    private Lead getOwnedLead(Long leadId, Long userId) {
        return leadStore.findById(leadId)
                .filter(l -> userId == null || userId.equals(l.getUserId()))
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));
    }
}
