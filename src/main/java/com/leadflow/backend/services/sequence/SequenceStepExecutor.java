package com.leadflow.backend.services.sequence;

import com.leadflow.backend.exceptions.DispatchException;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.models.sequence.SequenceEnrollment;
import com.leadflow.backend.models.sequence.SequenceStep;
import com.leadflow.backend.services.tracking.EmailDispatcher;
import com.leadflow.backend.services.tracking.OutboundEmail;
import com.leadflow.backend.store.LeadStore;
import com.leadflow.backend.store.SequenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Advances enrollments through their sequence.
 *
 * An enrollment is due when {@code now >= nextStepDueAt}. A successful send moves it to the next
 * step (or completes it after the last one). A failed send leaves it active at the same step so the
 * next pass retries it.
 *
 * Each step is claimed before anything is sent. The claim pushes nextStepDueAt out by
 * {@link #CLAIM_LEASE}, so overlapping passes over the same enrollment (two workflows on one
 * sequence, the sweep, a body still running after its timeout) send a step at most once. A pass
 * that dies between claim and save leaves the step retryable once the lease runs out.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SequenceStepExecutor {

    private final SequenceStore sequenceStore;
    private final LeadStore leadStore;
    private final SequenceTemplateRenderer renderer;
    private final EmailDispatcher emailDispatcher;

    static final Duration CLAIM_LEASE = Duration.ofHours(1);

    enum Result {
        SENT, FAILED, COMPLETED, FINISHED, CANCELED, NOT_DUE
    }

    /**
     * Executes every due enrollment of one sequence. A failure on one enrollment never stops the others.
     */
    public StepOutcome processDueEnrollments(Long sequenceId, OffsetDateTime now) {
        List<SequenceEnrollment> due = sequenceStore.findDueEnrollments(sequenceId, now);
        if (due.isEmpty()) {
            return StepOutcome.empty();
        }

        List<SequenceStep> steps = sequenceStore.findSteps(sequenceId);
        log.debug("Processing {} due enrollments of sequence {} ({} steps)", due.size(), sequenceId, steps.size());

        int sent = 0;
        int failed = 0;
        int completed = 0;
        int canceled = 0;

        for (SequenceEnrollment enrollment : due) {
            Result result;
            try {
                result = executeStep(enrollment, steps, now);
            } catch (Exception e) {
                log.error("Unexpected error executing enrollment {}: {}", enrollment.getId(), e.getMessage(), e);
                result = Result.FAILED;
            }

            switch (result) {
                case SENT -> sent++;
                case FAILED -> failed++;
                case COMPLETED -> {
                    sent++;
                    completed++;
                }
                case FINISHED -> completed++;
                case CANCELED -> canceled++;
                case NOT_DUE -> {
                }
            }
        }

        log.info("Sequence {}: {} sent, {} failed, {} completed, {} canceled",
                sequenceId, sent, failed, completed, canceled);
        return new StepOutcome(sent, failed, completed, canceled);
    }

    /**
     * Runs the current step of one enrollment. COMPLETED means the last step was just sent,
     * FINISHED that there was nothing left to send.
     */
    Result executeStep(SequenceEnrollment enrollment, List<SequenceStep> steps, OffsetDateTime now) {
        if (!enrollment.isDue(now)) {
            return Result.NOT_DUE;
        }

        OffsetDateTime dueAt = enrollment.getNextStepDueAt();
        int index = enrollment.getCurrentStepIndex() != null ? enrollment.getCurrentStepIndex() : 0;
        if (!sequenceStore.claimStep(enrollment.getId(), index, now, now.plus(CLAIM_LEASE))) {
            log.debug("Step {} of enrollment {} already taken by another pass", index + 1, enrollment.getId());
            return Result.NOT_DUE;
        }

        Optional<Lead> leadOpt = leadStore.findById(enrollment.getLeadId());
        if (leadOpt.isEmpty()) {
            return cancel(enrollment, now, "Lead no longer exists");
        }
        Lead lead = leadOpt.get();
        if (lead.getStatus() != null && lead.getStatus().isClosed()) {
            return cancel(enrollment, now, "Lead is " + lead.getStatus().getDisplayName().toLowerCase());
        }
        if (!lead.hasContactEmail()) {
            return cancel(enrollment, now, "Lead has no contact email");
        }

        if (index >= steps.size()) {
            enrollment.markCompleted(now);
            sequenceStore.saveEnrollment(enrollment);
            log.info("Enrollment {} has no remaining steps, completed", enrollment.getId());
            return Result.FINISHED;
        }

        SequenceStep step = steps.get(index);
        try {
            emailDispatcher.dispatch(OutboundEmail.builder()
                    .userId(lead.getUserId())
                    .leadId(lead.getId())
                    .recipientEmail(lead.getContactEmail())
                    .sequenceId(enrollment.getSequenceId())
                    .sequenceStepId(step.getId())
                    .enrollmentId(enrollment.getId())
                    .templateId(step.getTemplateId())
                    .subject(renderer.render(step.getSubject(), lead))
                    .body(renderer.render(step.getBody(), lead))
                    .build());
        } catch (DispatchException e) {
            enrollment.setNextStepDueAt(dueAt);
            enrollment.recordFailure(e.getMessage());
            sequenceStore.saveEnrollment(enrollment);
            log.warn("Step {} of enrollment {} failed (attempt {}): {}",
                    index + 1, enrollment.getId(), enrollment.getFailedAttempts(), e.getMessage());
            return Result.FAILED;
        }

        if (index + 1 >= steps.size()) {
            enrollment.advanceTo(index + 1, now, null);
            enrollment.markCompleted(now);
            sequenceStore.saveEnrollment(enrollment);
            log.info("Enrollment {} completed after step {}", enrollment.getId(), index + 1);
            return Result.COMPLETED;
        }

        OffsetDateTime nextDue = now.plus(steps.get(index + 1).getDelay());
        enrollment.advanceTo(index + 1, now, nextDue);
        sequenceStore.saveEnrollment(enrollment);
        log.debug("Enrollment {} advanced to step {}, next due {}", enrollment.getId(), index + 2, nextDue);
        return Result.SENT;
    }

    private Result cancel(SequenceEnrollment enrollment, OffsetDateTime now, String reason) {
        enrollment.markCanceled(now, reason);
        sequenceStore.saveEnrollment(enrollment);
        log.info("Enrollment {} canceled: {}", enrollment.getId(), reason);
        return Result.CANCELED;
    }
}
