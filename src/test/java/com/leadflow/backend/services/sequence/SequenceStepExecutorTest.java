package com.leadflow.backend.services.sequence;

import com.leadflow.backend.enums.EnrollmentStatus;
import com.leadflow.backend.enums.LeadStatus;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.models.sequence.EmailSequence;
import com.leadflow.backend.models.sequence.SequenceEnrollment;
import com.leadflow.backend.models.sequence.SequenceStep;
import com.leadflow.backend.services.tracking.EmailDispatcher;
import com.leadflow.backend.services.tracking.TrackingLinkRewriter;
import com.leadflow.backend.services.tracking.TrackingTokenService;
import com.leadflow.backend.support.InMemoryLeadStore;
import com.leadflow.backend.support.InMemorySequenceStore;
import com.leadflow.backend.support.InMemoryTrackingStore;
import com.leadflow.backend.support.RecordingEmailSender;
import com.leadflow.backend.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.leadflow.backend.services.email.EmailSender;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class SequenceStepExecutorTest {

    private static final OffsetDateTime NOW = TestFixtures.NOW;

    private InMemorySequenceStore sequenceStore;
    private InMemoryLeadStore leadStore;
    private RecordingEmailSender emailSender;
    private SequenceStepExecutor executor;
    private EmailSequence sequence;
    private Lead lead;

    @BeforeEach
    void setUp() {
        sequenceStore = new InMemorySequenceStore();
        leadStore = new InMemoryLeadStore(sequenceStore);
        emailSender = new RecordingEmailSender();
        EmailDispatcher dispatcher = new EmailDispatcher(new InMemoryTrackingStore(), new TrackingTokenService(),
                new TrackingLinkRewriter(TestFixtures.properties()), emailSender, TestFixtures.fixedClock());
        executor = new SequenceStepExecutor(sequenceStore, leadStore, new SequenceTemplateRenderer("LeadFlow"), dispatcher);

        sequence = sequenceStore.addSequence(EmailSequence.builder().userId(1L).name("Win-back").build());
        sequenceStore.appendStep(sequence.getId(), SequenceStep.builder()
                .delayDays(0).subject("Hi {{firstName}}").body("<p>Still at {{companyName}}?</p>").build());
        sequenceStore.appendStep(sequence.getId(), SequenceStep.builder()
                .delayDays(3).subject("Last check, {{firstName}}").body("<p>Bye from {{senderName}}</p>").build());

        lead = leadStore.save(Lead.builder()
                .userId(1L)
                .companyName("Acme Corp")
                .contactName("Sam Lee")
                .contactEmail("sam@acme.example")
                .build());
    }

    private SequenceEnrollment enroll(Lead target, OffsetDateTime dueAt) {
        SequenceEnrollment enrollment = new SequenceEnrollment(target.getId(), sequence.getId(), dueAt);
        return sequenceStore.createEnrollment(enrollment).orElseThrow();
    }

    @Test
    void processDueEnrollments_SendsFirstStepAndSchedulesNext() {
        SequenceEnrollment enrollment = enroll(lead, NOW);

        StepOutcome outcome = executor.processDueEnrollments(sequence.getId(), NOW);

        assertThat(outcome).isEqualTo(new StepOutcome(1, 0, 0, 0));
        assertThat(enrollment.getCurrentStepIndex()).isEqualTo(1);
        assertThat(enrollment.getLastEmailSentAt()).isEqualTo(NOW);
        assertThat(enrollment.getNextStepDueAt()).isEqualTo(NOW.plusDays(3));
        assertThat(emailSender.sent()).singleElement()
                .satisfies(mail -> {
                    assertThat(mail.subject()).isEqualTo("Hi Sam");
                    assertThat(mail.html()).contains("Still at Acme Corp?");
                });
    }

    @Test
    void processDueEnrollments_NothingHappensBeforeNextStepIsDue() {
        enroll(lead, NOW);
        executor.processDueEnrollments(sequence.getId(), NOW);

        StepOutcome outcome = executor.processDueEnrollments(sequence.getId(), NOW.plusDays(2));

        assertThat(outcome).isEqualTo(StepOutcome.empty());
        assertThat(emailSender.sent()).hasSize(1);
    }

    @Test
    void processDueEnrollments_LastStepCompletesEnrollment() {
        SequenceEnrollment enrollment = enroll(lead, NOW);
        executor.processDueEnrollments(sequence.getId(), NOW);

        StepOutcome outcome = executor.processDueEnrollments(sequence.getId(), NOW.plusDays(3));

        assertThat(outcome).isEqualTo(new StepOutcome(1, 0, 1, 0));
        assertThat(enrollment.getStatus()).isEqualTo(EnrollmentStatus.COMPLETED);
        assertThat(enrollment.getActiveLock()).isNull();
        assertThat(enrollment.getNextStepDueAt()).isNull();
        assertThat(emailSender.sent().get(1).html()).contains("Bye from LeadFlow");
    }

    @Test
    void processDueEnrollments_FailedSendStaysOnSameStepAndRetries() {
        SequenceEnrollment enrollment = enroll(lead, NOW);
        emailSender.failFor("sam@acme.example");

        StepOutcome outcome = executor.processDueEnrollments(sequence.getId(), NOW);

        assertThat(outcome).isEqualTo(new StepOutcome(0, 1, 0, 0));
        assertThat(outcome.allFailed()).isTrue();
        assertThat(enrollment.isActive()).isTrue();
        assertThat(enrollment.getCurrentStepIndex()).isZero();
        assertThat(enrollment.getFailedAttempts()).isEqualTo(1);
        assertThat(enrollment.getLastError()).contains("Mailbox unavailable");

        StepOutcome retry = executor.processDueEnrollments(sequence.getId(), NOW.plusMinutes(5));
        assertThat(retry.failed()).isEqualTo(1);
        assertThat(enrollment.getFailedAttempts()).isEqualTo(2);
    }

    @Test
    void processDueEnrollments_OneFailureDoesNotStopOthers() {
        Lead other = leadStore.save(Lead.builder()
                .userId(1L).companyName("Globex").contactName("Kim").contactEmail("kim@globex.example").build());
        enroll(lead, NOW);
        enroll(other, NOW);
        emailSender.failFor("sam@acme.example");

        StepOutcome outcome = executor.processDueEnrollments(sequence.getId(), NOW);

        assertThat(outcome.sent()).isEqualTo(1);
        assertThat(outcome.failed()).isEqualTo(1);
        assertThat(outcome.allFailed()).isFalse();
    }

    @Test
    void processDueEnrollments_ClosedLeadIsCanceled() {
        lead.setStatus(LeadStatus.CONVERTED);
        SequenceEnrollment enrollment = enroll(lead, NOW);

        StepOutcome outcome = executor.processDueEnrollments(sequence.getId(), NOW);

        assertThat(outcome).isEqualTo(new StepOutcome(0, 0, 0, 1));
        assertThat(enrollment.getStatus()).isEqualTo(EnrollmentStatus.CANCELED);
        assertThat(enrollment.getCancelReason()).isEqualTo("Lead is converted");
        assertThat(emailSender.sent()).isEmpty();
    }

    @Test
    void processDueEnrollments_LeadWithoutEmailIsCanceledNotFailed() {
        lead.setContactEmail(null);
        SequenceEnrollment enrollment = enroll(lead, NOW);

        StepOutcome outcome = executor.processDueEnrollments(sequence.getId(), NOW);

        assertThat(outcome.failed()).isZero();
        assertThat(outcome.canceled()).isEqualTo(1);
        assertThat(enrollment.getCancelReason()).isEqualTo("Lead has no contact email");
    }

    @Test
    void executeStep_PastLastStep_FinishesWithoutSending() {
        SequenceEnrollment enrollment = enroll(lead, NOW);
        enrollment.setCurrentStepIndex(2);

        SequenceStepExecutor.Result result = executor.executeStep(enrollment,
                sequenceStore.findSteps(sequence.getId()), NOW);

        assertThat(result).isEqualTo(SequenceStepExecutor.Result.FINISHED);
        assertThat(enrollment.getStatus()).isEqualTo(EnrollmentStatus.COMPLETED);
        assertThat(emailSender.sent()).isEmpty();
    }

    @Test
    void executeStep_NotDue_ReturnsNotDue() {
        SequenceEnrollment enrollment = enroll(lead, NOW.plusHours(1));

        SequenceStepExecutor.Result result = executor.executeStep(enrollment,
                sequenceStore.findSteps(sequence.getId()), NOW);

        assertThat(result).isEqualTo(SequenceStepExecutor.Result.NOT_DUE);
    }

    @Test
    void processDueEnrollments_OverlappingPassesSendStepOnce() throws Exception {
        SequenceEnrollment enrollment = enroll(lead, NOW);
        BlockingEmailSender blockingSender = new BlockingEmailSender();
        EmailDispatcher dispatcher = new EmailDispatcher(new InMemoryTrackingStore(), new TrackingTokenService(),
                new TrackingLinkRewriter(TestFixtures.properties()), blockingSender, TestFixtures.fixedClock());
        SequenceStepExecutor blockingExecutor = new SequenceStepExecutor(sequenceStore, leadStore,
                new SequenceTemplateRenderer("LeadFlow"), dispatcher);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<StepOutcome> first = pool.submit(() -> blockingExecutor.processDueEnrollments(sequence.getId(), NOW));
            assertThat(blockingSender.entered.await(5, TimeUnit.SECONDS)).isTrue();

            StepOutcome second = blockingExecutor.processDueEnrollments(sequence.getId(), NOW);
            blockingSender.release.countDown();

            assertThat(second.sent()).isZero();
            assertThat(first.get(5, TimeUnit.SECONDS).sent()).isEqualTo(1);
        } finally {
            blockingSender.release.countDown();
            pool.shutdownNow();
        }

        assertThat(blockingSender.recipients).containsExactly("sam@acme.example");
        assertThat(enrollment.getCurrentStepIndex()).isEqualTo(1);
        assertThat(enrollment.getNextStepDueAt()).isEqualTo(NOW.plusDays(3));
    }

    @Test
    void executeStep_StaleCopyOfClaimedStep_ReturnsNotDueWithoutSending() {
        SequenceEnrollment stored = enroll(lead, NOW);
        SequenceEnrollment staleCopy = new SequenceEnrollment(lead.getId(), sequence.getId(), NOW);
        staleCopy.setId(stored.getId());
        assertThat(sequenceStore.claimStep(stored.getId(), 0, NOW, NOW.plusHours(1))).isTrue();

        SequenceStepExecutor.Result result = executor.executeStep(staleCopy,
                sequenceStore.findSteps(sequence.getId()), NOW);

        assertThat(result).isEqualTo(SequenceStepExecutor.Result.NOT_DUE);
        assertThat(emailSender.sent()).isEmpty();
        assertThat(stored.getCurrentStepIndex()).isZero();
    }

    @Test
    void executeStep_FailedSendReleasesClaim() {
        SequenceEnrollment enrollment = enroll(lead, NOW);
        emailSender.failFor("sam@acme.example");

        SequenceStepExecutor.Result result = executor.executeStep(enrollment,
                sequenceStore.findSteps(sequence.getId()), NOW);

        assertThat(result).isEqualTo(SequenceStepExecutor.Result.FAILED);
        assertThat(enrollment.getNextStepDueAt()).isEqualTo(NOW);
        assertThat(sequenceStore.findDueEnrollments(sequence.getId(), NOW)).containsExactly(enrollment);
    }

    /**
     * Holds the first send until released so a second pass can run in between.
     */
    private static class BlockingEmailSender implements EmailSender {

        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final List<String> recipients = new CopyOnWriteArrayList<>();

        @Override
        public SendResult send(String to, String subject, String htmlBody) {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            recipients.add(to);
            return SendResult.sent("msg-" + recipients.size());
        }
    }
}
