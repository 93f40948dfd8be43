package com.leadflow.backend.scheduler;

import com.leadflow.backend.models.Lead;
import com.leadflow.backend.models.sequence.EmailSequence;
import com.leadflow.backend.models.sequence.SequenceEnrollment;
import com.leadflow.backend.models.sequence.SequenceStep;
import com.leadflow.backend.services.sequence.SequenceStepExecutor;
import com.leadflow.backend.services.sequence.SequenceTemplateRenderer;
import com.leadflow.backend.services.sequence.StepOutcome;
import com.leadflow.backend.services.tracking.EmailDispatcher;
import com.leadflow.backend.services.tracking.TrackingLinkRewriter;
import com.leadflow.backend.services.tracking.TrackingTokenService;
import com.leadflow.backend.store.SequenceStore;
import com.leadflow.backend.support.InMemoryLeadStore;
import com.leadflow.backend.support.InMemorySequenceStore;
import com.leadflow.backend.support.InMemoryTrackingStore;
import com.leadflow.backend.support.RecordingEmailSender;
import com.leadflow.backend.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SequenceSweepSchedulerTest {

    private static final OffsetDateTime NOW = TestFixtures.NOW;

    private InMemorySequenceStore sequenceStore;
    private InMemoryLeadStore leadStore;
    private RecordingEmailSender emailSender;
    private SequenceSweepScheduler scheduler;

    @BeforeEach
    void setUp() {
        sequenceStore = new InMemorySequenceStore();
        leadStore = new InMemoryLeadStore(sequenceStore);
        emailSender = new RecordingEmailSender();
        EmailDispatcher dispatcher = new EmailDispatcher(new InMemoryTrackingStore(), new TrackingTokenService(),
                new TrackingLinkRewriter(TestFixtures.properties()), emailSender, TestFixtures.fixedClock());
        SequenceStepExecutor stepExecutor = new SequenceStepExecutor(sequenceStore, leadStore,
                new SequenceTemplateRenderer("LeadFlow"), dispatcher);
        scheduler = new SequenceSweepScheduler(sequenceStore, stepExecutor, TestFixtures.properties(),
                TestFixtures.fixedClock());
    }

    private EmailSequence sequenceWithOneStep(String name) {
        EmailSequence sequence = sequenceStore.addSequence(EmailSequence.builder().userId(1L).name(name).build());
        sequenceStore.appendStep(sequence.getId(), SequenceStep.builder()
                .delayDays(0).subject("Welcome {{firstName}}").body("<p>Hello</p>").build());
        return sequence;
    }

    private void enroll(EmailSequence sequence, String contactEmail) {
        Lead lead = leadStore.save(Lead.builder()
                .userId(1L)
                .companyName("Acme Corp")
                .contactName("Sam Lee")
                .contactEmail(contactEmail)
                .build());
        sequenceStore.createEnrollment(new SequenceEnrollment(lead.getId(), sequence.getId(), NOW)).orElseThrow();
    }

    @Test
    void sweep_AdvancesSequencesWithoutActiveWorkflow() {
        EmailSequence manual = sequenceWithOneStep("Manual follow-up");
        enroll(manual, "sam@acme.example");

        int sent = scheduler.sweep(NOW);

        assertThat(sent).isEqualTo(1);
        assertThat(emailSender.sent()).singleElement()
                .satisfies(mail -> assertThat(mail.to()).isEqualTo("sam@acme.example"));
    }

    @Test
    void sweep_LeavesWorkflowDrivenSequencesToTheirWorkflow() {
        EmailSequence winBack = sequenceWithOneStep("Win-back");
        sequenceStore.targetedByWorkflow(winBack.getId());
        enroll(winBack, "kim@globex.example");

        assertThat(scheduler.sweep(NOW)).isZero();
        assertThat(emailSender.sent()).isEmpty();
    }

    @Test
    void sweep_FailureInOneSequenceDoesNotStopOthers() {
        SequenceStore store = mock(SequenceStore.class);
        SequenceStepExecutor stepExecutor = mock(SequenceStepExecutor.class);
        when(store.findUnscheduledSequencesWithDueEnrollments(NOW)).thenReturn(List.of(1L, 2L));
        when(stepExecutor.processDueEnrollments(eq(1L), any())).thenThrow(new IllegalStateException("db down"));
        when(stepExecutor.processDueEnrollments(eq(2L), any())).thenReturn(new StepOutcome(3, 0, 0, 0));

        SequenceSweepScheduler isolated = new SequenceSweepScheduler(store, stepExecutor,
                TestFixtures.properties(), TestFixtures.fixedClock());

        assertThat(isolated.sweep(NOW)).isEqualTo(3);
        verify(stepExecutor).processDueEnrollments(2L, NOW);
    }
}
