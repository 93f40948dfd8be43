package com.leadflow.backend.scheduler;

import com.leadflow.backend.enums.RunStatus;
import com.leadflow.backend.models.automation.JobExecution;
import com.leadflow.backend.models.automation.ReengagementWorkflow;
import com.leadflow.backend.models.automation.ScheduledJob;
import com.leadflow.backend.repositories.automation.ReengagementWorkflowRepository;
import com.leadflow.backend.services.automation.WorkflowExecutor;
import com.leadflow.backend.support.InMemoryJobExecutionStore;
import com.leadflow.backend.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkflowSchedulerTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Mock
    private ReengagementWorkflowRepository workflowRepository;

    @Mock
    private WorkflowExecutor workflowExecutor;

    private InMemoryJobExecutionStore jobStore;
    private WorkflowScheduler scheduler;
    private ReengagementWorkflow workflow;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobExecutionStore();
        scheduler = new WorkflowScheduler(jobStore, workflowRepository, workflowExecutor,
                new SyncTaskExecutor(), TestFixtures.properties(), TestFixtures.fixedClock());
        workflow = ReengagementWorkflow.builder().id(11L).userId(1L).name("Win-back").inactivityDays(30).build();
    }

    private ScheduledJob job(String cron, boolean active) {
        return jobStore.saveJob(ScheduledJob.builder().workflowId(11L).cronExpression(cron).isActive(active).build());
    }

    @Test
    void tick_FiresMatchingJobOncePerMinute() {
        ScheduledJob job = job("0 9 * * *", true);
        when(workflowRepository.findById(11L)).thenReturn(Optional.of(workflow));

        int first = scheduler.tick(ZonedDateTime.of(2026, 3, 2, 9, 0, 1, 0, UTC));
        int again = scheduler.tick(ZonedDateTime.of(2026, 3, 2, 9, 0, 30, 0, UTC));
        int nextDay = scheduler.tick(ZonedDateTime.of(2026, 3, 3, 9, 0, 0, 0, UTC));

        assertThat(first).isEqualTo(1);
        assertThat(again).isZero();
        assertThat(nextDay).isEqualTo(1);
        verify(workflowExecutor, times(2)).execute(eq(workflow), argThat(j -> j.getId().equals(job.getId())),
                eq(JobExecution.Trigger.SCHEDULED));
    }

    @Test
    void tick_ForgetsJobsThatAreNoLongerActive() {
        ScheduledJob daily = job("0 9 * * *", true);
        job("0 */6 * * *", true);
        when(workflowRepository.findById(11L)).thenReturn(Optional.of(workflow));
        scheduler.tick(ZonedDateTime.of(2026, 3, 2, 0, 0, 0, 0, UTC));
        scheduler.tick(ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, UTC));
        assertThat(scheduler.trackedJobCount()).isEqualTo(2);
        assertThat(scheduler.cachedScheduleCount()).isEqualTo(2);

        daily.setIsActive(false);
        scheduler.tick(ZonedDateTime.of(2026, 3, 2, 9, 1, 0, 0, UTC));

        assertThat(scheduler.trackedJobCount()).isEqualTo(1);
        assertThat(scheduler.cachedScheduleCount()).isEqualTo(1);
    }

    @Test
    void tick_NonMatchingMinuteFiresNothing() {
        job("0 9 * * *", true);

        assertThat(scheduler.tick(ZonedDateTime.of(2026, 3, 2, 9, 1, 0, 0, UTC))).isZero();
        verifyNoInteractions(workflowExecutor);
    }

    @Test
    void tick_InactiveJobsAreIgnored() {
        job("* * * * *", false);

        assertThat(scheduler.tick(ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, UTC))).isZero();
    }

    @Test
    void tick_InvalidScheduleIsSkippedWithoutStoppingOthers() {
        job("not a cron", true);
        job("* * * * *", true);
        when(workflowRepository.findById(11L)).thenReturn(Optional.of(workflow));

        assertThat(scheduler.tick(ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, UTC))).isEqualTo(1);
    }

    @Test
    void tick_EvaluatesScheduleInGivenZone() {
        job("0 9 * * *", true);
        when(workflowRepository.findById(11L)).thenReturn(Optional.of(workflow));
        ZoneId newYork = ZoneId.of("America/New_York");

        assertThat(scheduler.tick(ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, UTC).withZoneSameInstant(newYork)))
                .isZero();
        assertThat(scheduler.tick(ZonedDateTime.of(2026, 3, 2, 9, 0, 0, 0, newYork))).isEqualTo(1);
    }

    @Test
    void runJob_MissingWorkflowIsSkipped() {
        ScheduledJob job = job("* * * * *", true);
        when(workflowRepository.findById(11L)).thenReturn(Optional.empty());

        scheduler.runJob(job);

        verifyNoInteractions(workflowExecutor);
    }

    @Test
    void runJob_ExecutorErrorIsContained() {
        ScheduledJob job = job("* * * * *", true);
        when(workflowRepository.findById(11L)).thenReturn(Optional.of(workflow));
        when(workflowExecutor.execute(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> scheduler.runJob(job)).doesNotThrowAnyException();
    }

    @Test
    void sweepStuckRuns_ReleasesOnlyAbandonedLocks() {
        ScheduledJob abandoned = job("0 9 * * *", true);
        abandoned.setRunInProgress(true);
        abandoned.setRunStartedAt(TestFixtures.NOW.minusMinutes(20));
        ScheduledJob running = jobStore.saveJob(ScheduledJob.builder()
                .workflowId(12L).cronExpression("0 9 * * *").runInProgress(true)
                .runStartedAt(TestFixtures.NOW.minusMinutes(5)).build());

        int swept = scheduler.sweepStuckRuns(TestFixtures.NOW);

        assertThat(swept).isEqualTo(1);
        assertThat(abandoned.getRunInProgress()).isFalse();
        assertThat(abandoned.getFailedExecutions()).isEqualTo(1L);
        assertThat(running.getRunInProgress()).isTrue();
        assertThat(jobStore.executions()).singleElement().satisfies(execution -> {
            assertThat(execution.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(execution.getErrorMessage()).startsWith("Run abandoned");
        });
    }
}
