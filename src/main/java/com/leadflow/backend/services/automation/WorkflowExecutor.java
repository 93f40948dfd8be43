package com.leadflow.backend.services.automation;

import com.leadflow.backend.config.EngagementProperties;
import com.leadflow.backend.dto.automation.WorkflowExecutionResult;
import com.leadflow.backend.enums.RunStatus;
import com.leadflow.backend.exceptions.DetectionException;
import com.leadflow.backend.models.automation.JobExecution;
import com.leadflow.backend.models.automation.ReengagementWorkflow;
import com.leadflow.backend.models.automation.ScheduledJob;
import com.leadflow.backend.repositories.automation.ReengagementWorkflowRepository;
import com.leadflow.backend.services.notification.NotificationDispatcher;
import com.leadflow.backend.services.sequence.SequenceStepExecutor;
import com.leadflow.backend.services.sequence.StepOutcome;
import com.leadflow.backend.store.JobExecutionStore;
import com.leadflow.backend.store.SequenceStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one workflow: detection, then every due enrollment of the target sequence, then
 * bookkeeping and owner notification.
 *
 * A run only starts after taking the job's advisory lock, and the lock is always released,
 * including when the run exceeds its wall-clock budget.
 */
@Service
@Slf4j
public class WorkflowExecutor {

    private final ReengagementDetector detector;
    private final SequenceStepExecutor stepExecutor;
    private final SequenceStore sequenceStore;
    private final JobExecutionStore jobExecutionStore;
    private final ReengagementWorkflowRepository workflowRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final MeterRegistry meterRegistry;
    private final AsyncTaskExecutor workExecutor;
    private final EngagementProperties properties;
    private final Clock clock;

    public WorkflowExecutor(ReengagementDetector detector,
                            SequenceStepExecutor stepExecutor,
                            SequenceStore sequenceStore,
                            JobExecutionStore jobExecutionStore,
                            ReengagementWorkflowRepository workflowRepository,
                            NotificationDispatcher notificationDispatcher,
                            MeterRegistry meterRegistry,
                            @Qualifier("workflowWorkExecutor") AsyncTaskExecutor workExecutor,
                            EngagementProperties properties,
                            Clock clock) {
        this.detector = detector;
        this.stepExecutor = stepExecutor;
        this.sequenceStore = sequenceStore;
        this.jobExecutionStore = jobExecutionStore;
        this.workflowRepository = workflowRepository;
        this.notificationDispatcher = notificationDispatcher;
        this.meterRegistry = meterRegistry;
        this.workExecutor = workExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Tally of the run body, before classification.
     */
    record RunTally(DetectionResult detection, StepOutcome steps) {
    }

    /**
     * @return the run result, or empty when another run of the same job holds the lock
     */
    public Optional<WorkflowExecutionResult> execute(ReengagementWorkflow workflow,
                                                     ScheduledJob job,
                                                     JobExecution.Trigger trigger) {
        OffsetDateTime startedAt = OffsetDateTime.now(clock);
        Duration timeout = properties.scheduler().runTimeout();
        OffsetDateTime staleBefore = startedAt.minus(timeout).minus(properties.scheduler().lockGrace());

        if (!jobExecutionStore.tryAcquireRunLock(job.getId(), startedAt, staleBefore)) {
            log.info("Workflow {} is already running, skipping {} run", workflow.getId(), trigger);
            return Optional.empty();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        WorkflowExecutionResult result;
        try {
            result = runLocked(workflow, startedAt, timeout);
            recordExecution(job, workflow, trigger, result, startedAt);
            workflow.setLastRunAt(startedAt);
            workflowRepository.save(workflow);
        } catch (Exception e) {
            log.error("Bookkeeping failed for workflow {}: {}", workflow.getId(), e.getMessage(), e);
            result = failed(workflow, startedAt, "Execution bookkeeping failed: " + e.getMessage());
        } finally {
            releaseLock(job);
        }

        sample.stop(Timer.builder("engagement.workflow.duration")
                .description("Time taken by one workflow run")
                .tag("status", result.getStatus().getCode())
                .register(meterRegistry));
        Counter.builder("engagement.workflow.runs")
                .description("Number of workflow runs")
                .tag("status", result.getStatus().getCode())
                .tag("trigger", trigger.name().toLowerCase())
                .register(meterRegistry)
                .increment();

        notificationDispatcher.dispatch(workflow, result);
        return Optional.of(result);
    }

    private WorkflowExecutionResult runLocked(ReengagementWorkflow workflow, OffsetDateTime startedAt, Duration timeout) {
        if (!workflow.isEnabled()) {
            return failed(workflow, startedAt, "Workflow is not active");
        }
        if (sequenceStore.findSequence(workflow.getSequenceId()).isEmpty()) {
            return failed(workflow, startedAt, "Target sequence " + workflow.getSequenceId() + " not found");
        }

        Future<RunTally> future = workExecutor.submit(() -> runBody(workflow, startedAt));
        try {
            RunTally tally = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return classify(workflow, startedAt, tally);

        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Workflow {} exceeded its run budget of {}", workflow.getId(), timeout);
            return failed(workflow, startedAt, "Run timed out after " + timeout.toSeconds() + "s");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DetectionException) {
                log.error("Detection failed for workflow {}: {}", workflow.getId(), cause.getMessage());
            } else {
                log.error("Workflow {} run failed: {}", workflow.getId(), cause.getMessage(), cause);
            }
            return failed(workflow, startedAt, cause.getMessage());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(workflow, startedAt, "Run interrupted");
        }
    }

    /**
     * Detection happens-before the due scan, so leads enrolled by this run fire their first
     * step in the same run.
     */
    RunTally runBody(ReengagementWorkflow workflow, OffsetDateTime now) {
        DetectionResult detection = detector.detect(workflow, now);
        StepOutcome steps = stepExecutor.processDueEnrollments(workflow.getSequenceId(), now);
        return new RunTally(detection, steps);
    }

    WorkflowExecutionResult classify(ReengagementWorkflow workflow, OffsetDateTime startedAt, RunTally tally) {
        DetectionResult detection = tally.detection();
        StepOutcome steps = tally.steps();

        RunStatus status;
        String error = null;
        if (steps.allFailed()) {
            status = RunStatus.FAILED;
            error = "All " + steps.failed() + " email dispatches failed";
        } else if (steps.failed() > 0 || detection.lostRaces()) {
            status = RunStatus.PARTIAL;
            if (steps.failed() > 0) {
                error = steps.failed() + " of " + steps.attempted() + " email dispatches failed";
            } else {
                error = (detection.detected() - detection.enrolled()) + " detected leads were not enrolled";
            }
        } else {
            status = RunStatus.SUCCESS;
        }

        return WorkflowExecutionResult.builder()
                .workflowId(workflow.getId())
                .workflowName(workflow.getName())
                .leadsDetected(detection.detected())
                .leadsEnrolled(detection.enrolled())
                .emailsSent(steps.sent())
                .emailsFailed(steps.failed())
                .status(status)
                .errorMessage(error)
                .executedAt(startedAt)
                .duration(Duration.between(startedAt, OffsetDateTime.now(clock)))
                .build();
    }

    private WorkflowExecutionResult failed(ReengagementWorkflow workflow, OffsetDateTime startedAt, String error) {
        return WorkflowExecutionResult.builder()
                .workflowId(workflow.getId())
                .workflowName(workflow.getName())
                .status(RunStatus.FAILED)
                .errorMessage(error)
                .executedAt(startedAt)
                .duration(Duration.between(startedAt, OffsetDateTime.now(clock)))
                .build();
    }

    private void recordExecution(ScheduledJob job, ReengagementWorkflow workflow, JobExecution.Trigger trigger,
                                 WorkflowExecutionResult result, OffsetDateTime startedAt) {
        OffsetDateTime completedAt = OffsetDateTime.now(clock);
        jobExecutionStore.recordExecution(JobExecution.builder()
                .jobId(job.getId())
                .workflowId(workflow.getId())
                .status(result.getStatus())
                .trigger(trigger)
                .leadsDetected(result.getLeadsDetected())
                .leadsEnrolled(result.getLeadsEnrolled())
                .emailsSent(result.getEmailsSent())
                .emailsFailed(result.getEmailsFailed())
                .errorMessage(result.getErrorMessage())
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationMs(Duration.between(startedAt, completedAt).toMillis())
                .build());

        log.info("Workflow '{}' run {}: detected={}, enrolled={}, sent={}, failed={}",
                workflow.getName(), result.getStatus().getCode(), result.getLeadsDetected(),
                result.getLeadsEnrolled(), result.getEmailsSent(), result.getEmailsFailed());
    }

    private void releaseLock(ScheduledJob job) {
        try {
            jobExecutionStore.releaseRunLock(job.getId());
        } catch (Exception e) {
            log.error("Failed to release run lock of job {}: {}", job.getId(), e.getMessage(), e);
        }
    }
}
