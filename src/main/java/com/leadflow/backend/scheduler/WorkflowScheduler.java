package com.leadflow.backend.scheduler;

import com.leadflow.backend.config.EngagementProperties;
import com.leadflow.backend.enums.RunStatus;
import com.leadflow.backend.exceptions.InvalidCronExpressionException;
import com.leadflow.backend.models.automation.JobExecution;
import com.leadflow.backend.models.automation.ReengagementWorkflow;
import com.leadflow.backend.models.automation.ScheduledJob;
import com.leadflow.backend.repositories.automation.ReengagementWorkflowRepository;
import com.leadflow.backend.services.automation.WorkflowExecutor;
import com.leadflow.backend.store.JobExecutionStore;
import com.leadflow.backend.util.CronSchedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Minute tick for re-engagement workflows.
 *
 * Every minute the active jobs are matched against their cron schedule in the configured
 * zone, and matching jobs are handed to the run pool. A job fires at most once per minute.
 */
@Component
@Slf4j
public class WorkflowScheduler {

    private final JobExecutionStore jobExecutionStore;
    private final ReengagementWorkflowRepository workflowRepository;
    private final WorkflowExecutor workflowExecutor;
    private final TaskExecutor runExecutor;
    private final EngagementProperties properties;
    private final Clock clock;

    // Parsed schedules keyed by expression
    private final Map<String, CronSchedule> schedules = new ConcurrentHashMap<>();

    // Last minute each job was fired for
    private final Map<Long, ZonedDateTime> lastFired = new ConcurrentHashMap<>();

    public WorkflowScheduler(JobExecutionStore jobExecutionStore,
                             ReengagementWorkflowRepository workflowRepository,
                             WorkflowExecutor workflowExecutor,
                             @Qualifier("workflowRunExecutor") TaskExecutor runExecutor,
                             EngagementProperties properties,
                             Clock clock) {
        this.jobExecutionStore = jobExecutionStore;
        this.workflowRepository = workflowRepository;
        this.workflowExecutor = workflowExecutor;
        this.runExecutor = runExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "0 * * * * *")
    public void tick() {
        if (!properties.scheduler().enabled()) {
            return;
        }
        int fired = tick(ZonedDateTime.now(clock.withZone(properties.scheduler().zoneId())));
        if (fired > 0) {
            log.info("Scheduler tick fired {} workflow run(s)", fired);
        }
    }

    /**
     * Fires every active job whose schedule matches the minute of {@code now}.
     *
     * @return number of runs handed to the run pool
     */
    public int tick(ZonedDateTime now) {
        ZonedDateTime minute = now.truncatedTo(ChronoUnit.MINUTES);
        List<ScheduledJob> jobs;
        try {
            jobs = jobExecutionStore.findActiveJobs();
        } catch (Exception e) {
            log.error("Failed to load active jobs: {}", e.getMessage(), e);
            return 0;
        }
        forgetRemovedJobs(jobs);

        int fired = 0;
        for (ScheduledJob job : jobs) {
            CronSchedule schedule = scheduleFor(job);
            if (schedule == null || !schedule.matches(minute)) {
                continue;
            }
            ZonedDateTime previous = lastFired.put(job.getId(), minute);
            if (minute.equals(previous)) {
                continue;
            }
            try {
                runExecutor.execute(() -> runJob(job));
                fired++;
            } catch (TaskRejectedException e) {
                lastFired.remove(job.getId(), minute);
                log.warn("Run pool rejected job {}: {}", job.getId(), e.getMessage());
            }
        }
        return fired;
    }

    void runJob(ScheduledJob job) {
        try {
            ReengagementWorkflow workflow = workflowRepository.findById(job.getWorkflowId()).orElse(null);
            if (workflow == null) {
                log.warn("Job {} points at missing workflow {}, skipping", job.getId(), job.getWorkflowId());
                return;
            }
            workflowExecutor.execute(workflow, job, JobExecution.Trigger.SCHEDULED);
        } catch (Exception e) {
            log.error("Scheduled run of job {} failed: {}", job.getId(), e.getMessage(), e);
        }
    }

    /**
     * Releases locks left behind by runs that can no longer be alive, and records them as failed.
     */
    @Scheduled(fixedRate = 300000, initialDelay = 60000)
    public void sweepStuckRuns() {
        if (!properties.scheduler().enabled()) {
            return;
        }
        sweepStuckRuns(OffsetDateTime.now(clock));
    }

    public int sweepStuckRuns(OffsetDateTime now) {
        Duration timeout = properties.scheduler().runTimeout();
        OffsetDateTime before = now.minus(timeout).minus(properties.scheduler().lockGrace());

        int swept = 0;
        for (ScheduledJob job : jobExecutionStore.findJobsLockedBefore(before)) {
            try {
                OffsetDateTime startedAt = job.getRunStartedAt() != null ? job.getRunStartedAt() : before;
                jobExecutionStore.recordExecution(JobExecution.builder()
                        .jobId(job.getId())
                        .workflowId(job.getWorkflowId())
                        .status(RunStatus.FAILED)
                        .trigger(JobExecution.Trigger.SCHEDULED)
                        .errorMessage("Run abandoned: lock held since " + startedAt)
                        .startedAt(startedAt)
                        .completedAt(now)
                        .durationMs(Duration.between(startedAt, now).toMillis())
                        .build());
                jobExecutionStore.releaseRunLock(job.getId());
                swept++;
                log.warn("Released stuck run lock of job {} (held since {})", job.getId(), startedAt);
            } catch (Exception e) {
                log.error("Failed to sweep stuck job {}: {}", job.getId(), e.getMessage(), e);
            }
        }
        return swept;
    }

    // Paused, deleted or rescheduled jobs drop out of both maps
    private void forgetRemovedJobs(List<ScheduledJob> activeJobs) {
        Set<Long> activeIds = activeJobs.stream().map(ScheduledJob::getId).collect(Collectors.toSet());
        Set<String> activeExpressions = activeJobs.stream().map(ScheduledJob::getCronExpression)
                .filter(Objects::nonNull).collect(Collectors.toSet());
        lastFired.keySet().retainAll(activeIds);
        schedules.keySet().retainAll(activeExpressions);
    }

    int trackedJobCount() {
        return lastFired.size();
    }

    int cachedScheduleCount() {
        return schedules.size();
    }

    private CronSchedule scheduleFor(ScheduledJob job) {
        try {
            return schedules.computeIfAbsent(job.getCronExpression(), CronSchedule::parse);
        } catch (InvalidCronExpressionException e) {
            log.warn("Job {} has an invalid schedule '{}': {}", job.getId(), job.getCronExpression(), e.getMessage());
            return null;
        }
    }
}
