package com.leadflow.backend.support;

import com.leadflow.backend.models.automation.JobExecution;
import com.leadflow.backend.models.automation.ScheduledJob;
import com.leadflow.backend.store.JobExecutionStore;
import com.leadflow.backend.store.JobStatistics;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryJobExecutionStore implements JobExecutionStore {

    private final Map<Long, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final List<JobExecution> executions = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong(1);

    public synchronized List<JobExecution> executions() {
        return new ArrayList<>(executions);
    }

    @Override
    public ScheduledJob saveJob(ScheduledJob job) {
        if (job.getId() == null) {
            job.setId(ids.getAndIncrement());
        }
        jobs.put(job.getId(), job);
        return job;
    }

    @Override
    public Optional<ScheduledJob> findJob(Long jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized boolean updateSchedule(Long workflowId, String cronExpression, boolean active) {
        Optional<ScheduledJob> job = findJobByWorkflowId(workflowId);
        job.ifPresent(j -> {
            j.setCronExpression(cronExpression);
            j.setIsActive(active);
        });
        return job.isPresent();
    }

    @Override
    public synchronized void setJobActive(Long workflowId, boolean active) {
        findJobByWorkflowId(workflowId).ifPresent(j -> j.setIsActive(active));
    }

    @Override
    public Optional<ScheduledJob> findJobByWorkflowId(Long workflowId) {
        return jobs.values().stream().filter(j -> workflowId.equals(j.getWorkflowId())).findFirst();
    }

    @Override
    public List<ScheduledJob> findActiveJobs() {
        return jobs.values().stream().filter(ScheduledJob::isEnabled).collect(Collectors.toList());
    }

    @Override
    public void deleteJob(Long jobId) {
        jobs.remove(jobId);
    }

    @Override
    public synchronized boolean tryAcquireRunLock(Long jobId, OffsetDateTime now, OffsetDateTime staleBefore) {
        ScheduledJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        boolean free = !Boolean.TRUE.equals(job.getRunInProgress())
                || (job.getRunStartedAt() != null && job.getRunStartedAt().isBefore(staleBefore));
        if (free) {
            job.setRunInProgress(true);
            job.setRunStartedAt(now);
        }
        return free;
    }

    @Override
    public synchronized void releaseRunLock(Long jobId) {
        ScheduledJob job = jobs.get(jobId);
        if (job != null) {
            job.setRunInProgress(false);
            job.setRunStartedAt(null);
        }
    }

    @Override
    public List<ScheduledJob> findJobsLockedBefore(OffsetDateTime before) {
        return jobs.values().stream()
                .filter(j -> Boolean.TRUE.equals(j.getRunInProgress()))
                .filter(j -> j.getRunStartedAt() != null && j.getRunStartedAt().isBefore(before))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized JobExecution recordExecution(JobExecution execution) {
        ScheduledJob job = jobs.get(execution.getJobId());
        if (job == null) {
            throw new IllegalArgumentException("Scheduled job not found: " + execution.getJobId());
        }
        job.recordOutcome(execution.getStatus(), execution.getStartedAt());
        execution.setId(ids.getAndIncrement());
        execution.setTotalExecutions(job.getTotalExecutions());
        execution.setSuccessfulExecutions(job.getSuccessfulExecutions());
        execution.setFailedExecutions(job.getFailedExecutions());
        executions.add(execution);
        return execution;
    }

    @Override
    public synchronized List<JobExecution> findExecutions(Long jobId, int limit) {
        return executions.stream()
                .filter(e -> jobId.equals(e.getJobId()))
                .sorted(Comparator.comparing(JobExecution::getStartedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public JobStatistics statistics() {
        long active = jobs.values().stream().filter(ScheduledJob::isEnabled).count();
        return new JobStatistics(jobs.size(), active,
                jobs.values().stream().mapToLong(ScheduledJob::getTotalExecutions).sum(),
                jobs.values().stream().mapToLong(ScheduledJob::getSuccessfulExecutions).sum(),
                jobs.values().stream().mapToLong(ScheduledJob::getFailedExecutions).sum());
    }
}
