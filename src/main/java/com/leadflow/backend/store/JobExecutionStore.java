package com.leadflow.backend.store;

import com.leadflow.backend.models.automation.JobExecution;
import com.leadflow.backend.models.automation.ScheduledJob;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Scheduled jobs, their advisory run lock and the append-only execution log.
 */
public interface JobExecutionStore {

    ScheduledJob saveJob(ScheduledJob job);

    Optional<ScheduledJob> findJob(Long jobId);

    /**
     * Rewrites the schedule columns of the workflow's job, leaving counters and the run lock alone.
     * Returns false when the workflow has no job.
     */
    boolean updateSchedule(Long workflowId, String cronExpression, boolean active);

    void setJobActive(Long workflowId, boolean active);

    Optional<ScheduledJob> findJobByWorkflowId(Long workflowId);

    List<ScheduledJob> findActiveJobs();

    void deleteJob(Long jobId);

    /**
     * Atomically takes the run lock. A lock taken before staleBefore is considered abandoned
     * and may be taken over. Returns true when the caller owns the lock.
     */
    boolean tryAcquireRunLock(Long jobId, OffsetDateTime now, OffsetDateTime staleBefore);

    void releaseRunLock(Long jobId);

    List<ScheduledJob> findJobsLockedBefore(OffsetDateTime before);

    /**
     * Increments the job's cumulative counters for the execution's status and appends the
     * execution with a snapshot of the updated counters, in one transaction.
     */
    JobExecution recordExecution(JobExecution execution);

    List<JobExecution> findExecutions(Long jobId, int limit);

    JobStatistics statistics();
}
