package com.leadflow.backend.store.jpa;

import com.leadflow.backend.enums.RunStatus;
import com.leadflow.backend.models.automation.JobExecution;
import com.leadflow.backend.models.automation.ScheduledJob;
import com.leadflow.backend.repositories.automation.JobExecutionRepository;
import com.leadflow.backend.repositories.automation.ScheduledJobRepository;
import com.leadflow.backend.store.JobExecutionStore;
import com.leadflow.backend.store.JobStatistics;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional
public class JpaJobExecutionStore implements JobExecutionStore {

    private final ScheduledJobRepository jobRepository;
    private final JobExecutionRepository executionRepository;

    @Override
    public ScheduledJob saveJob(ScheduledJob job) {
        return jobRepository.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledJob> findJob(Long jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    public boolean updateSchedule(Long workflowId, String cronExpression, boolean active) {
        return jobRepository.updateSchedule(workflowId, cronExpression, active) > 0;
    }

    @Override
    public void setJobActive(Long workflowId, boolean active) {
        jobRepository.updateActive(workflowId, active);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledJob> findJobByWorkflowId(Long workflowId) {
        return jobRepository.findByWorkflowId(workflowId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledJob> findActiveJobs() {
        return jobRepository.findByIsActiveTrue();
    }

    @Override
    public void deleteJob(Long jobId) {
        jobRepository.deleteById(jobId);
    }

    @Override
    public boolean tryAcquireRunLock(Long jobId, OffsetDateTime now, OffsetDateTime staleBefore) {
        return jobRepository.tryAcquireRunLock(jobId, now, staleBefore) == 1;
    }

    @Override
    public void releaseRunLock(Long jobId) {
        jobRepository.releaseRunLock(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledJob> findJobsLockedBefore(OffsetDateTime before) {
        return jobRepository.findByRunInProgressTrueAndRunStartedAtBefore(before);
    }

    @Override
    public JobExecution recordExecution(JobExecution execution) {
        RunStatus status = execution.getStatus();
        int updated = jobRepository.recordOutcome(execution.getJobId(), status,
                status == RunStatus.SUCCESS ? 1 : 0,
                status == RunStatus.FAILED ? 1 : 0,
                status == RunStatus.PARTIAL ? 1 : 0,
                execution.getStartedAt());
        ScheduledJob job = jobRepository.findById(execution.getJobId())
                .filter(found -> updated == 1)
                .orElseThrow(() -> new EntityNotFoundException("Scheduled job not found: " + execution.getJobId()));

        execution.setTotalExecutions(job.getTotalExecutions());
        execution.setSuccessfulExecutions(job.getSuccessfulExecutions());
        execution.setFailedExecutions(job.getFailedExecutions());
        return executionRepository.save(execution);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobExecution> findExecutions(Long jobId, int limit) {
        return executionRepository.findByJobIdOrderByStartedAtDesc(jobId, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    @Transactional(readOnly = true)
    public JobStatistics statistics() {
        return new JobStatistics(
                jobRepository.count(),
                jobRepository.countByIsActiveTrue(),
                jobRepository.sumTotalExecutions(),
                jobRepository.sumSuccessfulExecutions(),
                jobRepository.sumFailedExecutions());
    }
}
