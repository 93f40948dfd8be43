package com.leadflow.backend.services.automation;

import com.leadflow.backend.dto.automation.JobExecutionDto;
import com.leadflow.backend.dto.automation.JobStatisticsDto;
import com.leadflow.backend.store.JobExecutionStore;
import com.leadflow.backend.store.JobStatistics;
import com.leadflow.backend.util.ExecutionMath;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only job statistics for the admin surface.
 */
@Service
@RequiredArgsConstructor
public class JobStatisticsService {

    private final JobExecutionStore jobExecutionStore;

    public JobStatisticsDto getStatistics() {
        JobStatistics stats = jobExecutionStore.statistics();
        return JobStatisticsDto.builder()
                .totalJobs(stats.totalJobs())
                .activeJobs(stats.activeJobs())
                .totalExecutions(stats.totalExecutions())
                .successfulExecutions(stats.successfulExecutions())
                .failedExecutions(stats.failedExecutions())
                .successRate(ExecutionMath.successRate(stats.successfulExecutions(), stats.totalExecutions()))
                .progressWidth(ExecutionMath.progressWidth(stats.successfulExecutions(), stats.totalExecutions()))
                .build();
    }

    public List<JobExecutionDto> getExecutions(Long jobId, int limit) {
        jobExecutionStore.findJob(jobId)
                .orElseThrow(() -> new EntityNotFoundException("Scheduled job not found: " + jobId));
        return jobExecutionStore.findExecutions(jobId, limit).stream()
                .map(JobExecutionDto::fromEntity)
                .collect(Collectors.toList());
    }
}
