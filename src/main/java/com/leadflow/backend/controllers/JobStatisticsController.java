package com.leadflow.backend.controllers;

import com.leadflow.backend.dto.automation.JobExecutionDto;
import com.leadflow.backend.dto.automation.JobStatisticsDto;
import com.leadflow.backend.services.automation.JobStatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Admin view over scheduled job counters and execution history
 */
@RestController
@RequestMapping("/api/v1/admin/jobs")
@RequiredArgsConstructor
public class JobStatisticsController {

    private final JobStatisticsService jobStatisticsService;

    @GetMapping("/stats")
    public JobStatisticsDto getStatistics() {
        return jobStatisticsService.getStatistics();
    }

    @GetMapping("/{jobId}/executions")
    public List<JobExecutionDto> getExecutions(@PathVariable Long jobId,
                                               @RequestParam(defaultValue = "20") int limit) {
        return jobStatisticsService.getExecutions(jobId, Math.max(1, Math.min(limit, 100)));
    }
}
