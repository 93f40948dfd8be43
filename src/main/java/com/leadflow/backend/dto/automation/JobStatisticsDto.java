package com.leadflow.backend.dto.automation;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class JobStatisticsDto {
    private Long totalJobs;
    private Long activeJobs;
    private Long totalExecutions;
    private Long successfulExecutions;
    private Long failedExecutions;
    /**
     * Percentage with one decimal, 0 when nothing ran yet.
     */
    private Double successRate;
    /**
     * Integer percentage used by dashboards for progress bars.
     */
    private Integer progressWidth;
}
