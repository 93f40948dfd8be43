package com.leadflow.backend.store;

/**
 * Raw aggregate of all scheduled jobs' cumulative counters.
 */
public record JobStatistics(long totalJobs,
                            long activeJobs,
                            long totalExecutions,
                            long successfulExecutions,
                            long failedExecutions) {
}
