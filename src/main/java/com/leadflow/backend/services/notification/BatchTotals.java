package com.leadflow.backend.services.notification;

import com.leadflow.backend.dto.automation.WorkflowExecutionResult;

import java.util.List;

/**
 * Aggregate of a batch of runs. successful + failed + partial always equals workflows.
 */
public record BatchTotals(int workflows,
                          int successful,
                          int failed,
                          int partial,
                          long leadsDetected,
                          long leadsEnrolled) {

    public static BatchTotals of(List<WorkflowExecutionResult> results) {
        int successful = 0;
        int failed = 0;
        int partial = 0;
        long detected = 0;
        long enrolled = 0;

        for (WorkflowExecutionResult result : results) {
            switch (result.getStatus()) {
                case SUCCESS -> successful++;
                case FAILED -> failed++;
                case PARTIAL -> partial++;
            }
            detected += result.getLeadsDetected();
            enrolled += result.getLeadsEnrolled();
        }
        return new BatchTotals(results.size(), successful, failed, partial, detected, enrolled);
    }
}
