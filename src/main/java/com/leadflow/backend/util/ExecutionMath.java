package com.leadflow.backend.util;

/**
 * Percentages shown on the job statistics surface.
 */
public class ExecutionMath {

    private ExecutionMath() {
    }

    /**
     * successful / total as a percentage rounded to one decimal, 0 when total is 0.
     */
    public static double successRate(long successful, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return Math.round((double) successful / total * 1000.0) / 10.0;
    }

    /**
     * Whole-number percentage used for progress bars, 0 when total is 0.
     */
    public static int progressWidth(long successful, long total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.round((double) successful / total * 100.0);
    }
}
