package com.leadflow.backend.util;

import java.util.Map;

/**
 * Human-readable labels for the schedules offered in the UI. Display only: scheduling
 * always goes through {@link CronSchedule}.
 */
public class CronDescriptions {

    private static final Map<String, String> KNOWN = Map.of(
            "0 9 * * *", "Daily at 9:00 AM",
            "0 */1 * * *", "Every hour",
            "0 * * * *", "Every hour",
            "0 */6 * * *", "Every 6 hours",
            "0 9 * * 1", "Weekly on Monday at 9:00 AM",
            "0 0 1 * *", "Monthly on 1st at midnight",
            "0 0 * * *", "Daily at midnight"
    );

    private CronDescriptions() {
    }

    public static String describe(String cronExpression) {
        if (cronExpression == null) {
            return null;
        }
        String normalized = cronExpression.trim().replaceAll("\\s+", " ");
        return KNOWN.getOrDefault(normalized, normalized);
    }
}
