package com.leadflow.backend.services.scoring;

import java.util.List;

/**
 * Outcome of scoring one lead. Each factor is already clamped to its own range.
 */
public record ScoreResult(int score,
                          Priority priority,
                          int companySize,
                          int contactCompleteness,
                          int dataQuality,
                          int engagement,
                          List<String> strengths,
                          List<String> improvements,
                          String explanation) {

    public enum Priority {
        HIGH, MEDIUM, LOW;

        static Priority of(int score) {
            if (score >= 70) {
                return HIGH;
            }
            return score >= 40 ? MEDIUM : LOW;
        }
    }
}
