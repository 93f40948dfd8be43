package com.leadflow.backend.services.sequence;

/**
 * Tally of one pass over due enrollments.
 */
public record StepOutcome(int sent, int failed, int completed, int canceled) {

    public static StepOutcome empty() {
        return new StepOutcome(0, 0, 0, 0);
    }

    public int attempted() {
        return sent + failed;
    }

    public boolean allFailed() {
        return failed > 0 && sent == 0;
    }
}
