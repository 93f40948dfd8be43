package com.leadflow.backend.store;

/**
 * Distinct engagement signals for one lead: emails opened at least once,
 * and distinct (email, url) pairs clicked.
 */
public record EngagementCounts(long openedEmails, long distinctClicks) {

    public static EngagementCounts none() {
        return new EngagementCounts(0, 0);
    }
}
