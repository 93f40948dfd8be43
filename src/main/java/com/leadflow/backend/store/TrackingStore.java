package com.leadflow.backend.store;

import com.leadflow.backend.models.tracking.EmailClick;
import com.leadflow.backend.models.tracking.EmailOpen;
import com.leadflow.backend.models.tracking.TrackedEmail;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Tracked emails and their open/click events.
 */
public interface TrackingStore {

    TrackedEmail saveTrackedEmail(TrackedEmail email);

    Optional<TrackedEmail> findByToken(String trackingToken);

    /**
     * Bumps open counters on the tracked email. Called for every open, first or not.
     */
    void incrementOpenCount(Long trackedEmailId, OffsetDateTime at);

    void incrementClickCount(Long trackedEmailId);

    /**
     * Stores the first open of a token. Returns false when the token was already opened.
     */
    boolean recordFirstOpen(EmailOpen open);

    /**
     * Stores a click once per (token, url hash). Returns false for a replay.
     */
    boolean recordClick(EmailClick click);

    EngagementCounts countEngagement(Long leadId);

    List<TrackedEmail> findEmailsForLead(Long leadId);

    List<EmailOpen> findOpensForLead(Long leadId);

    List<EmailClick> findClicksForLead(Long leadId);
}
