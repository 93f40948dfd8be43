package com.leadflow.backend.store;

import com.leadflow.backend.enums.LeadStatus;
import com.leadflow.backend.models.Lead;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Lead persistence used by the engagement engine.
 */
public interface LeadStore {

    Optional<Lead> findById(Long leadId);

    /**
     * Open leads of the owner whose last engagement is missing or older than the cutoff,
     * excluding leads with an active enrollment in excludeSequenceId.
     */
    List<Lead> findInactiveLeads(Long userId, OffsetDateTime cutoff, Long excludeSequenceId);

    /**
     * Writes the status and its change time, and records the change as engagement.
     * Other lead columns are left untouched.
     */
    void updateStatus(Long leadId, LeadStatus status, OffsetDateTime at);

    void updateScore(Long leadId, int score, OffsetDateTime at);

    /**
     * Moves lastEngagementAt forward to {@code at}; never moves it back.
     */
    void recordEngagement(Long leadId, OffsetDateTime at);
}
