package com.leadflow.backend.services.sequence;

import com.leadflow.backend.enums.LeadStatus;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.store.LeadStore;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Lead status transitions. A transition counts as engagement and may start STATUS_CHANGE sequences.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeadStatusService {

    private final LeadStore leadStore;
    private final SequenceEnrollmentService enrollmentService;
    private final Clock clock;

    public Lead changeStatus(Long leadId, Long userId, LeadStatus newStatus) {
        Lead lead = leadStore.findById(leadId)
                .filter(l -> userId == null || userId.equals(l.getUserId()))
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));

        if (lead.getStatus() == newStatus) {
            log.debug("Lead {} already {}", leadId, newStatus);
            return lead;
        }

        LeadStatus previous = lead.getStatus();
        OffsetDateTime now = OffsetDateTime.now(clock);
        leadStore.updateStatus(leadId, newStatus, now);
        lead.setStatus(newStatus);
        lead.setStatusChangedAt(now);
        lead.touchEngagement(now);

        log.info("Lead {} status {} -> {}", leadId, previous, newStatus);

        try {
            enrollmentService.enrollOnStatusChange(lead, newStatus);
        } catch (Exception e) {
            log.error("Status-change enrollment failed for lead {}: {}", leadId, e.getMessage(), e);
        }
        return lead;
    }
}
