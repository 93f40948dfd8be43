package com.leadflow.backend.services.tracking;

import com.leadflow.backend.dto.tracking.TimelineEventDto;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.models.tracking.EmailClick;
import com.leadflow.backend.models.tracking.EmailOpen;
import com.leadflow.backend.models.tracking.TrackedEmail;
import com.leadflow.backend.store.LeadStore;
import com.leadflow.backend.store.TrackingStore;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Merges sent emails, opens, clicks and the last status change of a lead, newest first.
 */
@Service
@RequiredArgsConstructor
public class EngagementTimelineService {

    private final LeadStore leadStore;
    private final TrackingStore trackingStore;

    public List<TimelineEventDto> getTimeline(Long leadId, Long userId) {
        Lead lead = leadStore.findById(leadId)
                .filter(l -> userId == null || userId.equals(l.getUserId()))
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));

        List<TrackedEmail> emails = trackingStore.findEmailsForLead(leadId);
        Map<Long, TrackedEmail> byId = emails.stream()
                .collect(Collectors.toMap(TrackedEmail::getId, Function.identity()));

        List<TimelineEventDto> events = new ArrayList<>();

        for (TrackedEmail email : emails) {
            if (email.isSent()) {
                events.add(TimelineEventDto.builder()
                        .type(TimelineEventDto.Type.EMAIL_SENT)
                        .occurredAt(email.getSentAt())
                        .trackedEmailId(email.getId())
                        .subject(email.getSubject())
                        .detail("Email sent: " + email.getSubject())
                        .build());
            }
        }

        for (EmailOpen open : trackingStore.findOpensForLead(leadId)) {
            String subject = subjectOf(byId, open.getTrackedEmailId());
            events.add(TimelineEventDto.builder()
                    .type(TimelineEventDto.Type.EMAIL_OPENED)
                    .occurredAt(open.getOpenedAt())
                    .trackedEmailId(open.getTrackedEmailId())
                    .subject(subject)
                    .detail("Email opened: " + subject)
                    .build());
        }

        for (EmailClick click : trackingStore.findClicksForLead(leadId)) {
            events.add(TimelineEventDto.builder()
                    .type(TimelineEventDto.Type.LINK_CLICKED)
                    .occurredAt(click.getClickedAt())
                    .trackedEmailId(click.getTrackedEmailId())
                    .subject(subjectOf(byId, click.getTrackedEmailId()))
                    .url(click.getOriginalUrl())
                    .detail("Link clicked: " + click.getOriginalUrl())
                    .build());
        }

        if (lead.getStatusChangedAt() != null) {
            events.add(TimelineEventDto.builder()
                    .type(TimelineEventDto.Type.STATUS_CHANGED)
                    .occurredAt(lead.getStatusChangedAt())
                    .detail("Status changed to " + lead.getStatus().getDisplayName())
                    .build());
        }

        events.sort(Comparator.comparing(TimelineEventDto::getOccurredAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return events;
    }

    private static String subjectOf(Map<Long, TrackedEmail> emails, Long trackedEmailId) {
        TrackedEmail email = emails.get(trackedEmailId);
        return email != null && email.getSubject() != null ? email.getSubject() : "Unknown";
    }
}
