package com.leadflow.backend.services.tracking;

import com.leadflow.backend.dto.tracking.TimelineEventDto;
import com.leadflow.backend.enums.LeadStatus;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.models.tracking.EmailClick;
import com.leadflow.backend.models.tracking.EmailOpen;
import com.leadflow.backend.models.tracking.TrackedEmail;
import com.leadflow.backend.support.InMemoryLeadStore;
import com.leadflow.backend.support.InMemorySequenceStore;
import com.leadflow.backend.support.InMemoryTrackingStore;
import com.leadflow.backend.support.TestFixtures;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EngagementTimelineServiceTest {

    private InMemoryLeadStore leadStore;
    private InMemoryTrackingStore trackingStore;
    private EngagementTimelineService service;
    private Lead lead;

    @BeforeEach
    void setUp() {
        leadStore = new InMemoryLeadStore(new InMemorySequenceStore());
        trackingStore = new InMemoryTrackingStore();
        service = new EngagementTimelineService(leadStore, trackingStore);

        lead = leadStore.save(Lead.builder()
                .userId(1L)
                .companyName("Acme Corp")
                .status(LeadStatus.QUALIFIED)
                .statusChangedAt(TestFixtures.NOW.minusDays(1))
                .build());
    }

    @Test
    void getTimeline_MergesEventsNewestFirst() {
        OffsetDateTime sentAt = TestFixtures.NOW.minusDays(5);
        TrackedEmail sent = trackedEmail("Quick question", "tok-1");
        sent.markSent("msg-1", sentAt);
        trackingStore.saveTrackedEmail(sent);
        trackingStore.saveTrackedEmail(trackedEmail("Never delivered", "tok-2"));

        trackingStore.recordFirstOpen(EmailOpen.builder()
                .trackedEmailId(sent.getId())
                .leadId(lead.getId())
                .trackingToken("tok-1")
                .openedAt(sentAt.plusHours(2))
                .build());
        trackingStore.recordClick(EmailClick.builder()
                .trackedEmailId(sent.getId())
                .leadId(lead.getId())
                .trackingToken("tok-1")
                .originalUrl("https://acme.example/pricing")
                .urlHash("h1")
                .clickedAt(sentAt.plusHours(3))
                .build());

        List<TimelineEventDto> timeline = service.getTimeline(lead.getId(), 1L);

        assertThat(timeline).extracting(TimelineEventDto::getType).containsExactly(
                TimelineEventDto.Type.STATUS_CHANGED,
                TimelineEventDto.Type.LINK_CLICKED,
                TimelineEventDto.Type.EMAIL_OPENED,
                TimelineEventDto.Type.EMAIL_SENT);
        assertThat(timeline.get(0).getDetail()).isEqualTo("Status changed to Qualified");
        assertThat(timeline.get(1).getUrl()).isEqualTo("https://acme.example/pricing");
        assertThat(timeline.get(2).getSubject()).isEqualTo("Quick question");
    }

    @Test
    void getTimeline_LeadWithoutActivityIsEmpty() {
        lead.setStatusChangedAt(null);

        assertThat(service.getTimeline(lead.getId(), 1L)).isEmpty();
    }

    @Test
    void getTimeline_OtherOwnerIsNotFound() {
        assertThatThrownBy(() -> service.getTimeline(lead.getId(), 99L))
                .isInstanceOf(EntityNotFoundException.class);
    }

    private TrackedEmail trackedEmail(String subject, String token) {
        return TrackedEmail.builder()
                .userId(1L)
                .leadId(lead.getId())
                .recipientEmail("sam@acme.example")
                .subject(subject)
                .body("<p>Hi</p>")
                .trackingToken(token)
                .build();
    }
}
