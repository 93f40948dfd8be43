package com.leadflow.backend.store.jpa;

import com.leadflow.backend.models.tracking.EmailClick;
import com.leadflow.backend.models.tracking.EmailOpen;
import com.leadflow.backend.models.tracking.TrackedEmail;
import com.leadflow.backend.repositories.tracking.EmailClickRepository;
import com.leadflow.backend.repositories.tracking.EmailOpenRepository;
import com.leadflow.backend.repositories.tracking.TrackedEmailRepository;
import com.leadflow.backend.store.EngagementCounts;
import com.leadflow.backend.store.TrackingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional
@Slf4j
public class JpaTrackingStore implements TrackingStore {

    private final TrackedEmailRepository trackedEmailRepository;
    private final EmailOpenRepository openRepository;
    private final EmailClickRepository clickRepository;

    @Override
    public TrackedEmail saveTrackedEmail(TrackedEmail email) {
        return trackedEmailRepository.save(email);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TrackedEmail> findByToken(String trackingToken) {
        return trackedEmailRepository.findByTrackingToken(trackingToken);
    }

    @Override
    public void incrementOpenCount(Long trackedEmailId, OffsetDateTime at) {
        trackedEmailRepository.incrementOpenCount(trackedEmailId, at);
    }

    @Override
    public void incrementClickCount(Long trackedEmailId) {
        trackedEmailRepository.incrementClickCount(trackedEmailId);
    }

    @Override
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public boolean recordFirstOpen(EmailOpen open) {
        if (openRepository.existsByTrackingToken(open.getTrackingToken())) {
            return false;
        }
        try {
            openRepository.saveAndFlush(open);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent first open for tracked email {}", open.getTrackedEmailId());
            return false;
        }
    }

    @Override
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public boolean recordClick(EmailClick click) {
        if (clickRepository.existsByTrackingTokenAndUrlHash(click.getTrackingToken(), click.getUrlHash())) {
            return false;
        }
        try {
            clickRepository.saveAndFlush(click);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent click replay for tracked email {}", click.getTrackedEmailId());
            return false;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public EngagementCounts countEngagement(Long leadId) {
        return new EngagementCounts(openRepository.countByLeadId(leadId), clickRepository.countByLeadId(leadId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TrackedEmail> findEmailsForLead(Long leadId) {
        return trackedEmailRepository.findByLeadIdOrderByCreatedAtDesc(leadId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<EmailOpen> findOpensForLead(Long leadId) {
        return openRepository.findByLeadIdOrderByOpenedAtDesc(leadId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<EmailClick> findClicksForLead(Long leadId) {
        return clickRepository.findByLeadIdOrderByClickedAtDesc(leadId);
    }
}
