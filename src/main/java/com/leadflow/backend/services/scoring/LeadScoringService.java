package com.leadflow.backend.services.scoring;

import com.leadflow.backend.dto.lead.LeadScoreDto;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.store.EngagementCounts;
import com.leadflow.backend.store.LeadStore;
import com.leadflow.backend.store.TrackingStore;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Loads a lead's engagement counts, scores it and stores the score when it changed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeadScoringService {

    private final LeadStore leadStore;
    private final TrackingStore trackingStore;
    private final LeadScoreCalculator calculator;
    private final Clock clock;

    /**
     * Recalculates the score of a lead owned by {@code userId}.
     */
    public LeadScoreDto recalculate(Long leadId, Long userId) {
        leadStore.findById(leadId)
                .filter(lead -> userId.equals(lead.getUserId()))
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));
        return recalculate(leadId);
    }

    public LeadScoreDto recalculate(Long leadId) {
        Lead lead = leadStore.findById(leadId)
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));

        EngagementCounts counts = trackingStore.countEngagement(leadId);
        ScoreResult result = calculator.calculate(lead, counts);
        Integer previous = lead.getScore();

        if (!Objects.equals(previous, result.score())) {
            leadStore.updateScore(leadId, result.score(), OffsetDateTime.now(clock));
            log.info("Lead {} score {} -> {} ({})", leadId, previous, result.score(), result.priority());
        } else {
            log.debug("Lead {} score unchanged at {}", leadId, result.score());
        }

        return LeadScoreDto.builder()
                .leadId(leadId)
                .score(result.score())
                .previousScore(previous)
                .priority(result.priority().name())
                .companySizeScore(result.companySize())
                .contactScore(result.contactCompleteness())
                .dataQualityScore(result.dataQuality())
                .engagementScore(result.engagement())
                .strengths(result.strengths())
                .improvements(result.improvements())
                .explanation(result.explanation())
                .build();
    }

    /**
     * Fire-and-forget recalculation after a tracking event. Failures are logged only.
     */
    @Async
    public void recalculateAsync(Long leadId) {
        try {
            recalculate(leadId);
        } catch (Exception e) {
            log.error("Score recalculation failed for lead {}: {}", leadId, e.getMessage(), e);
        }
    }
}
