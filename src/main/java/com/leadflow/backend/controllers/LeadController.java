package com.leadflow.backend.controllers;

import com.leadflow.backend.dto.lead.LeadScoreDto;
import com.leadflow.backend.dto.lead.StatusChangeRequest;
import com.leadflow.backend.dto.tracking.TimelineEventDto;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.services.scoring.LeadScoringService;
import com.leadflow.backend.services.sequence.LeadStatusService;
import com.leadflow.backend.services.tracking.EngagementTimelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/leads")
@RequiredArgsConstructor
public class LeadController {

    private final LeadStatusService leadStatusService;
    private final LeadScoringService leadScoringService;
    private final EngagementTimelineService timelineService;

    @PutMapping("/{leadId}/status")
    public Map<String, Object> changeStatus(@RequestHeader("X-User-Id") Long userId,
                                            @PathVariable Long leadId,
                                            @Valid @RequestBody StatusChangeRequest request) {
        Lead lead = leadStatusService.changeStatus(leadId, userId, request.getStatus());
        return Map.of(
                "leadId", lead.getId(),
                "status", lead.getStatus().name(),
                "statusChangedAt", lead.getStatusChangedAt());
    }

    @PostMapping("/{leadId}/score")
    public LeadScoreDto recalculateScore(@RequestHeader("X-User-Id") Long userId, @PathVariable Long leadId) {
        return leadScoringService.recalculate(leadId, userId);
    }

    @GetMapping("/{leadId}/timeline")
    public List<TimelineEventDto> getTimeline(@RequestHeader("X-User-Id") Long userId, @PathVariable Long leadId) {
        return timelineService.getTimeline(leadId, userId);
    }
}
