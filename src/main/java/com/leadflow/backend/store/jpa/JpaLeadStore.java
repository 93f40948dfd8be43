package com.leadflow.backend.store.jpa;

import com.leadflow.backend.enums.EnrollmentStatus;
import com.leadflow.backend.enums.LeadStatus;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.repositories.LeadRepository;
import com.leadflow.backend.store.LeadStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional
public class JpaLeadStore implements LeadStore {

    private static final EnumSet<LeadStatus> CLOSED_STATUSES = EnumSet.of(LeadStatus.CONVERTED, LeadStatus.UNQUALIFIED);

    private final LeadRepository leadRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Lead> findById(Long leadId) {
        return leadRepository.findById(leadId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Lead> findInactiveLeads(Long userId, OffsetDateTime cutoff, Long excludeSequenceId) {
        return leadRepository.findInactiveLeads(userId, cutoff, excludeSequenceId,
                CLOSED_STATUSES, EnrollmentStatus.ACTIVE);
    }

    @Override
    public void updateStatus(Long leadId, LeadStatus status, OffsetDateTime at) {
        leadRepository.updateStatus(leadId, status, at);
        leadRepository.touchEngagement(leadId, at);
    }

    @Override
    public void updateScore(Long leadId, int score, OffsetDateTime at) {
        leadRepository.updateScore(leadId, score, at);
    }

    @Override
    public void recordEngagement(Long leadId, OffsetDateTime at) {
        leadRepository.touchEngagement(leadId, at);
    }
}
