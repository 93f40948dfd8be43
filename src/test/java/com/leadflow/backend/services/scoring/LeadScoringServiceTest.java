package com.leadflow.backend.services.scoring;

import com.leadflow.backend.dto.lead.LeadScoreDto;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.store.EngagementCounts;
import com.leadflow.backend.store.LeadStore;
import com.leadflow.backend.store.TrackingStore;
import com.leadflow.backend.support.TestFixtures;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeadScoringServiceTest {

    @Mock
    private LeadStore leadStore;

    @Mock
    private TrackingStore trackingStore;

    private LeadScoringService service;
    private Lead lead;

    @BeforeEach
    void setUp() {
        service = new LeadScoringService(leadStore, trackingStore, new LeadScoreCalculator(), TestFixtures.fixedClock());
        lead = Lead.builder()
                .id(42L)
                .userId(1L)
                .companyName("Acme Corp")
                .companySize("200-500")
                .contactName("Sam Lee")
                .contactEmail("sam@acme.example")
                .score(0)
                .build();
    }

    @Test
    void recalculate_StoresChangedScore() {
        when(leadStore.findById(42L)).thenReturn(Optional.of(lead));
        when(trackingStore.countEngagement(42L)).thenReturn(new EngagementCounts(1, 1));

        LeadScoreDto dto = service.recalculate(42L);

        assertThat(dto.getPreviousScore()).isZero();
        assertThat(dto.getScore()).isPositive();
        assertThat(dto.getEngagementScore()).isEqualTo(21);
        verify(leadStore).updateScore(42L, dto.getScore(), TestFixtures.NOW);
    }

    @Test
    void recalculate_UnchangedScoreIsNotWritten() {
        lead.setScore(17 + 13);
        when(leadStore.findById(42L)).thenReturn(Optional.of(lead));
        when(trackingStore.countEngagement(42L)).thenReturn(EngagementCounts.none());

        LeadScoreDto dto = service.recalculate(42L);

        assertThat(dto.getScore()).isEqualTo(30);
        verify(leadStore, never()).updateScore(anyLong(), anyInt(), any());
    }

    @Test
    void recalculate_ForOtherOwnerIsNotFound() {
        when(leadStore.findById(42L)).thenReturn(Optional.of(lead));

        assertThatThrownBy(() -> service.recalculate(42L, 2L))
                .isInstanceOf(EntityNotFoundException.class);
        verifyNoInteractions(trackingStore);
    }

    @Test
    void recalculateAsync_SwallowsAndLogsFailures() {
        when(leadStore.findById(42L)).thenReturn(Optional.empty());

        assertThatCode(() -> service.recalculateAsync(42L)).doesNotThrowAnyException();
    }
}
