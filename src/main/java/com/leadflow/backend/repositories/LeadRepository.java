package com.leadflow.backend.repositories;

import com.leadflow.backend.enums.EnrollmentStatus;
import com.leadflow.backend.enums.LeadStatus;
import com.leadflow.backend.models.Lead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface LeadRepository extends JpaRepository<Lead, Long> {

    Optional<Lead> findByIdAndUserId(Long id, Long userId);

    /**
     * Leads of one owner with no engagement since the cutoff, skipping closed leads and
     * leads that already have an active enrollment in the given sequence.
     */
    @Query("SELECT l FROM Lead l WHERE l.userId = :userId " +
            "AND (l.lastEngagementAt IS NULL OR l.lastEngagementAt < :cutoff) " +
            "AND l.status NOT IN :closedStatuses " +
            "AND NOT EXISTS (SELECT e.id FROM SequenceEnrollment e " +
            "  WHERE e.leadId = l.id AND e.sequenceId = :sequenceId AND e.status = :activeStatus) " +
            "ORDER BY l.id")
    List<Lead> findInactiveLeads(
            @Param("userId") Long userId,
            @Param("cutoff") OffsetDateTime cutoff,
            @Param("sequenceId") Long sequenceId,
            @Param("closedStatuses") Collection<LeadStatus> closedStatuses,
            @Param("activeStatus") EnrollmentStatus activeStatus
    );

    @Modifying
    @Query("UPDATE Lead l SET l.score = :score, l.scoreUpdatedAt = :at WHERE l.id = :id")
    int updateScore(@Param("id") Long id, @Param("score") int score, @Param("at") OffsetDateTime at);

    @Modifying
    @Query("UPDATE Lead l SET l.status = :status, l.statusChangedAt = :at WHERE l.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") LeadStatus status, @Param("at") OffsetDateTime at);

    /**
     * Moves lastEngagementAt forward only.
     */
    @Modifying
    @Query("UPDATE Lead l SET l.lastEngagementAt = :at WHERE l.id = :id " +
            "AND (l.lastEngagementAt IS NULL OR l.lastEngagementAt < :at)")
    int touchEngagement(@Param("id") Long id, @Param("at") OffsetDateTime at);
}
