package com.leadflow.backend.repositories.sequence;

import com.leadflow.backend.enums.EnrollmentStatus;
import com.leadflow.backend.models.sequence.SequenceEnrollment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface SequenceEnrollmentRepository extends JpaRepository<SequenceEnrollment, Long> {

    boolean existsByLeadIdAndSequenceIdAndStatus(Long leadId, Long sequenceId, EnrollmentStatus status);

    List<SequenceEnrollment> findByLeadIdOrderByEnrolledAtDesc(Long leadId);

    @Query("SELECT e FROM SequenceEnrollment e WHERE e.sequenceId = :sequenceId " +
            "AND e.status = :status AND e.nextStepDueAt <= :now ORDER BY e.nextStepDueAt, e.id")
    List<SequenceEnrollment> findDue(
            @Param("sequenceId") Long sequenceId,
            @Param("status") EnrollmentStatus status,
            @Param("now") OffsetDateTime now
    );

    @Query("SELECT DISTINCT e.sequenceId FROM SequenceEnrollment e WHERE e.status = :status " +
            "AND e.nextStepDueAt <= :now AND e.sequenceId NOT IN " +
            "(SELECT w.sequenceId FROM ReengagementWorkflow w WHERE w.isActive = true)")
    List<Long> findUnscheduledSequencesWithDue(
            @Param("status") EnrollmentStatus status,
            @Param("now") OffsetDateTime now
    );

    /**
     * Returns 1 when the caller now holds the step until leaseUntil.
     */
    @Modifying
    @Query("UPDATE SequenceEnrollment e SET e.nextStepDueAt = :leaseUntil " +
            "WHERE e.id = :id AND e.status = :status AND e.currentStepIndex = :stepIndex " +
            "AND e.nextStepDueAt <= :now")
    int claimStep(@Param("id") Long id,
                  @Param("status") EnrollmentStatus status,
                  @Param("stepIndex") int stepIndex,
                  @Param("now") OffsetDateTime now,
                  @Param("leaseUntil") OffsetDateTime leaseUntil);
}
