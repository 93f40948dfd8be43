package com.leadflow.backend.repositories.automation;

import com.leadflow.backend.enums.RunStatus;
import com.leadflow.backend.models.automation.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, Long> {

    Optional<ScheduledJob> findByWorkflowId(Long workflowId);

    List<ScheduledJob> findByIsActiveTrue();

    long countByIsActiveTrue();

    List<ScheduledJob> findByRunInProgressTrueAndRunStartedAtBefore(OffsetDateTime before);

    /**
     * Check-and-set of the advisory lock. A lock older than staleBefore is treated as abandoned.
     * Returns 1 when the caller now owns the lock.
     */
    @Modifying
    @Query("UPDATE ScheduledJob j SET j.runInProgress = true, j.runStartedAt = :now " +
            "WHERE j.id = :id AND (j.runInProgress = false OR j.runStartedAt < :staleBefore)")
    int tryAcquireRunLock(@Param("id") Long id,
                          @Param("now") OffsetDateTime now,
                          @Param("staleBefore") OffsetDateTime staleBefore);

    @Modifying
    @Query("UPDATE ScheduledJob j SET j.runInProgress = false, j.runStartedAt = null WHERE j.id = :id")
    int releaseRunLock(@Param("id") Long id);

    @Modifying
    @Query("UPDATE ScheduledJob j SET j.cronExpression = :cron, j.isActive = :active WHERE j.workflowId = :workflowId")
    int updateSchedule(@Param("workflowId") Long workflowId,
                       @Param("cron") String cronExpression,
                       @Param("active") boolean active);

    @Modifying
    @Query("UPDATE ScheduledJob j SET j.isActive = :active WHERE j.workflowId = :workflowId")
    int updateActive(@Param("workflowId") Long workflowId, @Param("active") boolean active);

    /**
     * Increments the counters in place so a concurrent schedule edit is never overwritten.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ScheduledJob j SET j.totalExecutions = j.totalExecutions + 1, " +
            "j.successfulExecutions = j.successfulExecutions + :success, " +
            "j.failedExecutions = j.failedExecutions + :failed, " +
            "j.partialExecutions = j.partialExecutions + :partial, " +
            "j.lastRunAt = :at, j.lastStatus = :status WHERE j.id = :id")
    int recordOutcome(@Param("id") Long id,
                      @Param("status") RunStatus status,
                      @Param("success") long success,
                      @Param("failed") long failed,
                      @Param("partial") long partial,
                      @Param("at") OffsetDateTime at);

    @Query("SELECT COALESCE(SUM(j.totalExecutions), 0) FROM ScheduledJob j")
    long sumTotalExecutions();

    @Query("SELECT COALESCE(SUM(j.successfulExecutions), 0) FROM ScheduledJob j")
    long sumSuccessfulExecutions();

    @Query("SELECT COALESCE(SUM(j.failedExecutions), 0) FROM ScheduledJob j")
    long sumFailedExecutions();
}
