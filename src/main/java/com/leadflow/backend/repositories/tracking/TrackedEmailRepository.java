package com.leadflow.backend.repositories.tracking;

import com.leadflow.backend.models.tracking.TrackedEmail;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface TrackedEmailRepository extends JpaRepository<TrackedEmail, Long> {

    Optional<TrackedEmail> findByTrackingToken(String trackingToken);

    List<TrackedEmail> findByLeadIdOrderByCreatedAtDesc(Long leadId);

    @Modifying
    @Query("UPDATE TrackedEmail t SET t.openCount = t.openCount + 1, t.lastOpenedAt = :at, " +
            "t.firstOpenedAt = COALESCE(t.firstOpenedAt, :at) WHERE t.id = :id")
    int incrementOpenCount(@Param("id") Long id, @Param("at") OffsetDateTime at);

    @Modifying
    @Query("UPDATE TrackedEmail t SET t.clickCount = t.clickCount + 1 WHERE t.id = :id")
    int incrementClickCount(@Param("id") Long id);
}
