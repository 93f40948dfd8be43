package com.leadflow.backend.repositories.tracking;

import com.leadflow.backend.models.tracking.EmailClick;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmailClickRepository extends JpaRepository<EmailClick, Long> {

    boolean existsByTrackingTokenAndUrlHash(String trackingToken, String urlHash);

    /**
     * Rows are unique per (token, url), so this counts distinct links clicked.
     */
    long countByLeadId(Long leadId);

    List<EmailClick> findByLeadIdOrderByClickedAtDesc(Long leadId);
}
