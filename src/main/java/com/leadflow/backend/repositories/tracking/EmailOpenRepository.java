package com.leadflow.backend.repositories.tracking;

import com.leadflow.backend.models.tracking.EmailOpen;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmailOpenRepository extends JpaRepository<EmailOpen, Long> {

    boolean existsByTrackingToken(String trackingToken);

    /**
     * One row per opened email, so this is the number of distinct emails opened.
     */
    long countByLeadId(Long leadId);

    List<EmailOpen> findByLeadIdOrderByOpenedAtDesc(Long leadId);
}
