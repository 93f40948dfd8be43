package com.leadflow.backend.repositories.automation;

import com.leadflow.backend.models.automation.ReengagementWorkflow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ReengagementWorkflowRepository extends JpaRepository<ReengagementWorkflow, Long> {

    List<ReengagementWorkflow> findByUserIdOrderByCreatedAtDesc(Long userId);

    Optional<ReengagementWorkflow> findByIdAndUserId(Long id, Long userId);
}
