package com.leadflow.backend.repositories.automation;

import com.leadflow.backend.models.automation.JobExecution;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecution, Long> {

    List<JobExecution> findByJobIdOrderByStartedAtDesc(Long jobId, Pageable pageable);
}
