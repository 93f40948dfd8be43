package com.leadflow.backend.repositories.sequence;

import com.leadflow.backend.models.sequence.SequenceStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SequenceStepRepository extends JpaRepository<SequenceStep, Long> {

    List<SequenceStep> findBySequenceIdOrderByStepOrderAsc(Long sequenceId);

    @Query("SELECT COALESCE(MAX(s.stepOrder), 0) FROM SequenceStep s WHERE s.sequence.id = :sequenceId")
    int findMaxStepOrder(@Param("sequenceId") Long sequenceId);
}
