package com.leadflow.backend.repositories.sequence;

import com.leadflow.backend.enums.SequenceTriggerType;
import com.leadflow.backend.models.sequence.EmailSequence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmailSequenceRepository extends JpaRepository<EmailSequence, Long> {

    Optional<EmailSequence> findByIdAndUserId(Long id, Long userId);

    List<EmailSequence> findByUserIdAndTriggerTypeAndIsActiveTrue(Long userId, SequenceTriggerType triggerType);
}
