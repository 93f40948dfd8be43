package com.leadflow.backend.services.automation;

import com.leadflow.backend.enums.SequenceTriggerType;
import com.leadflow.backend.exceptions.DetectionException;
import com.leadflow.backend.models.Lead;
import com.leadflow.backend.models.automation.ReengagementWorkflow;
import com.leadflow.backend.models.sequence.SequenceEnrollment;
import com.leadflow.backend.store.LeadStore;
import com.leadflow.backend.store.SequenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Finds leads without engagement for {@code inactivityDays} and enrolls them into the
 * workflow's target sequence, due immediately.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReengagementDetector {

    private final LeadStore leadStore;
    private final SequenceStore sequenceStore;

    /**
     * @throws DetectionException when the inactive-lead scan cannot be performed
     */
    public DetectionResult detect(ReengagementWorkflow workflow, OffsetDateTime now) {
        OffsetDateTime cutoff = now.minusDays(workflow.getInactivityDays());

        List<Lead> inactive;
        try {
            inactive = leadStore.findInactiveLeads(workflow.getUserId(), cutoff, workflow.getSequenceId());
        } catch (RuntimeException e) {
            throw new DetectionException(workflow.getId(),
                    "Inactive lead scan failed: " + e.getMessage(), e);
        }

        int enrolled = 0;
        for (Lead lead : inactive) {
            SequenceEnrollment enrollment = new SequenceEnrollment(lead.getId(), workflow.getSequenceId(), now);
            enrollment.setWorkflowId(workflow.getId());
            enrollment.setSource(SequenceTriggerType.TIME_BASED);
            enrollment.setNextStepDueAt(now);

            try {
                if (sequenceStore.createEnrollment(enrollment).isPresent()) {
                    enrolled++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to enroll lead {} for workflow {}: {}", lead.getId(), workflow.getId(), e.getMessage());
            }
        }

        log.info("Workflow {} executed: {} inactive leads detected, {} enrolled, {} skipped",
                workflow.getId(), inactive.size(), enrolled, inactive.size() - enrolled);
        return new DetectionResult(inactive.size(), enrolled);
    }
}
