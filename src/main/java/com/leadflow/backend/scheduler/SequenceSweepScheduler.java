package com.leadflow.backend.scheduler;

import com.leadflow.backend.config.EngagementProperties;
import com.leadflow.backend.services.sequence.SequenceStepExecutor;
import com.leadflow.backend.services.sequence.StepOutcome;
import com.leadflow.backend.store.SequenceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Advances enrollments of sequences that no active workflow drives: manual and
 * status-change enrollments, and those left behind by a deleted or paused workflow.
 * Sequences targeted by an active workflow are advanced by that workflow's runs.
 */
@Component
@Slf4j
public class SequenceSweepScheduler {

    private final SequenceStore sequenceStore;
    private final SequenceStepExecutor stepExecutor;
    private final EngagementProperties properties;
    private final Clock clock;

    public SequenceSweepScheduler(SequenceStore sequenceStore,
                                  SequenceStepExecutor stepExecutor,
                                  EngagementProperties properties,
                                  Clock clock) {
        this.sequenceStore = sequenceStore;
        this.stepExecutor = stepExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${engagement.scheduler.sequence-sweep-cron:0 */15 * * * *}")
    public void sweep() {
        if (!properties.scheduler().enabled()) {
            return;
        }
        sweep(OffsetDateTime.now(clock));
    }

    /**
     * @return emails sent across all swept sequences
     */
    public int sweep(OffsetDateTime now) {
        List<Long> sequenceIds;
        try {
            sequenceIds = sequenceStore.findUnscheduledSequencesWithDueEnrollments(now);
        } catch (Exception e) {
            log.error("Error finding sequences with due enrollments: {}", e.getMessage(), e);
            return 0;
        }

        int sent = 0;
        for (Long sequenceId : sequenceIds) {
            try {
                StepOutcome outcome = stepExecutor.processDueEnrollments(sequenceId, now);
                sent += outcome.sent();
            } catch (Exception e) {
                log.error("Sequence sweep failed for sequence {}: {}", sequenceId, e.getMessage(), e);
            }
        }

        if (!sequenceIds.isEmpty()) {
            log.info("Sequence sweep processed {} sequence(s), {} email(s) sent", sequenceIds.size(), sent);
        }
        return sent;
    }
}
