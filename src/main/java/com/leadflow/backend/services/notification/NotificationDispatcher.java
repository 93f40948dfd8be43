package com.leadflow.backend.services.notification;

import com.leadflow.backend.dto.automation.WorkflowExecutionResult;
import com.leadflow.backend.models.automation.NotificationPreferences;
import com.leadflow.backend.models.automation.ReengagementWorkflow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Tells workflow owners how their runs went, immediately or as a periodic batch.
 * No method here throws: delivery problems are logged and reported as {@code false}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final NotificationPort notificationPort;
    private final NotificationContentBuilder contentBuilder;
    private final NotificationBatchBuffer batchBuffer;

    /**
     * Applies the workflow owner's preferences to one run.
     *
     * @return true when a message was sent right away; false when suppressed, queued for the
     * batch, or not delivered
     */
    public boolean dispatch(ReengagementWorkflow workflow, WorkflowExecutionResult result) {
        try {
            NotificationPreferences preferences = workflow.preferencesOrDefault();

            if (!preferences.isEnabled()) {
                log.debug("Notifications disabled for workflow {}", workflow.getId());
                return false;
            }
            if (workflow.getOwnerEmail() == null || workflow.getOwnerEmail().isBlank()) {
                log.warn("Workflow {} has no owner email, notification dropped", workflow.getId());
                return false;
            }

            // a batch summary covers every run, the per-status flags only gate immediate messages
            if (preferences.isBatch()) {
                batchBuffer.add(workflow.getOwnerEmail(), workflow.getOwnerName(), result);
                log.debug("Queued run of workflow {} for batch notification", workflow.getId());
                return false;
            }
            if (!preferences.wantsStatus(result.getStatus())) {
                log.debug("Skipping notification for workflow {} with status {}", workflow.getId(), result.getStatus());
                return false;
            }

            return sendRunNotification(workflow.getOwnerEmail(), workflow.getOwnerName(), result);
        } catch (Exception e) {
            log.error("Error dispatching notification for workflow {}: {}", workflow.getId(), e.getMessage(), e);
            return false;
        }
    }

    public boolean sendRunNotification(String recipient, String ownerName, WorkflowExecutionResult result) {
        try {
            NotificationContent content = contentBuilder.buildRunNotification(ownerName, result);
            boolean sent = notificationPort.notify(recipient, content.title(), content.body());
            if (sent) {
                log.info("Sent notification for workflow: {}", result.getWorkflowName());
            } else {
                log.warn("Failed to send notification for workflow: {}", result.getWorkflowName());
            }
            return sent;
        } catch (Exception e) {
            log.error("Error sending notification for workflow {}: {}", result.getWorkflowName(), e.getMessage(), e);
            return false;
        }
    }

    public boolean sendBatchNotification(String recipient, String ownerName, List<WorkflowExecutionResult> results) {
        if (results == null || results.isEmpty()) {
            return false;
        }
        try {
            NotificationContent content = contentBuilder.buildBatchNotification(ownerName, results);
            boolean sent = notificationPort.notify(recipient, content.title(), content.body());
            if (sent) {
                log.info("Sent batch notification for {} workflow runs to {}", results.size(), recipient);
            }
            return sent;
        } catch (Exception e) {
            log.error("Error sending batch notification to {}: {}", recipient, e.getMessage(), e);
            return false;
        }
    }

    @Scheduled(cron = "${engagement.notifications.batch-cron:0 0 18 * * *}")
    public void flushBatches() {
        Map<String, NotificationBatchBuffer.Pending> drained = batchBuffer.drain();
        if (drained.isEmpty()) {
            return;
        }
        log.info("Flushing batch notifications for {} recipients", drained.size());
        drained.forEach((recipient, pending) ->
                sendBatchNotification(recipient, pending.ownerName(), pending.results()));
    }
}
