package com.leadflow.backend.services.notification;

import com.leadflow.backend.config.EngagementProperties;
import com.leadflow.backend.dto.automation.WorkflowExecutionResult;
import com.leadflow.backend.enums.RunStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Plain-text bodies for run and batch notifications.
 */
@Component
@RequiredArgsConstructor
public class NotificationContentBuilder {

    private static final DateTimeFormatter EXECUTED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss xxx");

    private final EngagementProperties properties;

    public NotificationContent buildRunNotification(String ownerName, WorkflowExecutionResult result) {
        String title = String.format("Workflow \"%s\" %s", result.getWorkflowName(), result.getStatus().getHeadline());

        StringBuilder body = new StringBuilder();
        body.append("Hi ").append(displayName(ownerName)).append(",\n\n");
        body.append("Your scheduled workflow \"").append(result.getWorkflowName()).append("\" has completed execution.\n\n");

        body.append("Execution Summary:\n");
        body.append("- Status: ").append(result.getStatus().name()).append('\n');
        body.append("- Leads Detected: ").append(result.getLeadsDetected()).append('\n');
        body.append("- Leads Enrolled: ").append(result.getLeadsEnrolled()).append('\n');
        body.append("- Success Rate: ").append(Math.round(result.getEnrollmentRate())).append("%\n");
        if (result.getExecutedAt() != null) {
            body.append("- Executed At: ").append(result.getExecutedAt().format(EXECUTED_AT_FORMAT)).append('\n');
        }
        Long durationSeconds = result.getDurationSeconds();
        if (durationSeconds != null) {
            body.append("- Duration: ").append(durationSeconds).append("s\n");
        }

        if (result.getStatus() == RunStatus.FAILED && result.getErrorMessage() != null) {
            body.append("\nError Details:\n");
            body.append(result.getErrorMessage()).append('\n');
            body.append("\nPlease check your workflow configuration and try again.\n");
        } else if (result.getStatus() == RunStatus.PARTIAL) {
            body.append("\nSome leads could not be enrolled or emailed. Please check the execution logs for details.\n");
        } else if (result.getStatus() == RunStatus.SUCCESS) {
            body.append("\nAll leads were successfully enrolled in the re-engagement sequence!\n");
        }

        appendFooter(body);
        return new NotificationContent(title, body.toString());
    }

    public NotificationContent buildBatchNotification(String ownerName, List<WorkflowExecutionResult> results) {
        BatchTotals totals = BatchTotals.of(results);
        String title = String.format("Daily Workflow Summary: %d workflows executed", totals.workflows());

        StringBuilder body = new StringBuilder();
        body.append("Hi ").append(displayName(ownerName)).append(",\n\n");
        body.append("Here's your daily summary of scheduled workflow executions.\n\n");

        body.append("Overall Statistics:\n");
        body.append("- Total Workflows: ").append(totals.workflows()).append('\n');
        body.append("- Successful: ").append(totals.successful()).append('\n');
        body.append("- Failed: ").append(totals.failed()).append('\n');
        body.append("- Partial: ").append(totals.partial()).append('\n');
        body.append("- Total Leads Detected: ").append(totals.leadsDetected()).append('\n');
        body.append("- Total Leads Enrolled: ").append(totals.leadsEnrolled()).append('\n');

        if (!results.isEmpty()) {
            body.append("\nIndividual Workflow Results:\n\n");
            for (int i = 0; i < results.size(); i++) {
                WorkflowExecutionResult result = results.get(i);
                body.append(i + 1).append(". [").append(result.getStatus().name()).append("] ")
                        .append(result.getWorkflowName()).append('\n');
                body.append("   - Detected: ").append(result.getLeadsDetected())
                        .append(", Enrolled: ").append(result.getLeadsEnrolled()).append('\n');
                if (result.getStatus() == RunStatus.FAILED && result.getErrorMessage() != null) {
                    body.append("   - Error: ").append(result.getErrorMessage()).append('\n');
                }
                body.append('\n');
            }
        }

        appendFooter(body);
        return new NotificationContent(title, body.toString());
    }

    private void appendFooter(StringBuilder body) {
        body.append("\nView detailed execution history in your Admin Dashboard.\n");
        body.append("\nBest regards,\n").append(properties.notifications().signature());
    }

    private static String displayName(String ownerName) {
        return ownerName != null && !ownerName.isBlank() ? ownerName : "there";
    }
}
