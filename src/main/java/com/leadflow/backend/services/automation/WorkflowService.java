package com.leadflow.backend.services.automation;

import com.leadflow.backend.dto.automation.WorkflowDto;
import com.leadflow.backend.dto.automation.WorkflowExecutionResult;
import com.leadflow.backend.dto.automation.WorkflowRequest;
import com.leadflow.backend.models.automation.JobExecution;
import com.leadflow.backend.models.automation.NotificationPreferences;
import com.leadflow.backend.models.automation.ReengagementWorkflow;
import com.leadflow.backend.models.automation.ScheduledJob;
import com.leadflow.backend.repositories.automation.ReengagementWorkflowRepository;
import com.leadflow.backend.store.JobExecutionStore;
import com.leadflow.backend.store.SequenceStore;
import com.leadflow.backend.util.CronDescriptions;
import com.leadflow.backend.util.CronSchedule;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Owner-facing management of re-engagement workflows and their schedules.
 * Cron expressions are validated here, so a malformed schedule never reaches the scheduler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowService {

    private final ReengagementWorkflowRepository workflowRepository;
    private final JobExecutionStore jobExecutionStore;
    private final SequenceStore sequenceStore;
    private final WorkflowExecutor workflowExecutor;

    @Transactional(readOnly = true)
    public List<WorkflowDto> listWorkflows(Long userId) {
        return workflowRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public WorkflowDto getWorkflow(Long workflowId, Long userId) {
        return toDto(getOwnedWorkflow(workflowId, userId));
    }

    @Transactional
    public WorkflowDto createWorkflow(Long userId, WorkflowRequest request) {
        CronSchedule schedule = CronSchedule.parse(request.getCronExpression());
        validateSequence(request.getSequenceId(), userId);

        boolean active = request.getIsActive() == null || request.getIsActive();
        ReengagementWorkflow workflow = ReengagementWorkflow.builder()
                .userId(userId)
                .name(request.getName())
                .description(request.getDescription())
                .inactivityDays(request.getInactivityDays())
                .sequenceId(request.getSequenceId())
                .isActive(active)
                .ownerEmail(request.getOwnerEmail())
                .ownerName(request.getOwnerName())
                .notificationPreferences(preferencesFrom(request, NotificationPreferences.defaults()))
                .build();
        workflow = workflowRepository.save(workflow);

        jobExecutionStore.saveJob(ScheduledJob.builder()
                .workflowId(workflow.getId())
                .cronExpression(schedule.getExpression())
                .isActive(active)
                .build());

        log.info("Created workflow {} '{}' for user {} on schedule '{}'",
                workflow.getId(), workflow.getName(), userId, schedule);
        return toDto(workflow);
    }

    @Transactional
    public WorkflowDto updateWorkflow(Long workflowId, Long userId, WorkflowRequest request) {
        ReengagementWorkflow workflow = getOwnedWorkflow(workflowId, userId);
        CronSchedule schedule = CronSchedule.parse(request.getCronExpression());
        validateSequence(request.getSequenceId(), userId);

        workflow.setName(request.getName());
        workflow.setDescription(request.getDescription());
        workflow.setInactivityDays(request.getInactivityDays());
        workflow.setSequenceId(request.getSequenceId());
        if (request.getIsActive() != null) {
            workflow.setIsActive(request.getIsActive());
        }
        workflow.setOwnerEmail(request.getOwnerEmail());
        workflow.setOwnerName(request.getOwnerName());
        workflow.setNotificationPreferences(preferencesFrom(request, workflow.preferencesOrDefault()));
        workflow = workflowRepository.save(workflow);

        if (!jobExecutionStore.updateSchedule(workflowId, schedule.getExpression(), workflow.isEnabled())) {
            jobExecutionStore.saveJob(ScheduledJob.builder()
                    .workflowId(workflowId)
                    .cronExpression(schedule.getExpression())
                    .isActive(workflow.isEnabled())
                    .build());
        }

        log.info("Updated workflow {} for user {}", workflowId, userId);
        return toDto(workflow);
    }

    /**
     * Removes the workflow and its schedule. Enrollments it created stay as they are.
     */
    @Transactional
    public void deleteWorkflow(Long workflowId, Long userId) {
        ReengagementWorkflow workflow = getOwnedWorkflow(workflowId, userId);
        jobExecutionStore.findJobByWorkflowId(workflowId)
                .ifPresent(job -> jobExecutionStore.deleteJob(job.getId()));
        workflowRepository.delete(workflow);
        log.info("Deleted workflow {} for user {}", workflowId, userId);
    }

    @Transactional
    public WorkflowDto toggleWorkflow(Long workflowId, Long userId) {
        ReengagementWorkflow workflow = getOwnedWorkflow(workflowId, userId);
        boolean active = !workflow.isEnabled();
        workflow.setIsActive(active);
        workflow = workflowRepository.save(workflow);

        jobExecutionStore.setJobActive(workflowId, active);

        log.info("Workflow {} {}", workflowId, active ? "activated" : "paused");
        return toDto(workflow);
    }

    /**
     * Runs the workflow now, on the caller's thread.
     *
     * @throws IllegalStateException when a run of this workflow is already in progress
     */
    public WorkflowExecutionResult runNow(Long workflowId, Long userId) {
        ReengagementWorkflow workflow = getOwnedWorkflow(workflowId, userId);
        ScheduledJob job = jobExecutionStore.findJobByWorkflowId(workflowId)
                .orElseThrow(() -> new EntityNotFoundException("No schedule for workflow: " + workflowId));

        return workflowExecutor.execute(workflow, job, JobExecution.Trigger.MANUAL)
                .orElseThrow(() -> new IllegalStateException("Workflow " + workflowId + " is already running"));
    }

    private ReengagementWorkflow getOwnedWorkflow(Long workflowId, Long userId) {
        return workflowRepository.findByIdAndUserId(workflowId, userId)
                .orElseThrow(() -> new EntityNotFoundException("Workflow not found: " + workflowId));
    }

    private void validateSequence(Long sequenceId, Long userId) {
        sequenceStore.findSequence(sequenceId)
                .filter(s -> userId.equals(s.getUserId()))
                .orElseThrow(() -> new IllegalArgumentException("Sequence not found: " + sequenceId));
    }

    private static NotificationPreferences preferencesFrom(WorkflowRequest request, NotificationPreferences current) {
        return NotificationPreferences.builder()
                .enabled(request.getNotifyEnabled() != null ? request.getNotifyEnabled() : current.getEnabled())
                .onSuccess(request.getNotifyOnSuccess() != null ? request.getNotifyOnSuccess() : current.getOnSuccess())
                .onFailure(request.getNotifyOnFailure() != null ? request.getNotifyOnFailure() : current.getOnFailure())
                .onPartial(request.getNotifyOnPartial() != null ? request.getNotifyOnPartial() : current.getOnPartial())
                .batchNotifications(request.getBatchNotifications() != null
                        ? request.getBatchNotifications() : current.getBatchNotifications())
                .build();
    }

    private WorkflowDto toDto(ReengagementWorkflow workflow) {
        ScheduledJob job = jobExecutionStore.findJobByWorkflowId(workflow.getId()).orElse(null);
        String description = job != null ? CronDescriptions.describe(job.getCronExpression()) : null;
        return WorkflowDto.from(workflow, job, description);
    }
}
