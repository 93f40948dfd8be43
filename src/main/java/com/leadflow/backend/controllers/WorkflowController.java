package com.leadflow.backend.controllers;

import com.leadflow.backend.dto.automation.WorkflowDto;
import com.leadflow.backend.dto.automation.WorkflowExecutionResult;
import com.leadflow.backend.dto.automation.WorkflowRequest;
import com.leadflow.backend.services.automation.WorkflowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/reengagement/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final WorkflowService workflowService;

    @GetMapping
    public List<WorkflowDto> list(@RequestHeader("X-User-Id") Long userId) {
        return workflowService.listWorkflows(userId);
    }

    @GetMapping("/{workflowId}")
    public WorkflowDto get(@RequestHeader("X-User-Id") Long userId, @PathVariable Long workflowId) {
        return workflowService.getWorkflow(workflowId, userId);
    }

    @PostMapping
    public ResponseEntity<WorkflowDto> create(@RequestHeader("X-User-Id") Long userId,
                                              @Valid @RequestBody WorkflowRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workflowService.createWorkflow(userId, request));
    }

    @PutMapping("/{workflowId}")
    public WorkflowDto update(@RequestHeader("X-User-Id") Long userId,
                              @PathVariable Long workflowId,
                              @Valid @RequestBody WorkflowRequest request) {
        return workflowService.updateWorkflow(workflowId, userId, request);
    }

    @DeleteMapping("/{workflowId}")
    public ResponseEntity<Void> delete(@RequestHeader("X-User-Id") Long userId, @PathVariable Long workflowId) {
        workflowService.deleteWorkflow(workflowId, userId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{workflowId}/toggle")
    public WorkflowDto toggle(@RequestHeader("X-User-Id") Long userId, @PathVariable Long workflowId) {
        return workflowService.toggleWorkflow(workflowId, userId);
    }

    /**
     * Runs the workflow immediately. Returns 409 when a run is already in progress.
     */
    @PostMapping("/{workflowId}/run")
    public ResponseEntity<?> runNow(@RequestHeader("X-User-Id") Long userId, @PathVariable Long workflowId) {
        log.info("Manual run requested for workflow {} by user {}", workflowId, userId);
        try {
            WorkflowExecutionResult result = workflowService.runNow(workflowId, userId);
            return ResponseEntity.ok(result);
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "ALREADY_RUNNING", "message", e.getMessage()));
        }
    }
}
