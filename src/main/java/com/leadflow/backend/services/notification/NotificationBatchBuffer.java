package com.leadflow.backend.services.notification;

import com.leadflow.backend.dto.automation.WorkflowExecutionResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory accumulation of runs for owners that asked for batched notifications.
 * Contents are lost on restart.
 */
@Component
public class NotificationBatchBuffer {

    record Pending(String ownerName, List<WorkflowExecutionResult> results) {
    }

    private final Map<String, Pending> pending = new LinkedHashMap<>();

    public synchronized void add(String recipient, String ownerName, WorkflowExecutionResult result) {
        pending.computeIfAbsent(recipient, r -> new Pending(ownerName, new ArrayList<>()))
                .results().add(result);
    }

    /**
     * Removes and returns everything accumulated so far, keyed by recipient.
     */
    public synchronized Map<String, Pending> drain() {
        Map<String, Pending> drained = new LinkedHashMap<>(pending);
        pending.clear();
        return drained;
    }

    public synchronized int size() {
        return pending.values().stream().mapToInt(p -> p.results().size()).sum();
    }
}
