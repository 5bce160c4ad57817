package com.aegis.engine.workflow;

import java.time.Instant;
import java.util.Map;

/**
 * Notification about a workflow. {@code phase} is the phase the machine is in
 * after the event.
 */
public record WorkflowEvent(
        WorkflowEventType eventType,
        String projectId,
        String runId,
        String phase,
        Instant timestamp,
        String message,
        Map<String, Object> metadata
) {
    public WorkflowEvent {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
