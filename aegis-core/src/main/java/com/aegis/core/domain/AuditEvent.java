package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A generic audit fact: who did what to which resource, in which phase.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        String type,
        String actor,
        String action,
        String resource,
        String projectId,
        String runId,
        String phase,
        Map<String, String> metadata,
        Instant timestamp
) {
    public static final String SYSTEM_ACTOR = "SYSTEM";

    public static final String STATE_TRANSITION = "STATE_TRANSITION";
    public static final String TRANSITION_REFUSED = "TRANSITION_REFUSED";
    public static final String AGENT_ACTION = "AGENT_ACTION";

    public AuditEvent {
        Objects.requireNonNull(type, "Event type cannot be null");
        Objects.requireNonNull(action, "Action cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        actor = actor != null ? actor : SYSTEM_ACTOR;
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Audit event for a completed phase transition. The resource is
     * {@code from_to_to}.
     */
    public static AuditEvent stateTransition(String projectId, String runId, String from, String to,
                                             String event, String actor, Map<String, String> metadata,
                                             Instant timestamp) {
        Map<String, String> meta = new LinkedHashMap<>();
        if (metadata != null) {
            meta.putAll(metadata);
        }
        meta.put("from", from);
        meta.put("to", to);
        meta.put("event", event);
        return new AuditEvent(STATE_TRANSITION, actor, event, from + "_to_" + to,
                projectId, runId, to, meta, timestamp);
    }

    /**
     * Audit event for a transition that was refused; the phase is the one the
     * machine stayed in.
     */
    public static AuditEvent transitionRefused(String projectId, String runId, String phase, String target,
                                               String event, String actor, String reason, Instant timestamp) {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("from", phase);
        if (target != null) {
            meta.put("to", target);
        }
        meta.put("event", event);
        meta.put("reason", reason);
        return new AuditEvent(TRANSITION_REFUSED, actor, event,
                phase + "_to_" + (target != null ? target : "none"),
                projectId, runId, phase, meta, timestamp);
    }

    public static AuditEvent agentAction(String projectId, String runId, String phase, String agentId,
                                         String action, String taskId, boolean success, Duration duration,
                                         List<String> evidenceIds, Instant timestamp) {
        Objects.requireNonNull(agentId, "Agent ID cannot be null");
        Map<String, String> meta = new LinkedHashMap<>();
        if (taskId != null) {
            meta.put("taskId", taskId);
        }
        meta.put("success", Boolean.toString(success));
        if (duration != null) {
            meta.put("durationMs", Long.toString(duration.toMillis()));
        }
        if (evidenceIds != null && !evidenceIds.isEmpty()) {
            meta.put("evidenceIds", String.join(",", evidenceIds));
        }
        return new AuditEvent(AGENT_ACTION, agentId, action, taskId != null ? "task:" + taskId : "agent:" + agentId,
                projectId, runId, phase, meta, timestamp);
    }
}
