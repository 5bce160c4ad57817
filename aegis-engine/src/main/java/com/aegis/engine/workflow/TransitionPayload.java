package com.aegis.engine.workflow;

import com.aegis.core.domain.AuditEvent;

import java.util.List;
import java.util.Map;

/**
 * Optional context supplied with a dispatched event.
 */
public record TransitionPayload(
        String actor,
        List<String> evidenceIds,
        Map<String, String> metadata
) {
    public TransitionPayload {
        actor = actor != null && !actor.isBlank() ? actor : AuditEvent.SYSTEM_ACTOR;
        evidenceIds = evidenceIds != null ? List.copyOf(evidenceIds) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static TransitionPayload empty() {
        return new TransitionPayload(null, null, null);
    }

    public static TransitionPayload by(String actor) {
        return new TransitionPayload(actor, null, null);
    }
}
