package com.aegis.core.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A committed phase change.
 */
public record StateTransition(
        String id,
        String from,
        String to,
        String event,
        String actor,
        List<String> evidenceIds,
        List<String> gateResultIds,
        Instant timestamp
) {
    public StateTransition {
        Objects.requireNonNull(id, "Transition ID cannot be null");
        Objects.requireNonNull(from, "From phase cannot be null");
        Objects.requireNonNull(to, "To phase cannot be null");
        Objects.requireNonNull(event, "Event cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        actor = actor != null ? actor : AuditEvent.SYSTEM_ACTOR;
        evidenceIds = evidenceIds != null ? List.copyOf(evidenceIds) : List.of();
        gateResultIds = gateResultIds != null ? List.copyOf(gateResultIds) : List.of();
    }
}
