package com.aegis.engine.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One phase of a workflow.
 *
 * @param requiredGates gates that must pass before the phase can be entered
 * @param on            event name to target phase, in declaration order
 */
public record PhaseDefinition(
        String name,
        String description,
        boolean terminal,
        List<String> requiredGates,
        Map<String, String> on
) {
    public PhaseDefinition {
        Objects.requireNonNull(name, "Phase name cannot be null");
        requiredGates = requiredGates != null ? List.copyOf(requiredGates) : List.of();
        on = on != null ? Collections.unmodifiableMap(new LinkedHashMap<>(on)) : Map.of();
        if (terminal && !on.isEmpty()) {
            throw new IllegalArgumentException("Terminal phase " + name + " cannot have transitions");
        }
    }

    public String target(String event) {
        return event != null ? on.get(event) : null;
    }
}
