package com.aegis.engine.workflow;

import com.aegis.engine.config.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of a workflow: ordered phases, an initial phase and the
 * transition table. Validated on construction; every transition must target a
 * declared phase.
 */
public record WorkflowDefinition(
        String id,
        String version,
        String title,
        String initialState,
        List<PhaseDefinition> phases
) {
    public WorkflowDefinition {
        Objects.requireNonNull(id, "Workflow ID cannot be null");
        Objects.requireNonNull(initialState, "Initial state cannot be null");
        phases = phases != null ? List.copyOf(phases) : List.of();

        Set<String> names = new LinkedHashSet<>();
        for (PhaseDefinition phase : phases) {
            if (!names.add(phase.name())) {
                throw new ConfigurationException("Workflow " + id + " declares phase " + phase.name() + " twice");
            }
        }
        if (!names.contains(initialState)) {
            throw new ConfigurationException("Workflow " + id + " has undeclared initial state " + initialState);
        }
        for (PhaseDefinition phase : phases) {
            phase.on().forEach((event, target) -> {
                if (!names.contains(target)) {
                    throw new ConfigurationException("Workflow " + id + ": " + phase.name() + " --" + event
                            + "--> undeclared phase " + target);
                }
            });
        }
    }

    /**
     * @throws IllegalArgumentException if the phase is not declared
     */
    public PhaseDefinition phase(String name) {
        for (PhaseDefinition phase : phases) {
            if (phase.name().equals(name)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + name);
    }

    public List<String> phaseNames() {
        return phases.stream().map(PhaseDefinition::name).toList();
    }

    /**
     * Every gate id referenced by any phase, in first-reference order.
     */
    public Set<String> requiredGateIds() {
        Set<String> ids = new LinkedHashSet<>();
        phases.forEach(phase -> ids.addAll(phase.requiredGates()));
        return Collections.unmodifiableSet(ids);
    }

    public Map<String, String> transitionsFrom(String phase) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(phase(phase).on()));
    }
}
