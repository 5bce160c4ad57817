package com.aegis.engine.workflow;

import com.aegis.core.domain.ParallelState;
import com.aegis.core.domain.StateTransition;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a state machine.
 */
public record StateSnapshot(
        String workflowId,
        String projectId,
        String runId,
        String currentPhase,
        boolean terminal,
        List<String> availableTransitions,
        List<StateTransition> history,
        Map<ParallelState.Type, ParallelState> parallelStates
) {
    public StateSnapshot {
        availableTransitions = List.copyOf(availableTransitions);
        history = List.copyOf(history);
        parallelStates = Map.copyOf(parallelStates);
    }
}
