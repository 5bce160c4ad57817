package com.aegis.engine.workflow;

/**
 * Notifications emitted by a {@link PhaseStateMachine}.
 */
public enum WorkflowEventType {
    TRANSITION,
    TRANSITION_BLOCKED,
    TRANSITION_REJECTED,
    GATE_EVALUATED,
    PARALLEL_STATE_CHANGED,

    // Wildcard for subscribing to all events
    ALL
}
