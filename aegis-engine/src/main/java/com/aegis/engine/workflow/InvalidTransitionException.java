package com.aegis.engine.workflow;

/**
 * The event has no transition from the current phase. The phase is unchanged.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String phase;
    private final String event;

    public InvalidTransitionException(String phase, String event) {
        super("Invalid transition: " + event + " is not allowed from " + phase);
        this.phase = phase;
        this.event = event;
    }

    public String getPhase() {
        return phase;
    }

    public String getEvent() {
        return event;
    }
}
