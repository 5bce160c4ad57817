package com.aegis.engine.gate;

import com.aegis.core.domain.GateResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A blocking gate did not pass. Carries every result that blocked, each of
 * which names its unsatisfied checks and the evidence consulted.
 */
public class PolicyViolationException extends RuntimeException {

    private final List<GateResult> results;

    public PolicyViolationException(String context, List<GateResult> results) {
        super(context + ": " + results.stream()
                .map(GateResult::describeFailure)
                .collect(Collectors.joining(" | ")));
        this.results = List.copyOf(results);
    }

    public List<GateResult> getResults() {
        return results;
    }
}
