package com.aegis.engine.ledger;

import java.util.List;

/**
 * Outcome of walking one project's chain.
 *
 * @param valid   true when every record checked out
 * @param checked number of records walked
 * @param error   first problem found, or null
 * @param errors  every problem found, in chain order
 */
public record ChainVerification(
        String projectId,
        boolean valid,
        int checked,
        String error,
        List<String> errors
) {
    public ChainVerification {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    static ChainVerification of(String projectId, int checked, List<String> errors) {
        return new ChainVerification(projectId, errors.isEmpty(), checked,
                errors.isEmpty() ? null : errors.get(0), errors);
    }
}
