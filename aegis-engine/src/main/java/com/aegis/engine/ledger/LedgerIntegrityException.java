package com.aegis.engine.ledger;

/**
 * A chain no longer verifies, or the store diverged from the head this ledger
 * last wrote. Never recovered automatically.
 */
public class LedgerIntegrityException extends RuntimeException {

    private final String projectId;

    public LedgerIntegrityException(String projectId, String message) {
        super("Ledger integrity violation for project " + projectId + ": " + message);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
