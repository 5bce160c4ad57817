package com.aegis.engine.ledger;

/**
 * Submitted evidence was rejected before it reached the chain.
 */
public class EvidenceIngestionException extends RuntimeException {

    public EvidenceIngestionException(String message) {
        super(message);
    }
}
