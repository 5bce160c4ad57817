package com.aegis.engine.ledger;

import com.aegis.core.domain.LedgerRecord;

import java.util.List;
import java.util.Map;

/**
 * Raw record storage behind {@link ProvenanceLedger}. Stores never compute
 * hashes or signatures; they only keep what they are given, per project, in
 * append order.
 */
public interface LedgerStore {

    /**
     * Durably appends a record to its project's sequence.
     */
    void append(LedgerRecord record);

    /**
     * Records of a project in append order; empty if the project is unknown.
     */
    List<LedgerRecord> records(String projectId);

    /**
     * @return the most recently appended record of a project, or null
     */
    LedgerRecord last(String projectId);

    /**
     * Known projects, in the order their first record was appended.
     */
    List<String> projectIds();

    /**
     * Persists a public key so records remain verifiable after a restart.
     * Storing an id that already exists is a no-op.
     */
    void storePublicKey(String keyId, String pem);

    /**
     * Public keys as PEM, keyed by key id.
     */
    Map<String, String> publicKeys();

    /**
     * Projects whose stored data could not be read at all, with the reason.
     */
    default Map<String, String> unreadableProjects() {
        return Map.of();
    }
}
