package com.aegis.engine.ledger;

import com.aegis.core.domain.LedgerRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit handoff artifact for one project. Records, hashes and signatures are
 * included verbatim so a third party can re-verify the chain with the
 * exported public keys.
 *
 * @param headHash          hash of the last record, or the genesis hash
 * @param manifestHash      SHA-256 of the canonical manifest
 * @param manifestSignature signature over the manifest by {@code keyId}
 */
public record LedgerExport(
        String projectId,
        int recordCount,
        boolean chainValid,
        List<String> verificationErrors,
        List<LedgerRecord> records,
        String headHash,
        Instant exportedAt,
        String keyId,
        Map<String, String> publicKeys,
        String manifestHash,
        String manifestSignature
) {
    public LedgerExport {
        verificationErrors = verificationErrors != null ? List.copyOf(verificationErrors) : List.of();
        records = records != null ? List.copyOf(records) : List.of();
        publicKeys = publicKeys != null ? Map.copyOf(publicKeys) : Map.of();
    }
}
