package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;

/**
 * Evidence together with its content hash and signature.
 */
public record SignedEvidence(
        Evidence evidence,
        String contentHash,
        String signature,
        Instant signedAt,
        String signedBy,
        String keyId
) {
    public SignedEvidence {
        Objects.requireNonNull(evidence, "Evidence cannot be null");
        Objects.requireNonNull(contentHash, "Content hash cannot be null");
        Objects.requireNonNull(signature, "Signature cannot be null");
        Objects.requireNonNull(signedAt, "Signed at cannot be null");
        Objects.requireNonNull(signedBy, "Signed by cannot be null");
        Objects.requireNonNull(keyId, "Key ID cannot be null");
    }

    @JsonIgnore
    public String id() {
        return evidence.id();
    }
}
