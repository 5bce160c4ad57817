package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * Chained, signed unit of durability. Wraps exactly one payload: signed
 * evidence for {@link RecordKind#EVIDENCE}, an audit event for
 * {@link RecordKind#AUDIT_EVENT}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerRecord(
        String id,
        String projectId,
        String runId,
        RecordKind kind,
        long chainIndex,
        SignedEvidence evidence,
        AuditEvent auditEvent,
        String payloadHash,
        String previousHash,
        String signature,
        String signedBy,
        String keyId,
        Instant signedAt,
        Instant timestamp
) {
    /** previousHash of the first record in every chain. */
    public static final String GENESIS_HASH = "0".repeat(64);

    public LedgerRecord {
        Objects.requireNonNull(id, "Record ID cannot be null");
        Objects.requireNonNull(projectId, "Project ID cannot be null");
        Objects.requireNonNull(kind, "Record kind cannot be null");
        Objects.requireNonNull(payloadHash, "Payload hash cannot be null");
        Objects.requireNonNull(previousHash, "Previous hash cannot be null");
        Objects.requireNonNull(signature, "Signature cannot be null");
        Objects.requireNonNull(signedBy, "Signed by cannot be null");
        Objects.requireNonNull(keyId, "Key ID cannot be null");
        Objects.requireNonNull(signedAt, "Signed at cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        if (chainIndex < 0) {
            throw new IllegalArgumentException("Chain index cannot be negative");
        }
    }

    /**
     * The wrapped payload, whichever kind it is.
     */
    @JsonIgnore
    public Object payload() {
        return kind == RecordKind.EVIDENCE ? evidence : auditEvent;
    }

    /**
     * Source of the wrapped payload: the evidence source or the audit actor.
     */
    @JsonIgnore
    public String source() {
        if (kind == RecordKind.EVIDENCE) {
            return evidence != null ? evidence.evidence().source() : null;
        }
        return auditEvent != null ? auditEvent.actor() : null;
    }

    /**
     * Type of the wrapped payload: the evidence wire type or the audit event type.
     */
    @JsonIgnore
    public String payloadType() {
        if (kind == RecordKind.EVIDENCE) {
            return evidence != null ? evidence.evidence().type().wireName() : null;
        }
        return auditEvent != null ? auditEvent.type() : null;
    }
}
