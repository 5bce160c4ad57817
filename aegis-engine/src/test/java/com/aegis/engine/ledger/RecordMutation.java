package com.aegis.engine.ledger;

import com.aegis.core.domain.AuditEvent;
import com.aegis.core.domain.Evidence;
import com.aegis.core.domain.LedgerRecord;
import com.aegis.core.domain.RecordKind;
import com.aegis.core.domain.SignedEvidence;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Base64;

/**
 * Single-field edits of a stored record.
 */
enum RecordMutation {
    ID, PROJECT_ID, RUN_ID, KIND, CHAIN_INDEX, PAYLOAD, PAYLOAD_HASH, PREVIOUS_HASH,
    SIGNATURE, SIGNED_BY, KEY_ID, SIGNED_AT, TIMESTAMP;

    LedgerRecord apply(LedgerRecord r) {
        return switch (this) {
            case ID -> copy(r, r.id() + "-x", r.projectId(), r.runId(), r.kind(), r.chainIndex(), r.evidence(),
                    r.auditEvent(), r.payloadHash(), r.previousHash(), r.signature(), r.signedBy(), r.keyId(), r);
            case PROJECT_ID -> copy(r, r.id(), r.projectId() + "-x", r.runId(), r.kind(), r.chainIndex(),
                    r.evidence(), r.auditEvent(), r.payloadHash(), r.previousHash(), r.signature(), r.signedBy(),
                    r.keyId(), r);
            case RUN_ID -> copy(r, r.id(), r.projectId(), r.runId() + "-x", r.kind(), r.chainIndex(),
                    r.evidence(), r.auditEvent(), r.payloadHash(), r.previousHash(), r.signature(), r.signedBy(),
                    r.keyId(), r);
            case KIND -> copy(r, r.id(), r.projectId(), r.runId(),
                    r.kind() == RecordKind.EVIDENCE ? RecordKind.AUDIT_EVENT : RecordKind.EVIDENCE,
                    r.chainIndex(), r.evidence(), r.auditEvent(), r.payloadHash(), r.previousHash(),
                    r.signature(), r.signedBy(), r.keyId(), r);
            case CHAIN_INDEX -> copy(r, r.id(), r.projectId(), r.runId(), r.kind(), r.chainIndex() + 1,
                    r.evidence(), r.auditEvent(), r.payloadHash(), r.previousHash(), r.signature(), r.signedBy(),
                    r.keyId(), r);
            case PAYLOAD -> r.kind() == RecordKind.EVIDENCE
                    ? copy(r, r.id(), r.projectId(), r.runId(), r.kind(), r.chainIndex(), tamper(r.evidence()),
                    r.auditEvent(), r.payloadHash(), r.previousHash(), r.signature(), r.signedBy(), r.keyId(), r)
                    : copy(r, r.id(), r.projectId(), r.runId(), r.kind(), r.chainIndex(), r.evidence(),
                    tamper(r.auditEvent()), r.payloadHash(), r.previousHash(), r.signature(), r.signedBy(),
                    r.keyId(), r);
            case PAYLOAD_HASH -> copy(r, r.id(), r.projectId(), r.runId(), r.kind(), r.chainIndex(),
                    r.evidence(), r.auditEvent(), flip(r.payloadHash()), r.previousHash(), r.signature(),
                    r.signedBy(), r.keyId(), r);
            case PREVIOUS_HASH -> copy(r, r.id(), r.projectId(), r.runId(), r.kind(), r.chainIndex(),
                    r.evidence(), r.auditEvent(), r.payloadHash(), flip(r.previousHash()), r.signature(),
                    r.signedBy(), r.keyId(), r);
            case SIGNATURE -> copy(r, r.id(), r.projectId(), r.runId(), r.kind(), r.chainIndex(),
                    r.evidence(), r.auditEvent(), r.payloadHash(), r.previousHash(),
                    Base64.getEncoder().encodeToString(new byte[]{1, 2, 3, 4}), r.signedBy(), r.keyId(), r);
            case SIGNED_BY -> copy(r, r.id(), r.projectId(), r.runId(), r.kind(), r.chainIndex(),
                    r.evidence(), r.auditEvent(), r.payloadHash(), r.previousHash(), r.signature(),
                    r.signedBy() + "-x", r.keyId(), r);
            case KEY_ID -> copy(r, r.id(), r.projectId(), r.runId(), r.kind(), r.chainIndex(),
                    r.evidence(), r.auditEvent(), r.payloadHash(), r.previousHash(), r.signature(), r.signedBy(),
                    "key-unknown", r);
            case SIGNED_AT -> new LedgerRecord(r.id(), r.projectId(), r.runId(), r.kind(), r.chainIndex(),
                    r.evidence(), r.auditEvent(), r.payloadHash(), r.previousHash(), r.signature(), r.signedBy(),
                    r.keyId(), r.signedAt().plusSeconds(1), r.timestamp());
            case TIMESTAMP -> new LedgerRecord(r.id(), r.projectId(), r.runId(), r.kind(), r.chainIndex(),
                    r.evidence(), r.auditEvent(), r.payloadHash(), r.previousHash(), r.signature(), r.signedBy(),
                    r.keyId(), r.signedAt(), r.timestamp().minusSeconds(1));
        };
    }

    private static LedgerRecord copy(LedgerRecord original, String id, String projectId, String runId,
                                     RecordKind kind, long chainIndex, SignedEvidence evidence,
                                     AuditEvent auditEvent, String payloadHash, String previousHash,
                                     String signature, String signedBy, String keyId, LedgerRecord times) {
        return new LedgerRecord(id, projectId, runId, kind, chainIndex, evidence, auditEvent, payloadHash,
                previousHash, signature, signedBy, keyId, times.signedAt(), times.timestamp());
    }

    private static SignedEvidence tamper(SignedEvidence signed) {
        Evidence e = signed.evidence();
        Evidence changed = new Evidence(e.id(), e.projectId(), e.runId(), e.source(), e.type(), e.timestamp(),
                JsonNodeFactory.instance.objectNode().put("tampered", true), e.metadata());
        return new SignedEvidence(changed, signed.contentHash(), signed.signature(), signed.signedAt(),
                signed.signedBy(), signed.keyId());
    }

    private static AuditEvent tamper(AuditEvent event) {
        return new AuditEvent(event.type(), event.actor(), event.action() + "-x", event.resource(),
                event.projectId(), event.runId(), event.phase(), event.metadata(), event.timestamp());
    }

    private static String flip(String hex) {
        char first = hex.charAt(0);
        return (first == '0' ? '1' : '0') + hex.substring(1);
    }
}
