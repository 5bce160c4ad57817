package com.aegis.core.domain;

/**
 * Payload kind wrapped by a {@link LedgerRecord}.
 */
public enum RecordKind {
    EVIDENCE,
    AUDIT_EVENT
}
