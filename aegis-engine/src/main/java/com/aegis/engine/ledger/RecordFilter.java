package com.aegis.engine.ledger;

import com.aegis.core.domain.EvidenceType;
import com.aegis.core.domain.LedgerRecord;
import com.aegis.core.domain.RecordKind;

import java.time.Instant;

/**
 * Conjunctive filter for {@link ProvenanceLedger#list(String, RecordFilter)}.
 * Null fields match everything; the timestamp range is inclusive on both ends.
 *
 * @param source evidence source or audit actor
 * @param type   evidence wire type ("test_report") or audit event type
 */
public record RecordFilter(
        String source,
        String type,
        RecordKind kind,
        Instant from,
        Instant to
) {
    public static RecordFilter all() {
        return new RecordFilter(null, null, null, null, null);
    }

    public RecordFilter withSource(String newSource) {
        return new RecordFilter(newSource, type, kind, from, to);
    }

    public RecordFilter withType(String newType) {
        return new RecordFilter(source, newType, kind, from, to);
    }

    public RecordFilter withType(EvidenceType evidenceType) {
        return new RecordFilter(source, evidenceType.wireName(), RecordKind.EVIDENCE, from, to);
    }

    public RecordFilter withKind(RecordKind newKind) {
        return new RecordFilter(source, type, newKind, from, to);
    }

    public RecordFilter between(Instant newFrom, Instant newTo) {
        return new RecordFilter(source, type, kind, newFrom, newTo);
    }

    public boolean matches(LedgerRecord record) {
        if (kind != null && record.kind() != kind) {
            return false;
        }
        if (source != null && !source.equals(record.source())) {
            return false;
        }
        if (type != null && !type.equals(record.payloadType())) {
            return false;
        }
        if (from != null && record.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || !record.timestamp().isAfter(to);
    }
}
