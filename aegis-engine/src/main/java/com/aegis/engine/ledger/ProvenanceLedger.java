package com.aegis.engine.ledger;

import com.aegis.core.domain.AuditEvent;
import com.aegis.core.domain.Evidence;
import com.aegis.core.domain.LedgerRecord;
import com.aegis.core.domain.RecordKind;
import com.aegis.core.domain.SignedEvidence;
import com.aegis.core.json.CanonicalJson;
import com.aegis.engine.signer.EvidenceSigner;
import com.aegis.engine.signer.SignerException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-chained, signed record store, one chain per project.
 * <p>
 * Each record's header (every field but the signature) is signed; the record
 * hash covers the header and the signature, and the next record's
 * {@code previousHash} must equal it. The first record links to
 * {@link LedgerRecord#GENESIS_HASH}.
 * <p>
 * Appends to one project are serialized by a per-project lock and checked
 * against the head this ledger last wrote. Projects whose stored chain fails
 * verification (at open time or on a later {@link #verifyChain}) are
 * quarantined: they are neither extended nor served until an operator steps in.
 */
public class ProvenanceLedger {

    private static final Logger log = LoggerFactory.getLogger(ProvenanceLedger.class);

    public static final String DEFAULT_SIGNER_ID = "aegis-ledger";

    private final LedgerStore store;
    private final EvidenceSigner signer;
    private final String signerId;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, ChainHead> heads = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> evidenceIds = new ConcurrentHashMap<>();
    private final Map<String, ChainVerification> quarantined = new ConcurrentHashMap<>();
    private final Set<String> persistedKeys = ConcurrentHashMap.newKeySet();
    private final Map<String, String> rejectedKeys = new ConcurrentHashMap<>();

    public ProvenanceLedger(LedgerStore store, EvidenceSigner signer, String signerId, Clock clock) {
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.signer = Objects.requireNonNull(signer, "Signer cannot be null");
        this.signerId = signerId != null ? signerId : DEFAULT_SIGNER_ID;
        this.clock = clock != null ? clock : Clock.systemUTC();
        open();
    }

    public ProvenanceLedger(LedgerStore store, EvidenceSigner signer) {
        this(store, signer, DEFAULT_SIGNER_ID, Clock.systemUTC());
    }

    // ==================== Ingestion ====================

    /**
     * Validates, signs and appends evidence.
     *
     * @throws EvidenceIngestionException on a blank id, project or source, or an
     *                                    id already used in the project
     */
    public LedgerRecord appendEvidence(Evidence evidence) {
        Objects.requireNonNull(evidence, "Evidence cannot be null");
        requireText(evidence.id(), "id");
        requireText(evidence.projectId(), "projectId");
        requireText(evidence.source(), "source");

        String projectId = evidence.projectId();
        ReentrantLock lock = lockFor(projectId);
        lock.lock();
        try {
            Set<String> ids = knownEvidenceIds(projectId);
            if (ids.contains(evidence.id())) {
                throw new EvidenceIngestionException(
                        "Evidence " + evidence.id() + " already exists in project " + projectId);
            }
            SignedEvidence signed = signer.sign(evidence, signerId);
            LedgerRecord record = append(projectId, evidence.runId(), RecordKind.EVIDENCE,
                    signed, null, evidence.timestamp());
            ids.add(evidence.id());
            log.debug("Appended evidence {} ({}) to project {} at index {}",
                    evidence.id(), evidence.type(), projectId, record.chainIndex());
            return record;
        } finally {
            lock.unlock();
        }
    }

    public LedgerRecord appendAuditEvent(AuditEvent event) {
        Objects.requireNonNull(event, "Audit event cannot be null");
        if (event.projectId() == null || event.projectId().isBlank()) {
            throw new IllegalArgumentException("Audit event must name a project");
        }
        ReentrantLock lock = lockFor(event.projectId());
        lock.lock();
        try {
            return append(event.projectId(), event.runId(), RecordKind.AUDIT_EVENT, null, event, event.timestamp());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records one agent action as an audit event.
     */
    public LedgerRecord recordAgentAction(String projectId, String runId, String phase, String agentId,
                                          String action, String taskId, boolean success, Duration duration,
                                          List<String> evidenceIds) {
        return appendAuditEvent(AuditEvent.agentAction(projectId, runId, phase, agentId, action, taskId,
                success, duration, evidenceIds, clock.instant()));
    }

    // Caller holds the project lock.
    private LedgerRecord append(String projectId, String runId, RecordKind kind,
                                SignedEvidence evidence, AuditEvent auditEvent, Instant timestamp) {
        requireServable(projectId);
        LedgerRecord last = store.last(projectId);
        checkHead(projectId, last);

        long chainIndex = last == null ? 0 : last.chainIndex() + 1;
        String previousHash = last == null ? LedgerRecord.GENESIS_HASH : hashRecord(last);
        String payloadHash = signer.hashContent(kind == RecordKind.EVIDENCE ? evidence : auditEvent);
        String keyId = signer.ensureKey();
        persistKey(keyId);
        Instant signedAt = clock.instant();
        String id = "rec_" + UUID.randomUUID();

        ObjectNode header = header(id, projectId, runId, kind, chainIndex, payloadHash, previousHash,
                signerId, keyId, signedAt, timestamp);
        String signature = signer.signPayload(header, keyId);
        LedgerRecord record = new LedgerRecord(id, projectId, runId, kind, chainIndex, evidence, auditEvent,
                payloadHash, previousHash, signature, signerId, keyId, signedAt, timestamp);

        store.append(record);
        heads.put(projectId, new ChainHead(chainIndex, hashRecord(record)));
        return record;
    }

    // ==================== Verification ====================

    /**
     * Walks a project's records in chain order checking index, linkage,
     * payload hash, evidence signature and record signature. A failing chain
     * quarantines the project.
     */
    public ChainVerification verifyChain(String projectId) {
        Objects.requireNonNull(projectId, "Project ID cannot be null");
        String unreadableReason = store.unreadableProjects().get(projectId);
        if (unreadableReason != null) {
            ChainVerification result = ChainVerification.of(projectId, 0, List.of("Unreadable: " + unreadableReason));
            quarantine(result);
            return result;
        }

        List<LedgerRecord> records = store.records(projectId);
        List<String> errors = new ArrayList<>();
        String expectedPrevious = LedgerRecord.GENESIS_HASH;
        for (int i = 0; i < records.size(); i++) {
            LedgerRecord record = records.get(i);
            checkRecord(projectId, i, record, expectedPrevious, errors);
            expectedPrevious = hashRecord(record);
        }

        ChainVerification result = ChainVerification.of(projectId, records.size(), errors);
        if (!result.valid()) {
            quarantine(result);
        }
        return result;
    }

    private void checkRecord(String projectId, int position, LedgerRecord record, String expectedPrevious,
                             List<String> errors) {
        String at = "Record " + position + " (" + record.id() + ")";
        if (record.chainIndex() != position) {
            errors.add(at + ": chain index " + record.chainIndex() + " out of sequence");
        }
        if (!projectId.equals(record.projectId())) {
            errors.add(at + ": belongs to project " + record.projectId());
        }
        if (!expectedPrevious.equals(record.previousHash())) {
            errors.add(at + ": previous hash does not link to the prior record");
        }
        Object payload = record.payload();
        if (payload == null) {
            errors.add(at + ": missing " + record.kind() + " payload");
        } else if (!signer.hashContent(payload).equals(record.payloadHash())) {
            errors.add(at + ": payload hash mismatch");
        }
        if (record.kind() == RecordKind.EVIDENCE && record.evidence() != null && !signer.verify(record.evidence())) {
            errors.add(at + ": evidence signature invalid" + keyRejection(record.evidence().keyId()));
        }
        if (!signer.verifyPayload(header(record), record.signature(), record.keyId())) {
            errors.add(at + ": record signature invalid" + keyRejection(record.keyId()));
        }
    }

    private String keyRejection(String keyId) {
        String reason = keyId != null ? rejectedKeys.get(keyId) : null;
        return reason == null ? "" : " (stored public key " + keyId + " was rejected: " + reason + ")";
    }

    public boolean isQuarantined(String projectId) {
        return quarantined.containsKey(projectId);
    }

    // ==================== Queries ====================

    public List<LedgerRecord> list(String projectId) {
        return list(projectId, RecordFilter.all());
    }

    /**
     * Records of a project in append order, regardless of their timestamps.
     *
     * @throws LedgerIntegrityException if the project is quarantined
     */
    public List<LedgerRecord> list(String projectId, RecordFilter filter) {
        Objects.requireNonNull(projectId, "Project ID cannot be null");
        requireServable(projectId);
        RecordFilter effective = filter != null ? filter : RecordFilter.all();
        return store.records(projectId).stream()
                .filter(effective::matches)
                .toList();
    }

    /**
     * Records of every project sharing a run. Projects appear in the order
     * they were first appended to; each project's records in append order.
     * Quarantined projects are left out.
     */
    public List<LedgerRecord> findByRun(String runId) {
        Objects.requireNonNull(runId, "Run ID cannot be null");
        List<LedgerRecord> result = new ArrayList<>();
        for (String projectId : store.projectIds()) {
            if (isQuarantined(projectId)) {
                log.warn("Skipping quarantined project {} in run lookup {}", projectId, runId);
                continue;
            }
            for (LedgerRecord record : store.records(projectId)) {
                if (runId.equals(record.runId())) {
                    result.add(record);
                }
            }
        }
        return result;
    }

    /**
     * Verified evidence of a project, optionally restricted to one run, in
     * append order. Items whose signature no longer verifies are left out.
     */
    public List<Evidence> evidence(String projectId, String runId) {
        List<Evidence> result = new ArrayList<>();
        for (LedgerRecord record : list(projectId, RecordFilter.all().withKind(RecordKind.EVIDENCE))) {
            SignedEvidence signed = record.evidence();
            if (signed == null || (runId != null && !runId.equals(record.runId()))) {
                continue;
            }
            if (signer.verify(signed)) {
                result.add(signed.evidence());
            } else {
                log.warn("Excluding evidence {} of project {}: signature no longer verifies",
                        signed.id(), projectId);
            }
        }
        return result;
    }

    public List<String> projectIds() {
        return store.projectIds();
    }

    /**
     * @throws LedgerIntegrityException if the project is quarantined
     */
    public int size(String projectId) {
        Objects.requireNonNull(projectId, "Project ID cannot be null");
        requireServable(projectId);
        return store.records(projectId).size();
    }

    // ==================== Export ====================

    /**
     * Builds an audit handoff manifest for a project. Quarantined projects
     * can still be exported; {@code chainValid} then reports false.
     */
    public LedgerExport export(String projectId) {
        Objects.requireNonNull(projectId, "Project ID cannot be null");
        ChainVerification verification = verifyChain(projectId);
        List<LedgerRecord> records = store.records(projectId);
        String headHash = records.isEmpty()
                ? LedgerRecord.GENESIS_HASH
                : hashRecord(records.get(records.size() - 1));

        Map<String, String> publicKeys = new LinkedHashMap<>();
        String keyId = signer.ensureKey();
        persistKey(keyId);
        publicKeys.put(keyId, signer.exportPublicKey(keyId));
        for (LedgerRecord record : records) {
            addPublicKey(publicKeys, record.keyId());
            if (record.evidence() != null) {
                addPublicKey(publicKeys, record.evidence().keyId());
            }
        }

        Instant exportedAt = clock.instant();
        ObjectNode manifest = manifest(projectId, records.size(), verification.valid(), headHash, exportedAt, keyId);
        String manifestHash = signer.hashContent(manifest);
        String manifestSignature = signer.signPayload(manifest, keyId);
        log.info("Exported {} record(s) of project {} (chain valid: {})",
                records.size(), projectId, verification.valid());
        return new LedgerExport(projectId, records.size(), verification.valid(), verification.errors(), records,
                headHash, exportedAt, keyId, publicKeys, manifestHash, manifestSignature);
    }

    /**
     * Exports a project and writes the manifest to {@code target} as pretty JSON.
     */
    public LedgerExport writeExport(String projectId, Path target) {
        LedgerExport export = export(projectId);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            CanonicalJson.mapper().writerWithDefaultPrettyPrinter().writeValue(target.toFile(), export);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write export of project " + projectId + " to " + target, e);
        }
        return export;
    }

    /**
     * Checks an export's manifest hash and signature using only the public
     * key carried inside the export.
     */
    public static boolean verifyExport(LedgerExport export) {
        if (export == null || export.keyId() == null) {
            return false;
        }
        String pem = export.publicKeys().get(export.keyId());
        if (pem == null) {
            return false;
        }
        try {
            PublicKey publicKey = EvidenceSigner.parsePublicKey(pem);
            ObjectNode manifest = manifest(export.projectId(), export.recordCount(), export.chainValid(),
                    export.headHash(), export.exportedAt(), export.keyId());
            byte[] bytes = CanonicalJson.canonicalBytes(manifest);
            return EvidenceSigner.sha256Hex(bytes).equals(export.manifestHash())
                    && EvidenceSigner.verifyDetached(bytes, export.manifestSignature(), publicKey);
        } catch (SignerException e) {
            log.debug("Export manifest key is malformed: {}", e.getMessage());
            return false;
        }
    }

    // ==================== Internals ====================

    private void open() {
        store.publicKeys().forEach((keyId, pem) -> {
            try {
                signer.trustPublicKey(keyId, pem);
                persistedKeys.add(keyId);
            } catch (SignerException e) {
                log.error("Refusing stored public key {}: {}", keyId, e.getMessage());
                rejectedKeys.put(keyId, e.getMessage());
            }
        });

        List<String> projects = new ArrayList<>(store.projectIds());
        store.unreadableProjects().keySet().stream()
                .filter(projectId -> !projects.contains(projectId))
                .forEach(projects::add);
        for (String projectId : projects) {
            ChainVerification verification = verifyChain(projectId);
            if (verification.valid()) {
                LedgerRecord last = store.last(projectId);
                if (last != null) {
                    heads.put(projectId, new ChainHead(last.chainIndex(), hashRecord(last)));
                }
            }
        }
        if (!projects.isEmpty()) {
            log.info("Ledger opened: {} project(s), {} quarantined", projects.size(), quarantined.size());
        }
    }

    private void checkHead(String projectId, LedgerRecord last) {
        ChainHead head = heads.get(projectId);
        if (head == null) {
            if (last != null) {
                throw new LedgerIntegrityException(projectId,
                        "store holds record " + last.chainIndex() + " that this ledger never wrote");
            }
            return;
        }
        if (last == null || last.chainIndex() != head.chainIndex() || !hashRecord(last).equals(head.hash())) {
            LedgerIntegrityException failure = new LedgerIntegrityException(projectId,
                    "last stored record no longer matches head " + head.chainIndex());
            quarantine(ChainVerification.of(projectId, 0, List.of(failure.getMessage())));
            throw failure;
        }
    }

    private void requireServable(String projectId) {
        ChainVerification failure = quarantined.get(projectId);
        if (failure != null) {
            throw new LedgerIntegrityException(projectId, "project is quarantined: " + failure.error());
        }
    }

    private void quarantine(ChainVerification verification) {
        if (quarantined.putIfAbsent(verification.projectId(), verification) == null) {
            log.error("Quarantined project {}: {}", verification.projectId(), verification.errors());
        }
    }

    private ReentrantLock lockFor(String projectId) {
        return locks.computeIfAbsent(projectId, k -> new ReentrantLock());
    }

    // Caller holds the project lock.
    private Set<String> knownEvidenceIds(String projectId) {
        return evidenceIds.computeIfAbsent(projectId, k -> {
            Set<String> ids = new HashSet<>();
            for (LedgerRecord record : store.records(projectId)) {
                if (record.evidence() != null) {
                    ids.add(record.evidence().id());
                }
            }
            return ids;
        });
    }

    private void persistKey(String keyId) {
        if (persistedKeys.add(keyId)) {
            store.storePublicKey(keyId, signer.exportPublicKey(keyId));
        }
    }

    private void addPublicKey(Map<String, String> publicKeys, String keyId) {
        if (keyId != null && !publicKeys.containsKey(keyId)) {
            String pem = signer.exportPublicKey(keyId);
            if (pem != null) {
                publicKeys.put(keyId, pem);
            }
        }
    }

    /**
     * Hash of a stored record: SHA-256 over its canonical header plus signature.
     */
    public String hashRecord(LedgerRecord record) {
        ObjectNode node = header(record);
        node.put("signature", record.signature());
        return signer.hashContent(node);
    }

    private static ObjectNode header(LedgerRecord record) {
        return header(record.id(), record.projectId(), record.runId(), record.kind(), record.chainIndex(),
                record.payloadHash(), record.previousHash(), record.signedBy(), record.keyId(),
                record.signedAt(), record.timestamp());
    }

    private static ObjectNode header(String id, String projectId, String runId, RecordKind kind, long chainIndex,
                                     String payloadHash, String previousHash, String signedBy, String keyId,
                                     Instant signedAt, Instant timestamp) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", id);
        node.put("projectId", projectId);
        node.put("runId", runId);
        node.put("kind", kind.name());
        node.put("chainIndex", chainIndex);
        node.put("payloadHash", payloadHash);
        node.put("previousHash", previousHash);
        node.put("signedBy", signedBy);
        node.put("keyId", keyId);
        node.put("signedAt", signedAt.toString());
        node.put("timestamp", timestamp.toString());
        return node;
    }

    private static ObjectNode manifest(String projectId, int recordCount, boolean chainValid, String headHash,
                                       Instant exportedAt, String keyId) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("projectId", projectId);
        node.put("recordCount", recordCount);
        node.put("chainValid", chainValid);
        node.put("headHash", headHash);
        node.put("exportedAt", exportedAt.toString());
        node.put("keyId", keyId);
        return node;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new EvidenceIngestionException("Evidence " + field + " is required");
        }
    }

    private record ChainHead(long chainIndex, String hash) {
    }
}
