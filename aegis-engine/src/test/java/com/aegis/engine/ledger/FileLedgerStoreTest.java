package com.aegis.engine.ledger;

import com.aegis.core.domain.AuditEvent;
import com.aegis.core.domain.LedgerRecord;
import com.aegis.engine.Fixtures;
import com.aegis.engine.signer.EvidenceSigner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileLedgerStoreTest {

    @TempDir
    Path directory;

    @Test
    void ledgerSurvivesRestartAndKeepsExtendingTheChain() {
        ProvenanceLedger first = new ProvenanceLedger(new FileLedgerStore(directory), new EvidenceSigner());
        first.appendEvidence(Fixtures.testReport("ev-1", "proj/one", "run", 0, 12));
        first.appendAuditEvent(AuditEvent.stateTransition("proj/one", "run", "idle", "phase_0_discovery",
                "INIT_PROJECT", "alice", Map.of(), Fixtures.T0));
        first.appendEvidence(Fixtures.testReport("ev-1", "proj-two", "run", 0, 1));

        // A new process: fresh signer, same directory.
        ProvenanceLedger reopened = new ProvenanceLedger(new FileLedgerStore(directory), new EvidenceSigner());

        assertThat(reopened.projectIds()).containsExactly("proj/one", "proj-two");
        assertThat(reopened.list("proj/one")).hasSize(2);
        assertThat(reopened.verifyChain("proj/one").valid()).isTrue();
        assertThat(reopened.evidence("proj/one", "run")).hasSize(1);

        LedgerRecord appended = reopened.appendEvidence(Fixtures.testReport("ev-2", "proj/one", "run", 0, 13));

        assertThat(appended.chainIndex()).isEqualTo(2);
        assertThat(reopened.verifyChain("proj/one").checked()).isEqualTo(3);
        assertThat(reopened.verifyChain("proj/one").valid()).isTrue();
        assertThatThrownBy(() -> reopened.appendEvidence(Fixtures.testReport("ev-1", "proj/one", "run", 0, 1)))
                .isInstanceOf(EvidenceIngestionException.class);
    }

    @Test
    void tamperedFileIsRefusedOnOpen() throws Exception {
        ProvenanceLedger ledger = new ProvenanceLedger(new FileLedgerStore(directory), new EvidenceSigner());
        ledger.appendEvidence(Fixtures.testReport("ev-1", "proj", "run", 0, 12));
        ledger.appendEvidence(Fixtures.testReport("ev-1", "clean", "run", 0, 12));

        Path file = directory.resolve("proj.jsonl");
        String content = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(content).contains("\"passed\":12");
        Files.writeString(file, content.replace("\"passed\":12", "\"passed\":13"), StandardCharsets.UTF_8);

        ProvenanceLedger reopened = new ProvenanceLedger(new FileLedgerStore(directory), new EvidenceSigner());

        assertThat(reopened.isQuarantined("proj")).isTrue();
        assertThat(reopened.verifyChain("proj").valid()).isFalse();
        assertThatThrownBy(() -> reopened.list("proj")).isInstanceOf(LedgerIntegrityException.class);
        assertThatThrownBy(() -> reopened.appendEvidence(Fixtures.testReport("ev-2", "proj", "run", 0, 1)))
                .isInstanceOf(LedgerIntegrityException.class);
        assertThat(reopened.isQuarantined("clean")).isFalse();
        assertThat(reopened.list("clean")).hasSize(1);
    }

    @Test
    void unparseableFileIsReportedAndQuarantined() throws Exception {
        ProvenanceLedger ledger = new ProvenanceLedger(new FileLedgerStore(directory), new EvidenceSigner());
        ledger.appendEvidence(Fixtures.testReport("ev-1", "proj", "run", 0, 12));
        Files.writeString(directory.resolve("proj.jsonl"), "{not json\n",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        FileLedgerStore store = new FileLedgerStore(directory);
        ProvenanceLedger reopened = new ProvenanceLedger(store, new EvidenceSigner());

        assertThat(store.unreadableProjects()).containsKey("proj");
        assertThat(store.records("proj")).isEmpty();
        assertThat(reopened.isQuarantined("proj")).isTrue();
        assertThat(reopened.verifyChain("proj").error()).startsWith("Unreadable");
    }

    @Test
    void publicKeysArePersistedBesideRecords() {
        EvidenceSigner signer = new EvidenceSigner();
        ProvenanceLedger ledger = new ProvenanceLedger(new FileLedgerStore(directory), signer);
        ledger.appendEvidence(Fixtures.testReport("ev-1", "proj", "run", 0, 1));

        assertThat(directory.resolve("keys").resolve(signer.getKeyId() + ".pem")).exists();
        assertThat(new FileLedgerStore(directory).publicKeys())
                .containsEntry(signer.getKeyId(), signer.exportPublicKey());
        assertThat(directory.resolve("proj.jsonl")).exists();
    }

    @Test
    void secondWriterOnTheSameDirectoryIsDetectedInsteadOfForkingTheChain() {
        ProvenanceLedger first = new ProvenanceLedger(new FileLedgerStore(directory), new EvidenceSigner());
        first.appendEvidence(Fixtures.testReport("ev-0", "proj", "run", 0, 1));

        ProvenanceLedger second = new ProvenanceLedger(new FileLedgerStore(directory), new EvidenceSigner());
        second.appendEvidence(Fixtures.testReport("ev-1", "proj", "run", 0, 2));
        second.appendEvidence(Fixtures.testReport("ev-1", "fresh", "run", 0, 2));

        assertThatThrownBy(() -> first.appendEvidence(Fixtures.testReport("ev-2", "proj", "run", 0, 3)))
                .isInstanceOf(LedgerIntegrityException.class)
                .hasMessageContaining("proj");
        assertThat(first.isQuarantined("proj")).isTrue();
        assertThatThrownBy(() -> first.appendEvidence(Fixtures.testReport("ev-2", "fresh", "run", 0, 3)))
                .isInstanceOf(LedgerIntegrityException.class)
                .hasMessageContaining("never wrote");

        ProvenanceLedger reopened = new ProvenanceLedger(new FileLedgerStore(directory), new EvidenceSigner());
        assertThat(reopened.verifyChain("proj").valid()).isTrue();
        assertThat(reopened.verifyChain("fresh").valid()).isTrue();
        assertThat(reopened.list("proj")).extracting(LedgerRecord::chainIndex).containsExactly(0L, 1L);
        assertThat(reopened.size("fresh")).isEqualTo(1);
    }

    @Test
    void storeRefusesToAppendToAFileChangedByAnotherWriter() {
        FileLedgerStore stale = new FileLedgerStore(directory);
        FileLedgerStore writer = new FileLedgerStore(directory);
        LedgerRecord record = new ProvenanceLedger(writer, new EvidenceSigner())
                .appendEvidence(Fixtures.testReport("ev-1", "proj", "run", 0, 1));

        assertThat(stale.records("proj")).isEmpty();
        assertThat(stale.last("proj")).extracting(LedgerRecord::id).isEqualTo(record.id());
        assertThatThrownBy(() -> stale.append(record))
                .isInstanceOf(LedgerIntegrityException.class)
                .hasMessageContaining("another writer");
        assertThat(new FileLedgerStore(directory).records("proj")).extracting(LedgerRecord::id)
                .containsExactly(record.id());
    }

    @Test
    void rejectedPublicKeyIsNamedInVerificationErrors() throws Exception {
        EvidenceSigner signer = new EvidenceSigner();
        ProvenanceLedger ledger = new ProvenanceLedger(new FileLedgerStore(directory), signer);
        ledger.appendEvidence(Fixtures.testReport("ev-1", "proj", "run", 0, 1));
        String keyId = signer.getKeyId();
        Files.writeString(directory.resolve("keys").resolve(keyId + ".pem"), "not a key", StandardCharsets.UTF_8);

        ProvenanceLedger reopened = new ProvenanceLedger(new FileLedgerStore(directory), new EvidenceSigner());
        ChainVerification result = reopened.verifyChain("proj");

        assertThat(reopened.isQuarantined("proj")).isTrue();
        assertThat(result.valid()).isFalse();
        assertThat(result.errors())
                .anySatisfy(error -> assertThat(error)
                        .contains("record signature invalid")
                        .contains("stored public key " + keyId + " was rejected"))
                .anySatisfy(error -> assertThat(error).contains("evidence signature invalid"));
    }
}
