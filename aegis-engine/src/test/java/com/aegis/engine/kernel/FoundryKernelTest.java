package com.aegis.engine.kernel;

import com.aegis.core.domain.Evidence;
import com.aegis.core.domain.EvidenceType;
import com.aegis.core.domain.GateResult;
import com.aegis.core.domain.ReviewResult;
import com.aegis.core.domain.Rubric;
import com.aegis.engine.Fixtures;
import com.aegis.engine.gate.PolicyViolationException;
import com.aegis.engine.gate.ValidationOutcome;
import com.aegis.engine.workflow.PhaseStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FoundryKernelTest {

    private final Clock clock = Clock.fixed(Fixtures.T0, ZoneOffset.UTC);

    private FoundryKernel kernel;

    @BeforeEach
    void setUp() {
        kernel = new FoundryKernel(KernelSettings.defaults(), clock);
    }

    @Test
    void runWithCompleteEvidence_passesGateEvaluation() {
        Fixtures.passingScans("proj", "run-1").forEach(kernel::submitEvidence);
        PhaseStateMachine machine = kernel.openWorkflow("proj", "run-1");

        machine.dispatch("INIT_PROJECT");
        machine.dispatch("RUN_GATES");

        assertThat(machine.getCurrentPhase()).isEqualTo("gate_evaluation");
        assertThat(kernel.openWorkflow("proj", "run-1")).isSameAs(machine);
        assertThat(kernel.getLedger().verifyChain("proj").valid()).isTrue();
    }

    @Test
    void runMissingOneScan_isBlockedNamingTheGate() {
        Fixtures.passingScans("proj", "run-1").forEach(kernel::submitEvidence);
        Fixtures.passingScans("proj", "run-2").stream()
                .filter(evidence -> !"dependency_scan".equals(evidence.name()))
                .forEach(kernel::submitEvidence);
        PhaseStateMachine machine = kernel.openWorkflow("proj", "run-2");
        machine.dispatch("INIT_PROJECT");

        assertThatThrownBy(() -> machine.dispatch("RUN_GATES"))
                .isInstanceOfSatisfying(PolicyViolationException.class, e ->
                        assertThat(e.getResults()).extracting(GateResult::gateId).containsExactly("sca_gate"));

        assertThat(machine.getCurrentPhase()).isEqualTo("phase_0_discovery");
        assertThat(kernel.openWorkflow("proj", "run-1").getCurrentPhase()).isEqualTo("idle");
    }

    @Test
    void releaseNeedsApprovedReview() {
        Fixtures.passingScans("proj", "run-1").forEach(kernel::submitEvidence);
        PhaseStateMachine machine = kernel.openWorkflow("proj", "run-1");
        for (String event : List.of("INIT_PROJECT", "RUN_GATES", "GATES_PASSED", "APPROVE_PHASE", "REQUEST_RELEASE")) {
            machine.dispatch(event);
        }
        // Release notes are missing, but the documentation gate does not block.
        assertThat(machine.getCurrentPhase()).isEqualTo("release_review");

        assertThatThrownBy(() -> machine.dispatch("APPROVE_RELEASE"))
                .isInstanceOf(PolicyViolationException.class)
                .hasMessageContaining("release_review_gate");

        Rubric rubric = new Rubric("release_rubric", "Release", 7.0, List.of(
                new Rubric.Criterion("quality", "Code quality", 2.0, 6.0),
                new Rubric.Criterion("docs", "Documentation", 1.0, 5.0)));
        ReviewResult review = kernel.getRubricEvaluator()
                .evaluate(rubric, Map.of("quality", 8.0, "docs", 6.0), "lead", "approved");
        kernel.submitEvidence(kernel.getRubricEvaluator().toEvidence(review, "proj", "run-1"));

        machine.dispatch("APPROVE_RELEASE");

        assertThat(machine.getCurrentPhase()).isEqualTo("released");
        assertThat(machine.isTerminal()).isTrue();
        assertThat(kernel.getLedger().verifyChain("proj").valid()).isTrue();
    }

    @Test
    void registeredValidatorTakesPartInGates() {
        kernel.registerValidator("always_fails", (evidence, params) -> ValidationOutcome.failed("nope"));

        assertThat(kernel.getValidators().contains("always_fails")).isTrue();
        assertThatThrownBy(() -> kernel.registerValidator("tests_passed", (evidence, params) -> null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fileBackedKernel_survivesRestart(@TempDir Path directory) {
        KernelSettings settings = KernelSettings.defaults().withFileStore(directory);
        FoundryKernel first = new FoundryKernel(settings, clock);
        Fixtures.passingScans("proj", "run-1").forEach(first::submitEvidence);
        first.openWorkflow("proj", "run-1").dispatch("INIT_PROJECT");

        FoundryKernel second = new FoundryKernel(settings, clock);

        assertThat(second.getLedger().size("proj")).isEqualTo(5);
        assertThat(second.getLedger().verifyChain("proj").valid()).isTrue();
        Evidence extra = Fixtures.evidence("extra", "proj", "run-1", EvidenceType.EVENT, "{}");
        assertThat(second.submitEvidence(extra).chainIndex()).isEqualTo(5);
        assertThat(second.getLedger().verifyChain("proj").checked()).isEqualTo(6);
    }
}
