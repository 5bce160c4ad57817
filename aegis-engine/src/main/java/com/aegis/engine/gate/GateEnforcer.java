package com.aegis.engine.gate;

import com.aegis.core.domain.Evidence;
import com.aegis.core.domain.EvidenceType;
import com.aegis.core.domain.Gate;
import com.aegis.core.domain.GateResult;
import com.aegis.core.json.CanonicalJson;
import com.aegis.engine.ledger.ProvenanceLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates gates against a project's ledger evidence and records every
 * result on the ledger as {@code gate_result} evidence. Only enforcement
 * depends on {@link Gate#blocking()}: a non-blocking gate that fails is still
 * recorded.
 */
public class GateEnforcer {

    private static final Logger log = LoggerFactory.getLogger(GateEnforcer.class);

    public static final String SOURCE = "gate-enforcer";

    private final GateCatalog catalog;
    private final GateEvaluator evaluator;
    private final ProvenanceLedger ledger;

    public GateEnforcer(GateCatalog catalog, GateEvaluator evaluator, ProvenanceLedger ledger) {
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "Ledger cannot be null");
    }

    /**
     * Evaluates a catalog gate and appends the result to the ledger.
     *
     * @throws UnknownGateException if the catalog has no such gate
     */
    public GateResult evaluate(String gateId, String projectId, String runId) {
        return evaluate(catalog.require(gateId), projectId, runId);
    }

    public GateResult evaluate(Gate gate, String projectId, String runId) {
        Objects.requireNonNull(projectId, "Project ID cannot be null");
        List<Evidence> evidence = ledger.evidence(projectId, runId);
        GateResult result = evaluator.evaluate(gate, evidence);
        ledger.appendEvidence(toEvidence(result, projectId, runId));
        if (!result.passed()) {
            log.info("Gate {} {} for project {} (blocking: {})",
                    gate.id(), result.status().wireName(), projectId, gate.blocking());
        }
        return result;
    }

    /**
     * Evaluates each gate in order, recording all results, then refuses if any
     * blocking gate did not pass.
     *
     * @return every result, in gate order
     * @throws PolicyViolationException naming the blocking gates that did not pass
     */
    public List<GateResult> enforce(List<String> gateIds, String projectId, String runId, String context) {
        List<GateResult> results = new ArrayList<>();
        for (String gateId : gateIds) {
            results.add(evaluate(gateId, projectId, runId));
        }
        List<GateResult> blocked = blocking(results);
        if (!blocked.isEmpty()) {
            throw new PolicyViolationException(context, blocked);
        }
        return results;
    }

    /**
     * Results of blocking gates that did not pass.
     */
    public static List<GateResult> blocking(List<GateResult> results) {
        return results.stream()
                .filter(result -> result.blocking() && !result.passed())
                .toList();
    }

    public GateCatalog getCatalog() {
        return catalog;
    }

    static Evidence toEvidence(GateResult result, String projectId, String runId) {
        return new Evidence(result.id(), projectId, runId, SOURCE, EvidenceType.GATE_RESULT, result.timestamp(),
                CanonicalJson.toTree(result),
                Map.of(Evidence.NAME_KEY, result.gateId(), "status", result.status().wireName()));
    }
}
