package com.aegis.engine.workflow;

import com.aegis.core.domain.AuditEvent;
import com.aegis.core.domain.GateResult;
import com.aegis.core.domain.GateStatus;
import com.aegis.core.domain.ParallelState;
import com.aegis.core.domain.StateTransition;
import com.aegis.engine.gate.GateEnforcer;
import com.aegis.engine.gate.PolicyViolationException;
import com.aegis.engine.ledger.ProvenanceLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Drives one project run through a {@link WorkflowDefinition}.
 * <p>
 * Dispatch is serialized per machine. A transition into a phase with required
 * gates first evaluates every gate (each result is recorded on the ledger);
 * if a blocking gate did not pass the transition is refused. Every refusal and
 * every transition is appended to the ledger as an audit event before the
 * caller sees the outcome, and a transition's audit record is durable before
 * the phase changes.
 * <p>
 * Parallel monitors are updated as a side effect and never gate a transition.
 */
public class PhaseStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PhaseStateMachine.class);

    private final WorkflowDefinition definition;
    private final String projectId;
    private final String runId;
    private final ProvenanceLedger ledger;
    private final GateEnforcer enforcer;
    private final WorkflowEventBus eventBus;
    private final Clock clock;

    private volatile String currentPhase;
    private final List<StateTransition> history = new CopyOnWriteArrayList<>();
    private final Map<ParallelState.Type, ParallelState> parallelStates = new ConcurrentHashMap<>();

    public PhaseStateMachine(WorkflowDefinition definition, String projectId, String runId,
                             ProvenanceLedger ledger, GateEnforcer enforcer, WorkflowEventBus eventBus, Clock clock) {
        this.definition = Objects.requireNonNull(definition, "Definition cannot be null");
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("Project ID cannot be null or blank");
        }
        this.projectId = projectId;
        this.runId = runId;
        this.ledger = Objects.requireNonNull(ledger, "Ledger cannot be null");
        this.enforcer = Objects.requireNonNull(enforcer, "Gate enforcer cannot be null");
        this.eventBus = eventBus != null ? eventBus : new WorkflowEventBus();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.currentPhase = definition.initialState();

        Instant now = this.clock.instant();
        for (ParallelState.Type type : ParallelState.Type.values()) {
            parallelStates.put(type, ParallelState.initial(type, now));
        }
    }

    // ==================== Dispatch ====================

    public StateTransition dispatch(String event) {
        return dispatch(event, TransitionPayload.empty());
    }

    /**
     * Applies an event.
     *
     * @return the committed transition
     * @throws InvalidTransitionException if the current phase has no transition for the event
     * @throws PolicyViolationException   if a blocking gate of the target phase did not pass
     */
    public synchronized StateTransition dispatch(String event, TransitionPayload payload) {
        Objects.requireNonNull(event, "Event cannot be null");
        TransitionPayload context = payload != null ? payload : TransitionPayload.empty();
        String from = currentPhase;
        String target = definition.phase(from).target(event);

        if (target == null) {
            ledger.appendAuditEvent(AuditEvent.transitionRefused(projectId, runId, from, null, event,
                    context.actor(), "no transition for event", clock.instant()));
            log.warn("Project {} rejected {} in phase {}", projectId, event, from);
            emit(WorkflowEventType.TRANSITION_REJECTED, "Event " + event + " not allowed from " + from,
                    Map.of("event", event));
            throw new InvalidTransitionException(from, event);
        }

        List<GateResult> gateResults = evaluateGates(target);
        List<GateResult> blocked = GateEnforcer.blocking(gateResults);
        if (!blocked.isEmpty()) {
            PolicyViolationException violation = new PolicyViolationException(
                    "Transition " + from + " -> " + target + " on " + event + " blocked", blocked);
            ledger.appendAuditEvent(AuditEvent.transitionRefused(projectId, runId, from, target, event,
                    context.actor(), violation.getMessage(), clock.instant()));
            log.warn("Project {} blocked: {}", projectId, violation.getMessage());
            emit(WorkflowEventType.TRANSITION_BLOCKED, violation.getMessage(), Map.of(
                    "event", event,
                    "target", target,
                    "gateIds", blocked.stream().map(GateResult::gateId).toList()));
            throw violation;
        }

        Instant now = clock.instant();
        List<String> gateResultIds = gateResults.stream().map(GateResult::id).toList();
        StateTransition transition = new StateTransition("tr_" + UUID.randomUUID(), from, target, event,
                context.actor(), context.evidenceIds(), gateResultIds, now);

        Map<String, String> metadata = new LinkedHashMap<>(context.metadata());
        metadata.put("transitionId", transition.id());
        if (!context.evidenceIds().isEmpty()) {
            metadata.put("evidenceIds", String.join(",", context.evidenceIds()));
        }
        if (!gateResultIds.isEmpty()) {
            metadata.put("gateResultIds", String.join(",", gateResultIds));
        }
        ledger.appendAuditEvent(AuditEvent.stateTransition(projectId, runId, from, target, event,
                context.actor(), metadata, now));

        currentPhase = target;
        history.add(transition);
        updateParallelStates(event, now);
        log.info("Project {} transitioned {} -> {} on {}", projectId, from, target, event);
        emit(WorkflowEventType.TRANSITION, from + " -> " + target, Map.of(
                "event", event,
                "from", from,
                "to", target,
                "transitionId", transition.id()));
        return transition;
    }

    private List<GateResult> evaluateGates(String target) {
        List<GateResult> results = new ArrayList<>();
        for (String gateId : definition.phase(target).requiredGates()) {
            GateResult result = enforcer.evaluate(gateId, projectId, runId);
            results.add(result);
            recordGateOutcome(result);
            emit(WorkflowEventType.GATE_EVALUATED, result.gateId() + " " + result.status().wireName(), Map.of(
                    "gateId", result.gateId(),
                    "gateResultId", result.id(),
                    "status", result.status().wireName()));
        }
        return results;
    }

    // ==================== Parallel states ====================

    private void updateParallelStates(String event, Instant now) {
        String topic = event.toUpperCase(Locale.ROOT);
        if (topic.equals("PAUSE")) {
            setAllStatuses(ParallelState.Status.PAUSED, now);
        } else if (topic.equals("RESUME")) {
            setAllStatuses(ParallelState.Status.ACTIVE, now);
        }
        if (topic.contains("SECURITY") || topic.contains("GATE")) {
            parallelStates.computeIfPresent(ParallelState.Type.SECURITY_MONITORING,
                    (type, state) -> state.checked(now).increment("events", 1));
        }
        if (topic.contains("COMPLIANCE") || topic.contains("APPROVE")) {
            parallelStates.computeIfPresent(ParallelState.Type.COMPLIANCE_MONITORING,
                    (type, state) -> state.checked(now).increment("events", 1));
        }
        parallelStates.computeIfPresent(ParallelState.Type.OBSERVABILITY,
                (type, state) -> state.checked(now).increment("transitions", 1));
    }

    private void recordGateOutcome(GateResult result) {
        ParallelState before = parallelStates.get(ParallelState.Type.SECURITY_MONITORING);
        ParallelState.Status status = before.status();
        if (result.status() == GateStatus.ERROR) {
            status = ParallelState.Status.ERROR;
        } else if (status == ParallelState.Status.ERROR) {
            status = ParallelState.Status.ACTIVE;
        }
        ParallelState after = before.withStatus(status, result.timestamp())
                .increment("gate_evaluations", 1)
                .increment(result.passed() ? "gate_passes" : "gate_failures", 1);
        parallelStates.put(ParallelState.Type.SECURITY_MONITORING, after);
        if (after.status() != before.status()) {
            emit(WorkflowEventType.PARALLEL_STATE_CHANGED,
                    "security_monitoring " + before.status().wireName() + " -> " + after.status().wireName(),
                    Map.of("type", ParallelState.Type.SECURITY_MONITORING.wireName()));
        }
    }

    private void setAllStatuses(ParallelState.Status status, Instant now) {
        for (ParallelState.Type type : ParallelState.Type.values()) {
            ParallelState before = parallelStates.get(type);
            if (before.status() != status) {
                parallelStates.put(type, before.withStatus(status, now));
                emit(WorkflowEventType.PARALLEL_STATE_CHANGED,
                        type.wireName() + " " + before.status().wireName() + " -> " + status.wireName(),
                        Map.of("type", type.wireName()));
            }
        }
    }

    // ==================== Introspection ====================

    public boolean can(String event) {
        return event != null && definition.phase(currentPhase).target(event) != null;
    }

    public List<String> getAvailableTransitions() {
        return List.copyOf(definition.phase(currentPhase).on().keySet());
    }

    public String getCurrentPhase() {
        return currentPhase;
    }

    public boolean isTerminal() {
        return definition.phase(currentPhase).terminal();
    }

    public List<StateTransition> getHistory() {
        return List.copyOf(history);
    }

    public ParallelState getParallelState(ParallelState.Type type) {
        return parallelStates.get(type);
    }

    public Map<ParallelState.Type, ParallelState> getParallelStates() {
        return new EnumMap<>(parallelStates);
    }

    public StateSnapshot snapshot() {
        String phase = currentPhase;
        PhaseDefinition definitionOfPhase = definition.phase(phase);
        return new StateSnapshot(definition.id(), projectId, runId, phase, definitionOfPhase.terminal(),
                new ArrayList<>(definitionOfPhase.on().keySet()), history, parallelStates);
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getRunId() {
        return runId;
    }

    public WorkflowEventBus getEventBus() {
        return eventBus;
    }

    private void emit(WorkflowEventType type, String message, Map<String, Object> metadata) {
        eventBus.emit(new WorkflowEvent(type, projectId, runId, currentPhase, clock.instant(), message, metadata));
    }
}
