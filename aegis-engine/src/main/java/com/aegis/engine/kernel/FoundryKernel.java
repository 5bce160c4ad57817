package com.aegis.engine.kernel;

import com.aegis.core.domain.Evidence;
import com.aegis.core.domain.LedgerRecord;
import com.aegis.engine.gate.GateCatalog;
import com.aegis.engine.gate.GateEnforcer;
import com.aegis.engine.gate.GateEvaluator;
import com.aegis.engine.gate.GateValidator;
import com.aegis.engine.gate.ValidatorRegistry;
import com.aegis.engine.ledger.FileLedgerStore;
import com.aegis.engine.ledger.InMemoryLedgerStore;
import com.aegis.engine.ledger.LedgerStore;
import com.aegis.engine.ledger.ProvenanceLedger;
import com.aegis.engine.rubric.RubricEvaluator;
import com.aegis.engine.signer.EvidenceSigner;
import com.aegis.engine.signer.InMemorySigningKeyStore;
import com.aegis.engine.workflow.PhaseStateMachine;
import com.aegis.engine.workflow.WorkflowDefinition;
import com.aegis.engine.workflow.WorkflowDefinitions;
import com.aegis.engine.workflow.WorkflowEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wires signer, ledger, gates, rubric scoring and the workflow definition
 * together and hands out one state machine per project run.
 */
public class FoundryKernel {

    private static final Logger log = LoggerFactory.getLogger(FoundryKernel.class);

    private final KernelSettings settings;
    private final Clock clock;
    private final EvidenceSigner signer;
    private final ProvenanceLedger ledger;
    private final ValidatorRegistry validators;
    private final GateCatalog gateCatalog;
    private final GateEvaluator gateEvaluator;
    private final GateEnforcer gateEnforcer;
    private final RubricEvaluator rubricEvaluator;
    private final WorkflowDefinition workflow;
    private final WorkflowEventBus eventBus;
    private final Map<String, PhaseStateMachine> machines = new ConcurrentHashMap<>();

    /**
     * @throws com.aegis.engine.config.ConfigurationException if gates or workflow cannot be loaded
     * @throws com.aegis.engine.gate.UnknownGateException      if the workflow requires a gate the catalog lacks
     */
    public FoundryKernel(KernelSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.signer = new EvidenceSigner(new InMemorySigningKeyStore(), this.clock);
        this.ledger = new ProvenanceLedger(createStore(settings), signer, settings.signerId(), this.clock);
        this.validators = ValidatorRegistry.withBuiltIns();
        this.gateCatalog = GateCatalog.fromClasspath(settings.gatesResource());
        this.gateEvaluator = new GateEvaluator(validators, this.clock);
        this.gateEnforcer = new GateEnforcer(gateCatalog, gateEvaluator, ledger);
        this.rubricEvaluator = new RubricEvaluator(this.clock);
        this.workflow = WorkflowDefinitions.fromClasspath(settings.workflowResource());
        WorkflowDefinitions.checkGates(workflow, gateCatalog);
        this.eventBus = new WorkflowEventBus();
        log.info("Kernel ready: {} store, workflow {} v{}, {} gate(s), {} validator(s)",
                settings.storeType(), workflow.id(), workflow.version(), gateCatalog.all().size(),
                validators.names().size());
    }

    public FoundryKernel(KernelSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public FoundryKernel() {
        this(KernelSettings.load());
    }

    private static LedgerStore createStore(KernelSettings settings) {
        return switch (settings.storeType()) {
            case MEMORY -> new InMemoryLedgerStore();
            case FILE -> new FileLedgerStore(settings.ledgerDirectory());
        };
    }

    /**
     * The state machine of a project run, created on first use.
     */
    public PhaseStateMachine openWorkflow(String projectId, String runId) {
        Objects.requireNonNull(projectId, "Project ID cannot be null");
        String key = projectId + "\u0000" + (runId != null ? runId : "");
        return machines.computeIfAbsent(key, k -> new PhaseStateMachine(
                workflow, projectId, runId, ledger, gateEnforcer, eventBus, clock));
    }

    public LedgerRecord submitEvidence(Evidence evidence) {
        return ledger.appendEvidence(evidence);
    }

    /**
     * Adds a validator next to the built-ins.
     *
     * @throws IllegalArgumentException if the name is taken
     */
    public FoundryKernel registerValidator(String name, GateValidator validator) {
        validators.register(name, validator);
        return this;
    }

    public KernelSettings getSettings() {
        return settings;
    }

    public EvidenceSigner getSigner() {
        return signer;
    }

    public ProvenanceLedger getLedger() {
        return ledger;
    }

    public ValidatorRegistry getValidators() {
        return validators;
    }

    public GateCatalog getGateCatalog() {
        return gateCatalog;
    }

    public GateEvaluator getGateEvaluator() {
        return gateEvaluator;
    }

    public GateEnforcer getGateEnforcer() {
        return gateEnforcer;
    }

    public RubricEvaluator getRubricEvaluator() {
        return rubricEvaluator;
    }

    public WorkflowDefinition getWorkflow() {
        return workflow;
    }

    public WorkflowEventBus getEventBus() {
        return eventBus;
    }
}
