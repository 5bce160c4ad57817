package com.aegis.engine.gate;

import com.aegis.core.domain.CheckStatus;
import com.aegis.core.domain.Evidence;
import com.aegis.core.domain.Gate;
import com.aegis.core.domain.GateResult;
import com.aegis.core.domain.GateStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Matches a gate's checks against an evidence snapshot.
 * <p>
 * Each check takes the first evidence of its type (and name, when the check
 * filters by name). Gate status is {@code failed} if any check failed or is
 * missing, otherwise {@code error} if any check errored, otherwise
 * {@code passed}. Validator problems never escape as exceptions; they become
 * {@code error} checks.
 */
public class GateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GateEvaluator.class);

    private final ValidatorRegistry registry;
    private final Clock clock;

    public GateEvaluator(ValidatorRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public GateEvaluator(ValidatorRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    public GateResult evaluate(Gate gate, List<Evidence> evidence) {
        Objects.requireNonNull(gate, "Gate cannot be null");
        List<Evidence> snapshot = evidence != null ? evidence : List.of();

        List<GateResult.CheckResult> checks = new ArrayList<>();
        Set<String> consulted = new LinkedHashSet<>();
        for (Gate.Check check : gate.checks()) {
            Evidence match = snapshot.stream().filter(check::matches).findFirst().orElse(null);
            if (match == null) {
                checks.add(new GateResult.CheckResult(check.id(), CheckStatus.MISSING, null, missingMessage(check)));
                continue;
            }
            consulted.add(match.id());
            ValidationOutcome outcome = runValidator(gate, check, match);
            checks.add(new GateResult.CheckResult(check.id(), outcome.status(), match.id(), outcome.message()));
        }

        GateStatus status = aggregate(checks);
        log.debug("Gate {} evaluated: {} ({} check(s), {} evidence item(s) consulted)",
                gate.id(), status.wireName(), checks.size(), consulted.size());
        return new GateResult("gr_" + UUID.randomUUID(), gate.id(), gate.name(), gate.phase(), gate.blocking(),
                status, checks, new ArrayList<>(consulted), clock.instant());
    }

    private ValidationOutcome runValidator(Gate gate, Gate.Check check, Evidence evidence) {
        if (check.validator() == null || check.validator().isBlank()) {
            return ValidationOutcome.passed("No validator required");
        }
        GateValidator validator;
        try {
            validator = registry.require(check.validator());
        } catch (UnknownValidatorException e) {
            log.warn("Gate {} check {} names an unknown validator '{}'", gate.id(), check.id(), check.validator());
            return ValidationOutcome.error(e.getMessage());
        }
        try {
            ValidationOutcome outcome = validator.validate(evidence, check.params());
            return outcome != null ? outcome : ValidationOutcome.error("Validator returned no outcome");
        } catch (RuntimeException e) {
            log.warn("Validator {} failed on evidence {}", check.validator(), evidence.id(), e);
            return ValidationOutcome.error("Validator " + check.validator() + " failed: " + e.getMessage());
        }
    }

    static GateStatus aggregate(List<GateResult.CheckResult> checks) {
        boolean errored = false;
        for (GateResult.CheckResult check : checks) {
            if (check.status() == CheckStatus.FAILED || check.status() == CheckStatus.MISSING) {
                return GateStatus.FAILED;
            }
            if (check.status() == CheckStatus.ERROR) {
                errored = true;
            }
        }
        return errored ? GateStatus.ERROR : GateStatus.PASSED;
    }

    private static String missingMessage(Gate.Check check) {
        String message = "Missing evidence: " + check.evidenceType().wireName();
        if (check.mustMatch() != null && !check.mustMatch().isEmpty()) {
            message += " named " + String.join(" or ", check.mustMatch());
        }
        return message;
    }
}
