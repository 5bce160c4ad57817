package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of evaluating one gate against an evidence snapshot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GateResult(
        String id,
        String gateId,
        String gateName,
        String phase,
        boolean blocking,
        GateStatus status,
        List<CheckResult> checks,
        List<String> evidenceIds,
        Instant timestamp
) {
    public GateResult {
        Objects.requireNonNull(id, "Result ID cannot be null");
        Objects.requireNonNull(gateId, "Gate ID cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        checks = checks != null ? List.copyOf(checks) : List.of();
        evidenceIds = evidenceIds != null ? List.copyOf(evidenceIds) : List.of();
    }

    public boolean passed() {
        return status == GateStatus.PASSED;
    }

    /**
     * Checks that kept the gate from passing.
     */
    public List<CheckResult> unsatisfiedChecks() {
        return checks.stream()
                .filter(check -> check.status() != CheckStatus.PASSED)
                .toList();
    }

    /**
     * Human-readable account of why the gate did not pass.
     */
    public String describeFailure() {
        StringBuilder sb = new StringBuilder();
        sb.append("Gate '").append(gateId).append("' ").append(status.wireName());
        for (CheckResult check : unsatisfiedChecks()) {
            sb.append("; check '").append(check.id()).append("' ").append(check.status().wireName());
            if (check.message() != null) {
                sb.append(": ").append(check.message());
            }
        }
        sb.append("; evidence consulted: ").append(evidenceIds.isEmpty() ? "none" : String.join(", ", evidenceIds));
        return sb.toString();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CheckResult(
            String id,
            CheckStatus status,
            String evidenceId,
            String message
    ) {
        public CheckResult {
            Objects.requireNonNull(id, "Check ID cannot be null");
            Objects.requireNonNull(status, "Status cannot be null");
        }
    }
}
