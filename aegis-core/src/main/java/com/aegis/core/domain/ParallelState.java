package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of an always-on monitor that runs beside the phase workflow.
 * Never gates a transition.
 */
public record ParallelState(
        Type type,
        Status status,
        Instant lastCheck,
        Map<String, Long> metrics
) {
    public ParallelState {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        metrics = metrics != null ? Map.copyOf(metrics) : Map.of();
    }

    public static ParallelState initial(Type type, Instant now) {
        return new ParallelState(type, Status.ACTIVE, now, Map.of());
    }

    public ParallelState checked(Instant now) {
        return new ParallelState(type, status, now, metrics);
    }

    public ParallelState withStatus(Status newStatus, Instant now) {
        return new ParallelState(type, newStatus, now, metrics);
    }

    /**
     * Adds {@code delta} to a metric counter.
     */
    public ParallelState increment(String metric, long delta) {
        Map<String, Long> updated = new LinkedHashMap<>(metrics);
        updated.merge(metric, delta, Long::sum);
        return new ParallelState(type, status, lastCheck, updated);
    }

    public long metric(String name) {
        return metrics.getOrDefault(name, 0L);
    }

    public enum Type {
        SECURITY_MONITORING,
        COMPLIANCE_MONITORING,
        OBSERVABILITY;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Type fromWire(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    public enum Status {
        ACTIVE,
        PAUSED,
        ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status fromWire(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }
}
