package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.List;
import java.util.Objects;

/**
 * Declarative policy unit: the evidence a phase needs before it may be entered.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Gate(
        String id,
        String name,
        String description,
        String phase,
        boolean blocking,
        List<Check> checks
) {
    public Gate {
        Objects.requireNonNull(id, "Gate ID cannot be null");
        name = name != null ? name : id;
        checks = checks != null ? List.copyOf(checks) : List.of();
    }

    /**
     * One required piece of evidence. {@code validator}, {@code params} and
     * {@code mustMatch} are optional; without a validator, presence passes.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Check(
            String id,
            EvidenceType evidenceType,
            String validator,
            JsonNode params,
            List<String> mustMatch
    ) {
        public Check {
            Objects.requireNonNull(id, "Check ID cannot be null");
            Objects.requireNonNull(evidenceType, "Evidence type cannot be null");
            params = params != null && !params.isNull() ? params.deepCopy() : JsonNodeFactory.instance.objectNode();
            mustMatch = mustMatch != null ? List.copyOf(mustMatch) : null;
        }

        public static Check of(String id, EvidenceType evidenceType, String validator) {
            return new Check(id, evidenceType, validator, null, null);
        }

        /**
         * A copy of the validator parameters; gates are shared between evaluations.
         */
        @Override
        public JsonNode params() {
            return params.deepCopy();
        }

        /**
         * True when the evidence has the check's type and, if a name filter is
         * present, one of the listed names.
         */
        public boolean matches(Evidence evidence) {
            if (evidence.type() != evidenceType) {
                return false;
            }
            if (mustMatch == null || mustMatch.isEmpty()) {
                return true;
            }
            String name = evidence.name();
            return name != null && mustMatch.contains(name);
        }
    }
}
