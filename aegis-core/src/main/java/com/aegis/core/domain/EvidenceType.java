package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of evidence a collaborator can submit.
 */
public enum EvidenceType {
    TEST_REPORT("test_report"),
    VULN_REPORT("vuln_report"),
    ARTIFACT("artifact"),
    DECISION("decision"),
    FILE("file"),
    EVENT("event"),
    FINDING("finding"),
    TASK_COMPLETION("task_completion"),
    AGENT_OUTPUT("agent_output"),
    REVIEW("review"),
    GATE_RESULT("gate_result");

    private final String wireName;

    EvidenceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name ("test_report") or constant name ("TEST_REPORT").
     *
     * @throws IllegalArgumentException for unknown names
     */
    @JsonCreator
    public static EvidenceType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Evidence type cannot be null");
        }
        for (EvidenceType type : values()) {
            if (type.wireName.equals(value) || type.name().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown evidence type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
