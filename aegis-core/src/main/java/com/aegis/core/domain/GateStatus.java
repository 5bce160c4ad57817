package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall outcome of a gate evaluation.
 */
public enum GateStatus {
    PASSED,
    FAILED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GateStatus fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
