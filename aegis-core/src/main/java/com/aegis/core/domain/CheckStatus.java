package com.aegis.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a single gate check.
 */
public enum CheckStatus {
    PASSED,
    FAILED,
    /** No evidence of the required type (and name) was found. */
    MISSING,
    /** The validator is unknown or threw while validating. */
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CheckStatus fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
