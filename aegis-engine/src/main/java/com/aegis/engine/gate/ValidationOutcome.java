package com.aegis.engine.gate;

import com.aegis.core.domain.CheckStatus;

import java.util.Objects;

/**
 * What a validator concluded about one piece of evidence.
 */
public record ValidationOutcome(CheckStatus status, String message) {

    public ValidationOutcome {
        Objects.requireNonNull(status, "Status cannot be null");
        if (status == CheckStatus.MISSING) {
            throw new IllegalArgumentException("Validators judge present evidence; MISSING is not an outcome");
        }
    }

    public static ValidationOutcome passed(String message) {
        return new ValidationOutcome(CheckStatus.PASSED, message);
    }

    public static ValidationOutcome failed(String message) {
        return new ValidationOutcome(CheckStatus.FAILED, message);
    }

    public static ValidationOutcome error(String message) {
        return new ValidationOutcome(CheckStatus.ERROR, message);
    }
}
