package com.aegis.engine.gate;

public class UnknownValidatorException extends RuntimeException {

    private final String validatorName;

    public UnknownValidatorException(String validatorName) {
        super("Unknown validator: " + validatorName);
        this.validatorName = validatorName;
    }

    public String getValidatorName() {
        return validatorName;
    }
}
