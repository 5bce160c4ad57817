package com.aegis.engine.gate;

public class UnknownGateException extends RuntimeException {

    private final String gateId;

    public UnknownGateException(String gateId) {
        super("Unknown gate: " + gateId);
        this.gateId = gateId;
    }

    public String getGateId() {
        return gateId;
    }
}
