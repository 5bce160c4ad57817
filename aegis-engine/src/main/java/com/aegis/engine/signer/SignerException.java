package com.aegis.engine.signer;

/**
 * Key generation, key import or signing failed.
 */
public class SignerException extends RuntimeException {

    public SignerException(String message) {
        super(message);
    }

    public SignerException(String message, Throwable cause) {
        super(message, cause);
    }
}
