package com.aegis.engine.config;

/**
 * Declarative configuration (gates, workflow, settings) is missing or malformed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
