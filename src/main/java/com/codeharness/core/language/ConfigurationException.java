package com.codeharness.core.language;

/**
 * Raised when a manifest or language configuration cannot be honoured:
 * unknown language, missing required role, malformed override.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
