package com.atcascade.core;

/**
 * Raised when the cascade inputs (node table, split configuration, goal set,
 * options) cannot describe a valid cascade. Always raised before any job is
 * built or run.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
