package com.identity.resolution.api;

/**
 * Thrown when a resolution configuration is invalid. Raised before any mention is processed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
