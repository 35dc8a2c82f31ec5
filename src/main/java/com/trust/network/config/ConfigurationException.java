package com.trust.network.config;

/**
 * Runtime exception thrown when an optimization configuration is invalid.
 * Raised while the configuration is built, before any selector runs.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
