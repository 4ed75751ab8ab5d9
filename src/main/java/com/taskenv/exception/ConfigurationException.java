package com.taskenv.exception;

/**
 * Exception thrown when configuration or seed data is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends TaskEnvironmentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
