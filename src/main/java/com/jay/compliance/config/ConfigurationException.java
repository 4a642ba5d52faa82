package com.jay.compliance.config;

/**
 * Missing or invalid configuration detected at startup. Never thrown per request.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
