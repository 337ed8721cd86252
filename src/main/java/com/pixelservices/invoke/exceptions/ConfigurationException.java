package com.pixelservices.invoke.exceptions;

/**
 * Thrown when the server configuration file cannot be read, written or parsed.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
