package com.regulatory.conflict.config;

/**
 * Thrown when engine configuration is missing or malformed. The engine refuses to start
 * rather than guess, in particular for an ambiguous precedence table.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
