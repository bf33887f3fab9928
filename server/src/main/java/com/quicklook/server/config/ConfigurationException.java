package com.quicklook.server.config;

/**
 * Unrecoverable configuration problem detected at start-up.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
