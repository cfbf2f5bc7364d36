package com.netflowradar.common;

/**
 * Fatal startup error: configuration is missing or malformed. The application must not start.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
