package com.project.prism.config;

/**
 * Missing or unusable settings. Fatal to the current operation and never retried.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
