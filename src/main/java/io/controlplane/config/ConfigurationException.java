package io.controlplane.config;

/**
 * Exception thrown when the cluster configuration is invalid.
 * Raised before any component is registered.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
