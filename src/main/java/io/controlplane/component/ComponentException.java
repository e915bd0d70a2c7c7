package io.controlplane.component;

/**
 * Exception thrown when a component or reconciler lifecycle call fails.
 */
public class ComponentException extends Exception {

    public ComponentException(String message) {
        super(message);
    }

    public ComponentException(String message, Throwable cause) {
        super(message, cause);
    }
}
