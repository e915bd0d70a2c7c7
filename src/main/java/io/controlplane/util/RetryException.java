package io.controlplane.util;

/**
 * Thrown when a {@link RetryPolicy} runs out of attempts. The cause is the last failure.
 */
public class RetryException extends Exception {

    private final int attempts;

    public RetryException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
