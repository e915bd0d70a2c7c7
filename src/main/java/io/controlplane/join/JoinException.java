package io.controlplane.join;

/**
 * Exception thrown when a join token is malformed or a call to the peer control API fails.
 */
public class JoinException extends Exception {

    public JoinException(String message) {
        super(message);
    }

    public JoinException(String message, Throwable cause) {
        super(message, cause);
    }
}
