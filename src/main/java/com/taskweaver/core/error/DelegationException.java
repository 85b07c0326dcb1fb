package com.taskweaver.core.error;

/**
 * Base type for failures raised while delegating work to child sessions.
 */
public class DelegationException extends RuntimeException {

    public DelegationException(String message) {
        super(message);
    }

    public DelegationException(String message, Throwable cause) {
        super(message, cause);
    }
}
