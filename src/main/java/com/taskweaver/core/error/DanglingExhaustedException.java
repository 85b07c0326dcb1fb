package com.taskweaver.core.error;

/**
 * Thrown when a child session keeps finishing its turn without reporting a result
 * after every reminder has been sent.
 */
public class DanglingExhaustedException extends DelegationException {

    private final String sessionId;
    private final int attempts;

    public DanglingExhaustedException(String sessionId, int attempts) {
        super("Child session failed to provide result after " + attempts + " reminder attempts.");
        this.sessionId = sessionId;
        this.attempts = attempts;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getAttempts() {
        return attempts;
    }
}
