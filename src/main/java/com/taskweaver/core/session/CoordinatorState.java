package com.taskweaver.core.session;

/**
 * States a child session passes through while its coordinator waits for a result.
 * {@link #PAUSED} is not terminal: the coordinator keeps waiting for a tool call.
 */
public enum CoordinatorState {
    DISPATCHED,
    AWAITING_TOOL,
    PAUSED,
    SUCCEEDED,
    FAILED_DANGLING,
    FAILED_REPORTED,
    CANCELLED;

    public boolean isTerminal() {
        return this != DISPATCHED && this != AWAITING_TOOL && this != PAUSED;
    }
}
