package com.taskweaver.core.events;

/**
 * Lifecycle points of a delegation. {@link #key()} is the stable name used in logs.
 */
public enum DelegationEventType {

    DELEGATION_STARTED("delegation.started"),
    PARALLEL_STARTED("parallel.started"),
    CHILD_STARTED("child.started"),
    CHILD_COMPLETED("child.completed"),
    CHILD_FAILED("child.failed"),
    DELEGATION_COMPLETED("delegation.completed");

    private final String key;

    DelegationEventType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
