package com.taskweaver.core.host;

/**
 * Cancels whatever a session is currently doing (model turn, tool call).
 * Implementations must be idempotent.
 */
@FunctionalInterface
public interface CancellationControl {

    void cancel();
}
