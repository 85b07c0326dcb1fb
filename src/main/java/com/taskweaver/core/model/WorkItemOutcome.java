package com.taskweaver.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a single work item in a parallel run.
 *
 * @param name        work item name
 * @param value       work item value
 * @param childResult the settled child result (a synthetic failure when {@code exception} is set)
 * @param startTime   when the child was started
 * @param endTime     when the child settled
 * @param exception   unexpected failure raised while running the child (nullable)
 */
public record WorkItemOutcome(
    String name,
    Object value,
    ChildResult childResult,
    Instant startTime,
    Instant endTime,
    Throwable exception
) {

    public static WorkItemOutcome of(WorkItem item, ChildResult result, Instant start, Instant end) {
        return new WorkItemOutcome(item.name(), item.value(), result, start, end, null);
    }

    public static WorkItemOutcome failed(WorkItem item, Throwable exception, Instant start, Instant end) {
        return new WorkItemOutcome(item.name(), item.value(), ChildResult.failure(exception.getMessage()),
                start, end, exception);
    }

    public boolean isSuccess() {
        return exception == null && childResult != null && childResult.success();
    }

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }

    /** Failure text for summaries, never null. */
    public String failureMessage() {
        if (exception != null && exception.getMessage() != null) {
            return exception.getMessage();
        }
        if (childResult != null && childResult.errorMessage() != null) {
            return childResult.errorMessage();
        }
        return "Unknown error";
    }
}
