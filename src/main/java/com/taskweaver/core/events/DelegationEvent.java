package com.taskweaver.core.events;

import java.time.Duration;
import java.time.Instant;

/**
 * Something that happened while a delegation ran.
 *
 * @param type         lifecycle point
 * @param delegationId the delegation this event belongs to
 * @param workItem     label of the work item (null for delegation-level events)
 * @param outcome      short tag: the result of a delegation, "succeeded"/"failed" for a child,
 *                     or the strategy of a parallel run
 * @param detail       free text: function name, child error or the summary returned to the agent
 * @param itemCount    number of work items of a parallel run, otherwise 0
 * @param duration     how long a child ran (null unless the child finished)
 * @param timestamp    when the event occurred
 */
public record DelegationEvent(
    DelegationEventType type,
    String delegationId,
    String workItem,
    String outcome,
    String detail,
    int itemCount,
    Duration duration,
    Instant timestamp
) {

    public static DelegationEvent delegationStarted(String delegationId, String functionName) {
        return new DelegationEvent(DelegationEventType.DELEGATION_STARTED, delegationId, null, null,
                functionName, 0, null, Instant.now());
    }

    public static DelegationEvent parallelStarted(String delegationId, String strategy, int itemCount) {
        return new DelegationEvent(DelegationEventType.PARALLEL_STARTED, delegationId, null, strategy,
                null, itemCount, null, Instant.now());
    }

    public static DelegationEvent childStarted(String delegationId, String workItem) {
        return new DelegationEvent(DelegationEventType.CHILD_STARTED, delegationId, workItem, null,
                null, 0, null, Instant.now());
    }

    /**
     * @param error failure message, ignored when {@code success} is true
     */
    public static DelegationEvent childFinished(String delegationId, String workItem, boolean success,
                                                Duration duration, String error) {
        return new DelegationEvent(success ? DelegationEventType.CHILD_COMPLETED : DelegationEventType.CHILD_FAILED,
                delegationId, workItem, success ? "succeeded" : "failed", success ? null : error, 0,
                duration, Instant.now());
    }

    /**
     * @param result  tag such as "succeeded", "failed", "recursion_limit" or "cancelled"
     * @param summary text handed back to the delegating agent (null when the call threw)
     */
    public static DelegationEvent delegationCompleted(String delegationId, String result, String summary) {
        return new DelegationEvent(DelegationEventType.DELEGATION_COMPLETED, delegationId, null, result,
                summary, 0, null, Instant.now());
    }
}
