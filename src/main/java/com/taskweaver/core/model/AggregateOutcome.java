package com.taskweaver.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Combined outcome of a parallel run. A run succeeds when at least one child succeeded.
 */
public record AggregateOutcome(
    boolean success,
    String errorMessage,
    List<WorkItemOutcome> outcomes,
    ResultStrategy strategy,
    int totalCount,
    int completedCount,
    int failedCount,
    Instant startTime,
    Instant endTime
) {

    public AggregateOutcome {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    /** The first successful outcome in completion order. */
    public Optional<WorkItemOutcome> firstSuccess() {
        return outcomes.stream().filter(WorkItemOutcome::isSuccess).findFirst();
    }

    public List<WorkItemOutcome> failures() {
        return outcomes.stream().filter(o -> !o.isSuccess()).toList();
    }
}
