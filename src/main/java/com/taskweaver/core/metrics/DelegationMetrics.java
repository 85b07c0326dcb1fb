package com.taskweaver.core.metrics;

import com.taskweaver.core.events.DelegationEvent;
import com.taskweaver.core.events.DelegationEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for delegations and their child sessions.
 * <p>
 * Delegation results, parallel run sizes and work item durations arrive as events from
 * the {@link com.taskweaver.core.events.EventBus}; urges and tool validation failures
 * are recorded directly by the components that see them.
 */
@Service
public class DelegationMetrics implements DelegationEventListener {

    private final MeterRegistry registry;

    public DelegationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onEvent(DelegationEvent event) {
        switch (event.type()) {
            case PARALLEL_STARTED -> recordParallelRun(event.itemCount(), event.outcome());
            case CHILD_COMPLETED, CHILD_FAILED -> {
                if (event.duration() != null) {
                    recordChildDuration(event.outcome(), event.duration());
                }
            }
            case DELEGATION_COMPLETED -> recordDelegationResult(event.outcome());
            default -> {
            }
        }
    }

    /**
     * Records how long one child session ran before settling.
     *
     * @param outcome "succeeded", "failed" or "cancelled"
     */
    public void recordChildDuration(String outcome, Duration duration) {
        Timer.builder("taskweaver.child.duration")
                .description("Time from child session start until it settled")
                .tag("outcome", outcome)
                .register(registry)
                .record(duration);
    }

    public void recordDelegationResult(String result) {
        Counter.builder("taskweaver.delegations.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void incrementUrges() {
        Counter.builder("taskweaver.dangling.urges")
                .description("Reminder messages sent to children that ended a turn without a result")
                .register(registry)
                .increment();
    }

    public void recordToolValidationFailure(String toolName) {
        Counter.builder("taskweaver.tool.validation_failures")
                .tag("tool", toolName)
                .register(registry)
                .increment();
    }

    /**
     * Records the number of work items of a parallel run.
     *
     * @param itemCount number of work items
     * @param strategy  result strategy name
     */
    public void recordParallelRun(int itemCount, String strategy) {
        DistributionSummary.builder("taskweaver.parallel.items")
                .description("Work items per parallel run")
                .tag("strategy", strategy)
                .register(registry)
                .record(itemCount);
    }
}
