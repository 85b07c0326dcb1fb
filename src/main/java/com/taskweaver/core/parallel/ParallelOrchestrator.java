package com.taskweaver.core.parallel;

import com.taskweaver.core.concurrent.CancellationToken;
import com.taskweaver.core.error.ConfigurationException;
import com.taskweaver.core.error.DanglingExhaustedException;
import com.taskweaver.core.error.ParallelSourceException;
import com.taskweaver.core.events.DelegationEvent;
import com.taskweaver.core.events.EventBus;
import com.taskweaver.core.host.MessageKind;
import com.taskweaver.core.host.SessionHandle;
import com.taskweaver.core.logging.MdcContext;
import com.taskweaver.core.model.AggregateOutcome;
import com.taskweaver.core.model.ChildResult;
import com.taskweaver.core.model.ParallelConfig;
import com.taskweaver.core.model.ResultStrategy;
import com.taskweaver.core.model.WorkItem;
import com.taskweaver.core.model.WorkItemOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans work items out to child sessions under a concurrency bound and combines their
 * outcomes according to the configured {@link ResultStrategy}.
 * <p>
 * Items run on a worker pool sized to the effective concurrency and must pass a
 * {@link Semaphore} of the same size before their child starts. Once admitted, an item
 * gets its own cancellation token linked to the run and limited by the session
 * timeout, so a timeout aborts that item only and time spent queued does not count.
 * Unexpected per-item exceptions are folded into the item's outcome; a
 * {@link DanglingExhaustedException} aborts the run.
 */
@Component
public class ParallelOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ParallelOrchestrator.class);

    private static final long POLL_INTERVAL_MS = 50;
    static final Duration DEFAULT_NOTIFICATION_DRAIN_TIMEOUT = Duration.ofSeconds(10);

    private final EventBus eventBus;
    private final Duration notificationDrainTimeout;

    @Autowired
    public ParallelOrchestrator(EventBus eventBus) {
        this(eventBus, DEFAULT_NOTIFICATION_DRAIN_TIMEOUT);
    }

    ParallelOrchestrator(EventBus eventBus, Duration notificationDrainTimeout) {
        this.eventBus = eventBus;
        this.notificationDrainTimeout = notificationDrainTimeout;
    }

    public AggregateOutcome run(List<WorkItem> sources, ParallelConfig config, ChildRunner runner,
                                SessionHandle parentSession, CancellationToken callerToken) {
        return run(UUID.randomUUID().toString(), sources, config, runner, parentSession, callerToken);
    }

    /**
     * Runs every work item and aggregates the outcomes.
     *
     * @param delegationId  id used for logging and events
     * @param sources       work items, never empty
     * @param config        parallel settings
     * @param runner        runs one child to completion
     * @param parentSession receives per-item notifications under {@link ResultStrategy#STREAM_INDIVIDUAL}
     *                      (nullable)
     * @param callerToken   cancellation of the whole run (nullable)
     * @throws ConfigurationException     when no result strategy is configured
     * @throws DanglingExhaustedException when a child ignored every reminder
     * @throws CancellationException      when {@code callerToken} fired
     */
    public AggregateOutcome run(String delegationId, List<WorkItem> sources, ParallelConfig config,
                                ChildRunner runner, SessionHandle parentSession, CancellationToken callerToken) {
        ResultStrategy strategy = config.resultStrategy();
        if (strategy == null) {
            throw new ConfigurationException("A result strategy must be configured for parallel execution");
        }
        if (sources == null || sources.isEmpty()) {
            throw new ParallelSourceException("No work items to run in parallel");
        }
        CancellationToken caller = callerToken != null ? callerToken : CancellationToken.create();
        caller.throwIfCancelled();

        int concurrency = effectiveConcurrency(config.maxConcurrency(), sources.size());
        log.info("Running {} work item(s) with strategy {} and concurrency {}",
                sources.size(), strategy, concurrency);
        eventBus.publish(DelegationEvent.parallelStarted(delegationId, strategy.name(), sources.size()));

        Instant start = Instant.now();
        CancellationToken runToken = CancellationToken.linkedTo(caller);
        Semaphore semaphore = new Semaphore(concurrency);
        NotificationTracker notifications = new NotificationTracker();
        ExecutorService executor = Executors.newFixedThreadPool(concurrency, workerThreadFactory());
        CompletionService<WorkItemOutcome> completion = new ExecutorCompletionService<>(executor);

        try {
            for (WorkItem item : sources) {
                completion.submit(() -> runItem(delegationId, item, config, strategy, runner, parentSession,
                        semaphore, runToken, notifications));
            }
            AggregateOutcome outcome = strategy == ResultStrategy.FIRST_RESULT_WINS
                    ? collectFirstResult(completion, sources.size(), runToken, caller, start)
                    : collectAll(completion, sources.size(), strategy, runToken, caller, start);
            notifications.awaitAll(notificationDrainTimeout);
            log.info("Parallel run finished: {}/{} succeeded, {} failed",
                    outcome.completedCount(), outcome.totalCount(), outcome.failedCount());
            return outcome;
        } finally {
            executor.shutdown();
            runToken.release();
        }
    }

    /**
     * Concurrency actually used: the configured bound (CPU count when not positive),
     * capped by the number of items and never below one.
     */
    public static int effectiveConcurrency(int maxConcurrency, int itemCount) {
        int bound = maxConcurrency <= 0 ? Runtime.getRuntime().availableProcessors() : maxConcurrency;
        return Math.max(1, Math.min(bound, itemCount));
    }

    private AggregateOutcome collectAll(CompletionService<WorkItemOutcome> completion, int total,
                                        ResultStrategy strategy, CancellationToken runToken,
                                        CancellationToken caller, Instant start) {
        List<WorkItemOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            outcomes.add(nextOutcome(completion, runToken, caller));
        }
        int completed = (int) outcomes.stream().filter(WorkItemOutcome::isSuccess).count();
        int failed = total - completed;
        String error = completed > 0 ? null
                : completed + "/" + total + " sessions succeeded, " + failed + " failed";
        return new AggregateOutcome(completed > 0, error, outcomes, strategy, total, completed, failed,
                start, Instant.now());
    }

    private AggregateOutcome collectFirstResult(CompletionService<WorkItemOutcome> completion, int total,
                                                CancellationToken runToken, CancellationToken caller,
                                                Instant start) {
        List<WorkItemOutcome> failures = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            WorkItemOutcome outcome = nextOutcome(completion, runToken, caller);
            if (outcome.isSuccess()) {
                log.info("First result received from {}={}, cancelling remaining sessions",
                        outcome.name(), outcome.value());
                runToken.cancel("Another parallel session produced the first result");
                List<WorkItemOutcome> reported = new ArrayList<>(failures);
                reported.add(outcome);
                return new AggregateOutcome(true, null, reported, ResultStrategy.FIRST_RESULT_WINS, total,
                        1, failures.size(), start, Instant.now());
            }
            failures.add(outcome);
        }
        return new AggregateOutcome(false, "All parallel sessions failed", failures,
                ResultStrategy.FIRST_RESULT_WINS, total, 0, failures.size(), start, Instant.now());
    }

    private WorkItemOutcome nextOutcome(CompletionService<WorkItemOutcome> completion,
                                        CancellationToken runToken, CancellationToken caller) {
        try {
            Future<WorkItemOutcome> done;
            while ((done = completion.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) == null) {
                if (caller.isCancelled()) {
                    throw new CancellationException(caller.reason());
                }
            }
            return done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runToken.cancel("Interrupted");
            throw new CancellationException("Interrupted while waiting for parallel sessions");
        } catch (ExecutionException e) {
            runToken.cancel("Parallel run aborted");
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Parallel session failed", cause);
        } catch (CancellationException e) {
            runToken.cancel(e.getMessage());
            throw e;
        }
    }

    private WorkItemOutcome runItem(String delegationId, WorkItem item, ParallelConfig config,
                                    ResultStrategy strategy, ChildRunner runner, SessionHandle parentSession,
                                    Semaphore semaphore, CancellationToken runToken,
                                    NotificationTracker notifications) {
        MdcContext.setWorkItem(delegationId, item.label());
        CancellationToken itemToken = null;
        Instant itemStart = Instant.now();
        try {
            WorkItemOutcome outcome;
            try {
                acquire(semaphore, runToken);
                try {
                    itemStart = Instant.now();
                    itemToken = runToken.withTimeout(config.sessionTimeoutMs());
                    eventBus.publish(DelegationEvent.childStarted(delegationId, item.label()));
                    ChildResult result = runner.run(item, itemToken);
                    outcome = WorkItemOutcome.of(item,
                            result != null ? result : ChildResult.failure("Child session returned no result"),
                            itemStart, Instant.now());
                } finally {
                    semaphore.release();
                }
            } catch (DanglingExhaustedException e) {
                throw e;
            } catch (CancellationException e) {
                if (runToken.isCancelled()) {
                    throw e;
                }
                if (itemToken != null && itemToken.isCancelled()) {
                    log.warn("Parallel session {} stopped: {}", item.label(), itemToken.reason());
                    outcome = WorkItemOutcome.failed(item, new TimeoutException(itemToken.reason()),
                            itemStart, Instant.now());
                } else {
                    log.warn("Parallel session {} was cancelled by its host: {}", item.label(), e.getMessage());
                    outcome = WorkItemOutcome.failed(item, e, itemStart, Instant.now());
                }
            } catch (RuntimeException e) {
                log.error("Parallel session {} failed: {}", item.label(), e.getMessage(), e);
                outcome = WorkItemOutcome.failed(item, e, itemStart, Instant.now());
            }
            record(delegationId, item, outcome);
            if (strategy == ResultStrategy.STREAM_INDIVIDUAL && parentSession != null) {
                notifyParent(parentSession, outcome, notifications);
            }
            return outcome;
        } finally {
            if (itemToken != null) {
                itemToken.cancel("Work item finished");
            }
            MdcContext.clear();
        }
    }

    private void acquire(Semaphore semaphore, CancellationToken token) {
        try {
            while (!semaphore.tryAcquire(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                token.throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a concurrency slot");
        }
        if (token.isCancelled()) {
            semaphore.release();
            token.throwIfCancelled();
        }
    }

    private void record(String delegationId, WorkItem item, WorkItemOutcome outcome) {
        String status = outcome.isSuccess() ? "succeeded" : "failed";
        log.info("Parallel session {} {} in {} ms", item.label(), status, outcome.duration().toMillis());
        eventBus.publish(DelegationEvent.childFinished(delegationId, item.label(), outcome.isSuccess(),
                outcome.duration(), outcome.failureMessage()));
    }

    private void notifyParent(SessionHandle parentSession, WorkItemOutcome outcome,
                              NotificationTracker notifications) {
        String label = outcome.name() + "=" + outcome.value();
        String message;
        if (outcome.isSuccess()) {
            message = "Parallel session " + label + " completed successfully: " + outcome.childResult().result();
        } else if (outcome.exception() == null) {
            message = "Parallel session " + label + " reported an error: " + outcome.failureMessage();
        } else {
            message = "Parallel session " + label + " failed: " + outcome.failureMessage();
        }
        try {
            CompletableFuture<Void> sent = parentSession.sendMessage(MessageKind.MESSAGE, message);
            if (sent == null) {
                return;
            }
            notifications.track(sent.whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("Failed to stream result of {} to the parent session: {}", label, error.getMessage());
                }
            }));
        } catch (RuntimeException e) {
            log.warn("Failed to stream result of {} to the parent session: {}", label, e.getMessage());
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "taskweaver-child-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
