package com.taskweaver.core.session;

import com.taskweaver.core.concurrent.CancellationToken;
import com.taskweaver.core.error.DanglingExhaustedException;
import com.taskweaver.core.host.CancellationControl;
import com.taskweaver.core.host.MessageKind;
import com.taskweaver.core.host.SessionHandle;
import com.taskweaver.core.host.ToolExecutionMode;
import com.taskweaver.core.metrics.DelegationMetrics;
import com.taskweaver.core.model.ChildResult;
import com.taskweaver.core.model.DanglingBehavior;
import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.model.ErrorReportingBehavior;
import com.taskweaver.core.model.ErrorReportingConfig;
import com.taskweaver.core.tools.ChildToolFactory;
import com.taskweaver.core.tools.CompletionGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Drives one child session from its first message to a settled {@link ChildResult}.
 * <p>
 * The coordinator registers the return tool (and the error-report tool when
 * configured), forces a tool call on the child's turn and then waits on any of:
 * the return gate, the error gate, the end of the child's model turn and
 * cancellation. Events are checked in that order after every wake-up, so an event
 * that fired together with another is handled on the next iteration, never lost.
 * <p>
 * A turn that ends without a tool call is "dangling" and handled per
 * {@link DanglingBehavior}. Whatever the exit path, the child's in-flight activity
 * is cancelled before returning.
 */
@Component
public class ChildSessionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ChildSessionCoordinator.class);

    public static final int MAX_URGE_ATTEMPTS = 3;
    public static final String DEFAULT_PARENT_ERROR_MESSAGE = "The child session reported an error.";
    public static final String DEFAULT_DANGLING_ERROR_MESSAGE = "The child session ended without reporting a result.";

    private final ChildToolFactory toolFactory;
    private final DelegationMetrics metrics;

    @Autowired
    public ChildSessionCoordinator(ChildToolFactory toolFactory,
                                   @Autowired(required = false) DelegationMetrics metrics) {
        this.toolFactory = toolFactory;
        this.metrics = metrics;
    }

    public ChildSessionCoordinator(ChildToolFactory toolFactory) {
        this(toolFactory, null);
    }

    /**
     * Runs the child session until it settles.
     *
     * @param child          the freshly created child session
     * @param config         delegation configuration
     * @param prompt         rendered initial message
     * @param urgingMessage  rendered reminder used by {@link DanglingBehavior#URGE}
     * @param token          cancellation for this child
     * @return the settled result
     * @throws DanglingExhaustedException when every reminder was ignored
     * @throws CancellationException      when {@code token} fired first
     */
    public ChildResult await(SessionHandle child, DelegationConfig config, String prompt,
                             String urgingMessage, CancellationToken token) {
        return new Run(child, config, urgingMessage, token).execute(prompt);
    }

    /**
     * Mutable state of one coordinator invocation. Confined to the calling thread.
     */
    private final class Run {
        private final SessionHandle child;
        private final DelegationConfig config;
        private final String urgingMessage;
        private final CancellationToken token;
        private final CompletionGate returnGate = new CompletionGate();
        private final CompletionGate errorGate;
        private CoordinatorState state = CoordinatorState.DISPATCHED;
        private boolean errorPaused;

        Run(SessionHandle child, DelegationConfig config, String urgingMessage, CancellationToken token) {
            this.child = child;
            this.config = config;
            this.urgingMessage = urgingMessage;
            this.token = token;
            this.errorGate = config.errorReportingConfig() != null ? new CompletionGate() : null;
        }

        ChildResult execute(String prompt) {
            try {
                registerTools();
                token.throwIfCancelled();
                child.setToolExecutionMode(ToolExecutionMode.REQUIRE_ANY);
                CompletableFuture<Void> turn = child.sendMessage(MessageKind.MESSAGE, prompt);
                transition(CoordinatorState.AWAITING_TOOL);
                return awaitSettlement(turn);
            } catch (CancellationException e) {
                transition(CoordinatorState.CANCELLED);
                throw e;
            } finally {
                cancelChildQuietly();
            }
        }

        private void registerTools() {
            Map<String, ToolCallback> tools = new LinkedHashMap<>();
            tools.put(config.returnToolName(), toolFactory.resultTool(config, child.id(), returnGate));
            if (errorGate != null) {
                tools.put(config.errorReportingToolName(),
                        toolFactory.errorReportTool(config, child.id(), errorGate));
            }
            child.registerTools(tools);
            log.debug("Registered tools {} on child session {}", tools.keySet(), child.id());
        }

        private ChildResult awaitSettlement(CompletableFuture<Void> initialTurn) {
            CompletableFuture<Void> turn = initialTurn;
            while (true) {
                waitForAny(turn);

                if (returnGate.isDone()) {
                    return settleFromReturnGate();
                }
                if (errorGate != null && errorGate.isDone() && !errorPaused) {
                    ChildResult reported = settledOrFail(errorGate);
                    ErrorReportingConfig errorConfig = config.errorReportingConfig();
                    if (errorConfig.behavior() == ErrorReportingBehavior.REPORT_ERROR) {
                        transition(CoordinatorState.FAILED_REPORTED);
                        return ChildResult.failure(buildParentErrorMessage(errorConfig, reported));
                    }
                    log.debug("Child session {} reported an error and is paused: {}",
                            child.id(), reported.errorMessage());
                    errorPaused = true;
                    transition(CoordinatorState.PAUSED);
                    continue;
                }
                token.throwIfCancelled();
                if (turn != null && turn.isDone()) {
                    logTurnFailure(turn);
                    turn = null;
                    if (errorPaused) {
                        continue;
                    }
                    ChildResult dangling = handleDangling();
                    if (dangling != null) {
                        return dangling;
                    }
                }
            }
        }

        /**
         * @return a settled result, or null when the loop should keep waiting
         */
        private ChildResult handleDangling() {
            DanglingBehavior behavior = config.danglingBehavior();
            if (behavior == null) {
                log.warn("No dangling behavior configured for {}, falling back to URGE", config.functionName());
                behavior = DanglingBehavior.URGE;
            }
            switch (behavior) {
                case REPORT_ERROR -> {
                    String message = config.errorMessage() != null && !config.errorMessage().isBlank()
                            ? config.errorMessage() : DEFAULT_DANGLING_ERROR_MESSAGE;
                    log.debug("Child session {} ended its turn without a result: {}", child.id(), message);
                    transition(CoordinatorState.FAILED_DANGLING);
                    return ChildResult.failure(message);
                }
                case PAUSE -> {
                    log.debug("Child session {} paused, waiting for a manual tool call", child.id());
                    transition(CoordinatorState.PAUSED);
                    return null;
                }
                default -> {
                    urge();
                    return null;
                }
            }
        }

        private void urge() {
            for (int attempt = 1; attempt <= MAX_URGE_ATTEMPTS; attempt++) {
                if (anyGateSettled() || token.isCancelled()) {
                    return;
                }
                log.debug("Result not provided yet, reminder {}/{} for child session {}",
                        attempt, MAX_URGE_ATTEMPTS, child.id());
                if (metrics != null) {
                    metrics.incrementUrges();
                }
                child.setToolExecutionMode(ToolExecutionMode.REQUIRE_ANY);
                CompletableFuture<Void> reminderTurn = child.sendMessage(MessageKind.MESSAGE, urgingMessage);
                waitForAny(reminderTurn);
                if (reminderTurn.isDone()) {
                    logTurnFailure(reminderTurn);
                }
            }
            if (!anyGateSettled() && !token.isCancelled()) {
                transition(CoordinatorState.FAILED_DANGLING);
                throw new DanglingExhaustedException(child.id(), MAX_URGE_ATTEMPTS);
            }
        }

        private boolean anyGateSettled() {
            return returnGate.isDone() || (errorGate != null && errorGate.isDone() && !errorPaused);
        }

        private ChildResult settleFromReturnGate() {
            ChildResult result = settledOrFail(returnGate);
            transition(CoordinatorState.SUCCEEDED);
            return result;
        }

        private ChildResult settledOrFail(CompletionGate gate) {
            try {
                return gate.resultNow();
            } catch (RuntimeException e) {
                transition(CoordinatorState.FAILED_DANGLING);
                throw e;
            }
        }

        private void waitForAny(CompletableFuture<Void> turn) {
            List<CompletableFuture<?>> watched = new ArrayList<>();
            watched.add(returnGate.future());
            if (errorGate != null && !errorPaused) {
                watched.add(errorGate.future());
            }
            if (turn != null) {
                watched.add(turn);
            }
            watched.add(token.whenCancelled());
            try {
                CompletableFuture.anyOf(watched.toArray(new CompletableFuture<?>[0])).get();
            } catch (ExecutionException e) {
                // a faulted gate or failed turn is inspected by the caller
                log.trace("Watched future completed exceptionally: {}", e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for child session " + child.id());
            }
        }

        private String buildParentErrorMessage(ErrorReportingConfig errorConfig, ChildResult reported) {
            String reportedMessage = reported.errorMessage() != null ? reported.errorMessage() : "";
            String message = reportedMessage;
            String template = errorConfig.customParentMessageTemplate();
            if (template != null && !template.isBlank()) {
                message = template
                        .replace("{FunctionName}", String.valueOf(config.functionName()))
                        .replace("{SessionId}", child.id())
                        .replace("{Timestamp}", Instant.now().toString())
                        .replace("{ErrorMessage}", reportedMessage)
                        .replace("{ErrorToolName}", config.errorReportingToolName());
            }
            return message.isBlank() ? DEFAULT_PARENT_ERROR_MESSAGE : message;
        }

        private void logTurnFailure(CompletableFuture<Void> turn) {
            if (turn.isCompletedExceptionally()) {
                try {
                    turn.join();
                } catch (CompletionException | CancellationException e) {
                    log.warn("Model turn of child session {} failed: {}", child.id(), e.getMessage());
                }
            }
        }

        private void transition(CoordinatorState next) {
            log.debug("Child session {}: {} -> {}", child.id(), state, next);
            state = next;
        }

        private void cancelChildQuietly() {
            try {
                CancellationControl control = child.cancellationControl();
                if (control != null) {
                    control.cancel();
                }
            } catch (RuntimeException e) {
                log.warn("Failed to cancel activity of child session {}: {}", child.id(), e.getMessage());
            }
        }
    }
}
