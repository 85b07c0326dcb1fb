package com.taskweaver.core.engine;

import com.taskweaver.core.concurrent.CancellationToken;
import com.taskweaver.core.error.ConfigurationException;
import com.taskweaver.core.error.DanglingExhaustedException;
import com.taskweaver.core.error.DelegationException;
import com.taskweaver.core.error.ParallelSourceException;
import com.taskweaver.core.error.RecursionLimitExceededException;
import com.taskweaver.core.error.ToolValidationExhaustedException;
import com.taskweaver.core.events.DelegationEvent;
import com.taskweaver.core.events.EventBus;
import com.taskweaver.core.host.SessionHandle;
import com.taskweaver.core.logging.MdcContext;
import com.taskweaver.core.model.AggregateOutcome;
import com.taskweaver.core.model.ChildResult;
import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.model.ParameterSpec;
import com.taskweaver.core.model.WorkItem;
import com.taskweaver.core.parallel.ChildRunner;
import com.taskweaver.core.parallel.ParallelOrchestrator;
import com.taskweaver.core.parallel.ParallelSourceExtractor;
import com.taskweaver.core.recursion.RecursionGuard;
import com.taskweaver.core.session.AssistantSelector;
import com.taskweaver.core.session.ChildSessionRunner;
import com.taskweaver.core.validation.DelegationConfigValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Entry point of a delegate call: validates the request, then runs either one child
 * session or a parallel fan-out and reports the outcome as text for the calling agent.
 * <p>
 * Expected failures (recursion limit, missing inputs, unusable parallel sources) are
 * returned as text. Configuration errors, exhausted reminders, exhausted tool
 * validation and cancellation propagate as exceptions.
 */
@Service
public class DelegationService {

    private static final Logger log = LoggerFactory.getLogger(DelegationService.class);

    private final DelegationConfigValidator configValidator;
    private final RecursionGuard recursionGuard;
    private final AssistantSelector assistantSelector;
    private final ChildSessionRunner childSessionRunner;
    private final ParallelSourceExtractor sourceExtractor;
    private final ParallelOrchestrator orchestrator;
    private final EventBus eventBus;

    @Autowired
    public DelegationService(DelegationConfigValidator configValidator, RecursionGuard recursionGuard,
                             AssistantSelector assistantSelector, ChildSessionRunner childSessionRunner,
                             ParallelSourceExtractor sourceExtractor, ParallelOrchestrator orchestrator,
                             EventBus eventBus) {
        this.configValidator = configValidator;
        this.recursionGuard = recursionGuard;
        this.assistantSelector = assistantSelector;
        this.childSessionRunner = childSessionRunner;
        this.sourceExtractor = sourceExtractor;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    public String delegate(Map<String, Object> requestArgs, DelegationConfig config, SessionHandle contextSession) {
        return delegate(requestArgs, config, contextSession, CancellationToken.create());
    }

    /**
     * Runs a delegate call.
     *
     * @param requestArgs    arguments the agent passed to the delegate function
     * @param config         delegation configuration
     * @param contextSession the delegating session (nullable for a root call)
     * @param token          cancellation of the whole call
     * @return "Succeeded", "Failed: ..." or a parallel summary
     */
    public String delegate(Map<String, Object> requestArgs, DelegationConfig config, SessionHandle contextSession,
                           CancellationToken token) {
        Map<String, Object> args = requestArgs != null ? requestArgs : Map.of();
        String delegationId = UUID.randomUUID().toString();
        MdcContext.setDelegation(delegationId);
        try {
            configValidator.validate(config);
            eventBus.publish(DelegationEvent.delegationStarted(delegationId, config.functionName()));
            try {
                recursionGuard.check(contextSession, config.maxRecursionLevel());
            } catch (RecursionLimitExceededException e) {
                log.info("Rejected delegation {}: {}", config.functionName(), e.getMessage());
                return finish(delegationId, "recursion_limit", e.getMessage());
            }

            String missing = describeMissingInputs(config.inputParameters(), args);
            if (missing != null) {
                return finish(delegationId, "invalid_request", "Missing required parameters: " + missing);
            }

            String assistant;
            try {
                assistant = assistantSelector.select(config, contextSession);
            } catch (DelegationException e) {
                log.warn("No assistant for delegation {}: {}", config.functionName(), e.getMessage());
                return finish(delegationId, "no_assistant", ResultFormatter.FAILED + ": " + e.getMessage());
            }

            log.info("Delegation {} runs on assistant {} ({})", config.functionName(), assistant,
                    config.isParallel() ? "parallel" : "single");
            return config.isParallel()
                    ? runParallel(delegationId, args, config, contextSession, assistant, token)
                    : runSingle(delegationId, args, config, contextSession, assistant, token);
        } finally {
            MdcContext.clear();
        }
    }

    private String runSingle(String delegationId, Map<String, Object> args, DelegationConfig config,
                             SessionHandle contextSession, String assistant, CancellationToken token) {
        try {
            ChildResult result = childSessionRunner.run(contextSession, assistant, args, config, null, token);
            return finish(delegationId, result != null && result.success() ? "succeeded" : "failed",
                    ResultFormatter.formatSingle(result));
        } catch (ConfigurationException | DanglingExhaustedException | ToolValidationExhaustedException
                 | CancellationException e) {
            finish(delegationId, e instanceof CancellationException ? "cancelled" : "error", null);
            throw e;
        } catch (RuntimeException e) {
            log.error("Delegation {} failed: {}", config.functionName(), e.getMessage(), e);
            return finish(delegationId, "error", ResultFormatter.FAILED + ": " + e.getMessage());
        }
    }

    private String runParallel(String delegationId, Map<String, Object> args, DelegationConfig config,
                               SessionHandle contextSession, String assistant, CancellationToken token) {
        List<WorkItem> items;
        try {
            items = sourceExtractor.extract(args, config.parallelConfig());
        } catch (ParallelSourceException e) {
            return finish(delegationId, "invalid_request", "Parallel execution failed: " + e.getMessage());
        }
        if (items.isEmpty()) {
            return finish(delegationId, "invalid_request", ResultFormatter.NO_VALID_PARAMETERS);
        }

        ChildRunner runner = (item, itemToken) ->
                childSessionRunner.run(contextSession, assistant, args, config, item, itemToken);
        try {
            AggregateOutcome outcome = orchestrator.run(delegationId, items, config.parallelConfig(), runner,
                    contextSession, token);
            return finish(delegationId, outcome.success() ? "succeeded" : "failed",
                    ResultFormatter.formatParallel(outcome));
        } catch (ConfigurationException | DanglingExhaustedException | CancellationException e) {
            finish(delegationId, e instanceof CancellationException ? "cancelled" : "error", null);
            throw e;
        } catch (RuntimeException e) {
            log.error("Parallel delegation {} failed: {}", config.functionName(), e.getMessage(), e);
            return finish(delegationId, "error", "Parallel execution failed: " + e.getMessage());
        }
    }

    /**
     * @return a description of the missing required inputs, or null when all are present
     */
    static String describeMissingInputs(List<ParameterSpec> inputs, Map<String, Object> args) {
        List<String> missing = inputs.stream()
                .filter(p -> p.required() && !args.containsKey(p.name()))
                .map(p -> p.description().isBlank() ? "'" + p.name() + "'" : "'" + p.name() + "' (" + p.description() + ")")
                .toList();
        return missing.isEmpty() ? null : String.join(", ", missing);
    }

    private String finish(String delegationId, String result, String summary) {
        eventBus.publish(DelegationEvent.delegationCompleted(delegationId, result, summary));
        return summary;
    }
}
