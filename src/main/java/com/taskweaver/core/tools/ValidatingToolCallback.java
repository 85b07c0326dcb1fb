package com.taskweaver.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweaver.core.error.ToolValidationExhaustedException;
import com.taskweaver.core.metrics.DelegationMetrics;
import com.taskweaver.core.model.ParameterSpec;
import com.taskweaver.core.validation.ParameterValidator;
import com.taskweaver.core.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for the tools a child session uses to settle its {@link CompletionGate}.
 * <p>
 * Arguments are validated against the declared parameters before the subclass sees
 * them. Invalid calls are answered with a description so the model can retry; once
 * either failure counter reaches {@value #MAX_VALIDATION_FAILURES} the gate is
 * faulted with a {@link ToolValidationExhaustedException}. Counters belong to the
 * tool instance, so each child session gets its own budget.
 */
public abstract class ValidatingToolCallback implements ToolCallback {

    private static final Logger log = LoggerFactory.getLogger(ValidatingToolCallback.class);

    public static final int MAX_VALIDATION_FAILURES = 5;

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    protected final String sessionId;
    protected final List<ParameterSpec> parameters;
    protected final CompletionGate gate;
    protected final ObjectMapper objectMapper;
    private final ToolDefinition definition;
    private final ParameterValidator validator;
    private final DelegationMetrics metrics;

    private int missingRequiredCount;
    private int typeErrorCount;

    protected ValidatingToolCallback(String name, String description, List<ParameterSpec> parameters,
                                     String sessionId, CompletionGate gate, ObjectMapper objectMapper,
                                     ParameterValidator validator, DelegationMetrics metrics) {
        this.sessionId = sessionId;
        this.parameters = List.copyOf(parameters);
        this.gate = gate;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.metrics = metrics;
        this.definition = new DefaultToolDefinition(name,
                description != null && !description.isBlank() ? description : name,
                ToolSchemas.inputSchema(objectMapper, this.parameters));
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        Map<String, Object> args;
        try {
            args = toolInput == null || toolInput.isBlank()
                    ? Map.of()
                    : objectMapper.readValue(toolInput, ARGS_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("Tool {} received unparseable arguments: {}", name(), e.getOriginalMessage());
            return onValidationFailure(new ValidationReport(List.of(),
                    List.of("Arguments must be a JSON object: " + e.getOriginalMessage())));
        }
        return invoke(args);
    }

    /**
     * Invokes the tool with already-parsed arguments.
     */
    public synchronized String invoke(Map<String, Object> args) {
        Map<String, Object> safeArgs = args != null ? args : Map.of();
        if (gate.isDone()) {
            return alreadyRecordedMessage();
        }
        ValidationReport report = validator.validate(parameters, safeArgs);
        if (!report.isValid()) {
            return onValidationFailure(report);
        }
        Map<String, Object> declared = new LinkedHashMap<>();
        for (ParameterSpec param : parameters) {
            if (safeArgs.containsKey(param.name())) {
                declared.put(param.name(), safeArgs.get(param.name()));
            }
        }
        return accept(declared);
    }

    public String name() {
        return definition.name();
    }

    int missingRequiredCount() {
        return missingRequiredCount;
    }

    int typeErrorCount() {
        return typeErrorCount;
    }

    /**
     * Handles a call whose arguments passed validation.
     *
     * @param declared only the declared parameters that were supplied, in declaration order
     * @return text returned to the model
     */
    protected abstract String accept(Map<String, Object> declared);

    protected abstract String alreadyRecordedMessage();

    private synchronized String onValidationFailure(ValidationReport report) {
        if (report.hasMissingRequired()) {
            missingRequiredCount++;
        }
        if (report.hasTypeErrors()) {
            typeErrorCount++;
        }
        if (metrics != null) {
            metrics.recordToolValidationFailure(name());
        }
        String details = report.describe();
        boolean exhausted = (report.hasMissingRequired() && missingRequiredCount >= MAX_VALIDATION_FAILURES)
                || (report.hasTypeErrors() && typeErrorCount >= MAX_VALIDATION_FAILURES);
        if (exhausted) {
            log.warn("Tool {} on session {} exhausted its validation budget: {}", name(), sessionId, details);
            gate.trySetFault(new ToolValidationExhaustedException(name(), MAX_VALIDATION_FAILURES, details));
            return "Validation failed: " + details + ". Session " + sessionId
                    + " will now close due to repeated validation errors.";
        }
        log.debug("Tool {} on session {} rejected arguments: {}", name(), sessionId, details);
        return "Validation failed: " + details + ".";
    }

    protected String toPrettyJson(Map<String, Object> values) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize tool arguments", e);
        }
    }
}
