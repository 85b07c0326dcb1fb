package com.taskweaver.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweaver.core.metrics.DelegationMetrics;
import com.taskweaver.core.model.ChildResult;
import com.taskweaver.core.model.ParameterSpec;
import com.taskweaver.core.validation.ParameterValidator;

import java.util.List;
import java.util.Map;

/**
 * The error-report tool: settles the error gate with a failed result carrying the
 * reported {@code error_message}. What the coordinator does next depends on the
 * configured error-reporting behavior.
 */
public class ErrorReportTool extends ValidatingToolCallback {

    public static final String MESSAGE_PARAMETER = "error_message";
    public static final String DEFAULT_REPORTED_MESSAGE = "An error was reported.";

    public ErrorReportTool(String name, String description, List<ParameterSpec> parameters, String sessionId,
                           CompletionGate gate, ObjectMapper objectMapper, ParameterValidator validator,
                           DelegationMetrics metrics) {
        super(name, description, parameters, sessionId, gate, objectMapper, validator, metrics);
    }

    @Override
    protected String accept(Map<String, Object> declared) {
        Object reported = declared.get(MESSAGE_PARAMETER);
        String message = reported != null && !reported.toString().isBlank()
                ? reported.toString() : DEFAULT_REPORTED_MESSAGE;
        if (!gate.trySet(ChildResult.failure(message))) {
            return alreadyRecordedMessage();
        }
        return "Error reported to parent session. Session " + sessionId
                + " will continue based on the configured behavior.";
    }

    @Override
    protected String alreadyRecordedMessage() {
        return "An error was already reported for session " + sessionId + ". This call has no effect.";
    }
}
