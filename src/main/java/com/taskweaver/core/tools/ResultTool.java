package com.taskweaver.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweaver.core.metrics.DelegationMetrics;
import com.taskweaver.core.model.ChildResult;
import com.taskweaver.core.model.ParameterSpec;
import com.taskweaver.core.validation.ParameterValidator;

import java.util.List;
import java.util.Map;

/**
 * The return tool: a child calls it once with its result, which settles the return gate
 * with the declared parameters serialized as indented JSON.
 */
public class ResultTool extends ValidatingToolCallback {

    public ResultTool(String name, String description, List<ParameterSpec> parameters, String sessionId,
                      CompletionGate gate, ObjectMapper objectMapper, ParameterValidator validator,
                      DelegationMetrics metrics) {
        super(name, description, parameters, sessionId, gate, objectMapper, validator, metrics);
    }

    @Override
    protected String accept(Map<String, Object> declared) {
        if (!gate.trySet(ChildResult.success(toPrettyJson(declared)))) {
            return alreadyRecordedMessage();
        }
        return "Result recorded and returned to the parent session. Session " + sessionId + " will now close.";
    }

    @Override
    protected String alreadyRecordedMessage() {
        return "A result was already recorded for session " + sessionId + ". This call has no effect.";
    }
}
