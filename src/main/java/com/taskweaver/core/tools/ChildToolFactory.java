package com.taskweaver.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweaver.core.metrics.DelegationMetrics;
import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.model.ErrorReportingConfig;
import com.taskweaver.core.validation.ParameterValidator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Creates the per-child return and error-report tools bound to their gates.
 */
@Component
public class ChildToolFactory {

    private final ObjectMapper objectMapper;
    private final ParameterValidator validator = new ParameterValidator();
    private final DelegationMetrics metrics;

    @Autowired
    public ChildToolFactory(ObjectMapper objectMapper,
                            @Autowired(required = false) DelegationMetrics metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public ChildToolFactory(ObjectMapper objectMapper) {
        this(objectMapper, null);
    }

    public ResultTool resultTool(DelegationConfig config, String sessionId, CompletionGate gate) {
        return new ResultTool(config.returnToolName(), config.returnToolDescription(), config.returnParameters(),
                sessionId, gate, objectMapper, validator, metrics);
    }

    /**
     * @throws IllegalStateException when the configuration has no error reporting settings
     */
    public ErrorReportTool errorReportTool(DelegationConfig config, String sessionId, CompletionGate gate) {
        ErrorReportingConfig errorConfig = config.errorReportingConfig();
        if (errorConfig == null) {
            throw new IllegalStateException("Error reporting is not configured for " + config.functionName());
        }
        return new ErrorReportTool(config.errorReportingToolName(), errorConfig.toolDescription(),
                errorConfig.effectiveParameters(), sessionId, gate, objectMapper, validator, metrics);
    }
}
