package com.taskweaver.core.model;

import java.util.List;

/**
 * Immutable configuration of one delegate function: how it is advertised, how its
 * child sessions are prompted and how their completion is detected.
 * <p>
 * Instances are built with {@link #builder()} or from {@code TaskweaverProperties}.
 * Validation happens when a delegation starts, not at construction time, so that a
 * misconfigured function is reported to the calling agent rather than at boot.
 */
public record DelegationConfig(
    String functionName,
    String functionDescription,
    int maxRecursionLevel,
    List<ParameterSpec> inputParameters,
    String returnToolName,
    String returnToolDescription,
    List<ParameterSpec> returnParameters,
    String promptMessage,
    String urgingMessage,
    DanglingBehavior danglingBehavior,
    String errorMessage,
    String errorReportingToolName,
    ErrorReportingConfig errorReportingConfig,
    ParallelConfig parallelConfig,
    String executiveAssistant
) {

    public static final String DEFAULT_FUNCTION_NAME = "create_subtask";
    public static final String DEFAULT_FUNCTION_DESCRIPTION =
            "Delegate a subtask to a new child session and return its result";
    public static final String DEFAULT_RETURN_TOOL_NAME = "set_result";
    public static final String DEFAULT_RETURN_TOOL_DESCRIPTION = "Report back with the result after completion";
    public static final String DEFAULT_ERROR_TOOL_NAME = "report_error";
    public static final String DEFAULT_URGING_MESSAGE =
            "You have not reported your result yet. Call the result tool now with the outcome of your task.";
    public static final int DEFAULT_MAX_RECURSION_LEVEL = 1;

    public DelegationConfig {
        inputParameters = inputParameters != null ? List.copyOf(inputParameters) : List.of();
        returnParameters = returnParameters != null ? List.copyOf(returnParameters) : List.of();
        promptMessage = promptMessage != null ? promptMessage : "";
    }

    /** True when work items should be fanned out to parallel children. */
    public boolean isParallel() {
        return parallelConfig != null && parallelConfig.executionType() != ParallelExecutionType.NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .functionName(functionName)
                .functionDescription(functionDescription)
                .maxRecursionLevel(maxRecursionLevel)
                .inputParameters(inputParameters)
                .returnToolName(returnToolName)
                .returnToolDescription(returnToolDescription)
                .returnParameters(returnParameters)
                .promptMessage(promptMessage)
                .urgingMessage(urgingMessage)
                .danglingBehavior(danglingBehavior)
                .errorMessage(errorMessage)
                .errorReportingToolName(errorReportingToolName)
                .errorReportingConfig(errorReportingConfig)
                .parallelConfig(parallelConfig)
                .executiveAssistant(executiveAssistant);
    }

    public static final class Builder {
        private String functionName = DEFAULT_FUNCTION_NAME;
        private String functionDescription = DEFAULT_FUNCTION_DESCRIPTION;
        private int maxRecursionLevel = DEFAULT_MAX_RECURSION_LEVEL;
        private List<ParameterSpec> inputParameters = List.of();
        private String returnToolName = DEFAULT_RETURN_TOOL_NAME;
        private String returnToolDescription = DEFAULT_RETURN_TOOL_DESCRIPTION;
        private List<ParameterSpec> returnParameters = List.of(
                ParameterSpec.required("result", ParameterType.STRING, "The result of the task"));
        private String promptMessage = "";
        private String urgingMessage = DEFAULT_URGING_MESSAGE;
        private DanglingBehavior danglingBehavior = DanglingBehavior.URGE;
        private String errorMessage;
        private String errorReportingToolName = DEFAULT_ERROR_TOOL_NAME;
        private ErrorReportingConfig errorReportingConfig;
        private ParallelConfig parallelConfig;
        private String executiveAssistant;

        private Builder() {}

        public Builder functionName(String functionName) { this.functionName = functionName; return this; }
        public Builder functionDescription(String functionDescription) { this.functionDescription = functionDescription; return this; }
        public Builder maxRecursionLevel(int maxRecursionLevel) { this.maxRecursionLevel = maxRecursionLevel; return this; }
        public Builder inputParameters(List<ParameterSpec> inputParameters) { this.inputParameters = inputParameters; return this; }
        public Builder returnToolName(String returnToolName) { this.returnToolName = returnToolName; return this; }
        public Builder returnToolDescription(String returnToolDescription) { this.returnToolDescription = returnToolDescription; return this; }
        public Builder returnParameters(List<ParameterSpec> returnParameters) { this.returnParameters = returnParameters; return this; }
        public Builder promptMessage(String promptMessage) { this.promptMessage = promptMessage; return this; }
        public Builder urgingMessage(String urgingMessage) { this.urgingMessage = urgingMessage; return this; }
        public Builder danglingBehavior(DanglingBehavior danglingBehavior) { this.danglingBehavior = danglingBehavior; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder errorReportingToolName(String errorReportingToolName) { this.errorReportingToolName = errorReportingToolName; return this; }
        public Builder errorReportingConfig(ErrorReportingConfig errorReportingConfig) { this.errorReportingConfig = errorReportingConfig; return this; }
        public Builder parallelConfig(ParallelConfig parallelConfig) { this.parallelConfig = parallelConfig; return this; }
        public Builder executiveAssistant(String executiveAssistant) { this.executiveAssistant = executiveAssistant; return this; }

        public DelegationConfig build() {
            return new DelegationConfig(functionName, functionDescription, maxRecursionLevel, inputParameters,
                    returnToolName, returnToolDescription, returnParameters, promptMessage, urgingMessage,
                    danglingBehavior, errorMessage, errorReportingToolName, errorReportingConfig,
                    parallelConfig, executiveAssistant);
        }
    }
}
