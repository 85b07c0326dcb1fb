package com.taskweaver.config;

import com.taskweaver.core.model.DanglingBehavior;
import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.model.ErrorReportingBehavior;
import com.taskweaver.core.model.ErrorReportingConfig;
import com.taskweaver.core.model.ParallelConfig;
import com.taskweaver.core.model.ParallelExecutionType;
import com.taskweaver.core.model.ParameterSpec;
import com.taskweaver.core.model.ParameterType;
import com.taskweaver.core.model.ResultStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code taskweaver.*} configuration tree.
 */
@ConfigurationProperties(prefix = "taskweaver")
public class TaskweaverProperties {

    private Delegation delegation = new Delegation();
    private Parallel parallel = new Parallel();

    public Delegation getDelegation() { return delegation; }
    public void setDelegation(Delegation delegation) { this.delegation = delegation; }
    public Parallel getParallel() { return parallel; }
    public void setParallel(Parallel parallel) { this.parallel = parallel; }

    /**
     * Converts the bound properties into the immutable configuration used by the engine.
     */
    public DelegationConfig toDelegationConfig() {
        DelegationConfig.Builder builder = DelegationConfig.builder()
                .functionName(delegation.functionName)
                .functionDescription(delegation.functionDescription)
                .maxRecursionLevel(delegation.maxRecursionLevel)
                .inputParameters(toSpecs(delegation.inputParameters))
                .returnToolName(delegation.returnToolName)
                .returnToolDescription(delegation.returnToolDescription)
                .promptMessage(delegation.promptMessage)
                .urgingMessage(delegation.urgingMessage)
                .danglingBehavior(delegation.danglingBehavior)
                .errorMessage(delegation.errorMessage)
                .errorReportingToolName(delegation.errorReportingToolName)
                .executiveAssistant(delegation.executiveAssistant);
        if (!delegation.returnParameters.isEmpty()) {
            builder.returnParameters(toSpecs(delegation.returnParameters));
        }
        ErrorReporting errors = delegation.errorReporting;
        if (errors.enabled) {
            builder.errorReportingConfig(new ErrorReportingConfig(errors.toolDescription,
                    toSpecs(errors.parameters), errors.behavior, errors.customParentMessageTemplate));
        }
        if (parallel.executionType != ParallelExecutionType.NONE) {
            builder.parallelConfig(ParallelConfig.builder()
                    .executionType(parallel.executionType)
                    .maxConcurrency(parallel.maxConcurrency)
                    .resultStrategy(parallel.resultStrategy)
                    .listParameterName(parallel.listParameterName)
                    .externalList(parallel.externalList)
                    .excludedParameterNames(parallel.excludedParameterNames)
                    .sessionTimeoutMs(parallel.sessionTimeout.toMillis())
                    .build());
        }
        return builder.build();
    }

    private static List<ParameterSpec> toSpecs(List<Parameter> parameters) {
        return parameters.stream().map(Parameter::toSpec).toList();
    }

    public static class Delegation {
        private String functionName = DelegationConfig.DEFAULT_FUNCTION_NAME;
        private String functionDescription = DelegationConfig.DEFAULT_FUNCTION_DESCRIPTION;
        private int maxRecursionLevel = DelegationConfig.DEFAULT_MAX_RECURSION_LEVEL;
        private List<Parameter> inputParameters = new ArrayList<>();
        private String returnToolName = DelegationConfig.DEFAULT_RETURN_TOOL_NAME;
        private String returnToolDescription = DelegationConfig.DEFAULT_RETURN_TOOL_DESCRIPTION;
        private List<Parameter> returnParameters = new ArrayList<>();
        private String promptMessage = "";
        private String urgingMessage = DelegationConfig.DEFAULT_URGING_MESSAGE;
        private DanglingBehavior danglingBehavior = DanglingBehavior.URGE;
        private String errorMessage;
        private String errorReportingToolName = DelegationConfig.DEFAULT_ERROR_TOOL_NAME;
        private String executiveAssistant;
        private ErrorReporting errorReporting = new ErrorReporting();

        public String getFunctionName() { return functionName; }
        public void setFunctionName(String functionName) { this.functionName = functionName; }
        public String getFunctionDescription() { return functionDescription; }
        public void setFunctionDescription(String functionDescription) { this.functionDescription = functionDescription; }
        public int getMaxRecursionLevel() { return maxRecursionLevel; }
        public void setMaxRecursionLevel(int maxRecursionLevel) { this.maxRecursionLevel = maxRecursionLevel; }
        public List<Parameter> getInputParameters() { return inputParameters; }
        public void setInputParameters(List<Parameter> inputParameters) { this.inputParameters = inputParameters; }
        public String getReturnToolName() { return returnToolName; }
        public void setReturnToolName(String returnToolName) { this.returnToolName = returnToolName; }
        public String getReturnToolDescription() { return returnToolDescription; }
        public void setReturnToolDescription(String returnToolDescription) { this.returnToolDescription = returnToolDescription; }
        public List<Parameter> getReturnParameters() { return returnParameters; }
        public void setReturnParameters(List<Parameter> returnParameters) { this.returnParameters = returnParameters; }
        public String getPromptMessage() { return promptMessage; }
        public void setPromptMessage(String promptMessage) { this.promptMessage = promptMessage; }
        public String getUrgingMessage() { return urgingMessage; }
        public void setUrgingMessage(String urgingMessage) { this.urgingMessage = urgingMessage; }
        public DanglingBehavior getDanglingBehavior() { return danglingBehavior; }
        public void setDanglingBehavior(DanglingBehavior danglingBehavior) { this.danglingBehavior = danglingBehavior; }
        public String getErrorMessage() { return errorMessage; }
        public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
        public String getErrorReportingToolName() { return errorReportingToolName; }
        public void setErrorReportingToolName(String errorReportingToolName) { this.errorReportingToolName = errorReportingToolName; }
        public String getExecutiveAssistant() { return executiveAssistant; }
        public void setExecutiveAssistant(String executiveAssistant) { this.executiveAssistant = executiveAssistant; }
        public ErrorReporting getErrorReporting() { return errorReporting; }
        public void setErrorReporting(ErrorReporting errorReporting) { this.errorReporting = errorReporting; }
    }

    public static class ErrorReporting {
        private boolean enabled = false;
        private String toolDescription = ErrorReportingConfig.DEFAULT_TOOL_DESCRIPTION;
        private ErrorReportingBehavior behavior = ErrorReportingBehavior.PAUSE;
        private String customParentMessageTemplate;
        private List<Parameter> parameters = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getToolDescription() { return toolDescription; }
        public void setToolDescription(String toolDescription) { this.toolDescription = toolDescription; }
        public ErrorReportingBehavior getBehavior() { return behavior; }
        public void setBehavior(ErrorReportingBehavior behavior) { this.behavior = behavior; }
        public String getCustomParentMessageTemplate() { return customParentMessageTemplate; }
        public void setCustomParentMessageTemplate(String customParentMessageTemplate) { this.customParentMessageTemplate = customParentMessageTemplate; }
        public List<Parameter> getParameters() { return parameters; }
        public void setParameters(List<Parameter> parameters) { this.parameters = parameters; }
    }

    public static class Parallel {
        private ParallelExecutionType executionType = ParallelExecutionType.NONE;
        private int maxConcurrency = 0;
        private ResultStrategy resultStrategy = ResultStrategy.WAIT_FOR_ALL;
        private String listParameterName;
        private List<String> externalList = new ArrayList<>();
        private List<String> excludedParameterNames = new ArrayList<>();
        private Duration sessionTimeout = Duration.ofMillis(ParallelConfig.DEFAULT_SESSION_TIMEOUT_MS);

        public ParallelExecutionType getExecutionType() { return executionType; }
        public void setExecutionType(ParallelExecutionType executionType) { this.executionType = executionType; }
        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public ResultStrategy getResultStrategy() { return resultStrategy; }
        public void setResultStrategy(ResultStrategy resultStrategy) { this.resultStrategy = resultStrategy; }
        public String getListParameterName() { return listParameterName; }
        public void setListParameterName(String listParameterName) { this.listParameterName = listParameterName; }
        public List<String> getExternalList() { return externalList; }
        public void setExternalList(List<String> externalList) { this.externalList = externalList; }
        public List<String> getExcludedParameterNames() { return excludedParameterNames; }
        public void setExcludedParameterNames(List<String> excludedParameterNames) { this.excludedParameterNames = excludedParameterNames; }
        public Duration getSessionTimeout() { return sessionTimeout; }
        public void setSessionTimeout(Duration sessionTimeout) { this.sessionTimeout = sessionTimeout; }
    }

    public static class Parameter {
        private String name;
        private String description;
        private ParameterType type = ParameterType.STRING;
        private boolean required = true;
        private ParameterType itemType;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public ParameterType getType() { return type; }
        public void setType(ParameterType type) { this.type = type; }
        public boolean isRequired() { return required; }
        public void setRequired(boolean required) { this.required = required; }
        public ParameterType getItemType() { return itemType; }
        public void setItemType(ParameterType itemType) { this.itemType = itemType; }

        ParameterSpec toSpec() {
            ParameterSpec element = itemType != null
                    ? new ParameterSpec("item", null, itemType, false, null, List.of())
                    : null;
            return new ParameterSpec(name, description, type, required, element, List.of());
        }
    }
}
