package com.taskweaver.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Settings for the optional error-report tool registered on child sessions.
 *
 * @param toolDescription             description advertised to the model
 * @param parameters                  tool parameters; defaults are used when empty
 * @param behavior                    what happens once an error is reported
 * @param customParentMessageTemplate optional template for the message surfaced to the parent.
 *                                    Supports {FunctionName}, {SessionId}, {Timestamp},
 *                                    {ErrorMessage} and {ErrorToolName}.
 */
public record ErrorReportingConfig(
    String toolDescription,
    List<ParameterSpec> parameters,
    ErrorReportingBehavior behavior,
    String customParentMessageTemplate
) implements Serializable {

    public static final String DEFAULT_TOOL_DESCRIPTION = "Report an error or issue encountered during task execution";

    public ErrorReportingConfig {
        toolDescription = toolDescription != null && !toolDescription.isBlank()
                ? toolDescription : DEFAULT_TOOL_DESCRIPTION;
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        behavior = behavior != null ? behavior : ErrorReportingBehavior.PAUSE;
    }

    /** Parameters used when none are configured. */
    public static List<ParameterSpec> defaultParameters() {
        return List.of(
                ParameterSpec.required("error_message", ParameterType.STRING,
                        "Description of the error or issue encountered"),
                ParameterSpec.optional("error_type", ParameterType.STRING,
                        "Category of the error"));
    }

    public List<ParameterSpec> effectiveParameters() {
        return parameters.isEmpty() ? defaultParameters() : parameters;
    }
}
