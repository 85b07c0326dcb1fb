package com.taskweaver.core.validation;

import com.taskweaver.core.error.ConfigurationException;
import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.model.ErrorReportingConfig;
import com.taskweaver.core.model.ParameterSpec;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Rejects delegation configurations that cannot work before any child session is created.
 */
@Component
public class DelegationConfigValidator {

    public void validate(DelegationConfig config) {
        if (config == null) {
            throw new ConfigurationException("Delegation configuration is missing");
        }
        if (isBlank(config.functionName())) {
            throw new ConfigurationException("Function name must not be empty");
        }
        if (config.maxRecursionLevel() < 0) {
            throw new ConfigurationException("maxRecursionLevel must not be negative, was "
                    + config.maxRecursionLevel());
        }
        if (isBlank(config.returnToolName())) {
            throw new ConfigurationException("Return tool name must not be empty");
        }
        if (isBlank(config.urgingMessage())) {
            throw new ConfigurationException("Urging message must not be empty");
        }
        ErrorReportingConfig errorConfig = config.errorReportingConfig();
        if (errorConfig != null) {
            validateErrorReporting(config, errorConfig);
        }
    }

    private void validateErrorReporting(DelegationConfig config, ErrorReportingConfig errorConfig) {
        String toolName = config.errorReportingToolName();
        if (isBlank(toolName)) {
            throw new ConfigurationException("Error reporting tool name must not be empty");
        }
        if (toolName.trim().equalsIgnoreCase(config.returnToolName().trim())) {
            throw new ConfigurationException("Error reporting tool name '" + toolName
                    + "' conflicts with the return tool name");
        }
        Set<String> seen = new HashSet<>();
        for (ParameterSpec param : errorConfig.parameters()) {
            if (isBlank(param.name())) {
                throw new ConfigurationException("Error reporting parameters must have a name");
            }
            if (!seen.add(param.name().toLowerCase(Locale.ROOT))) {
                throw new ConfigurationException("Duplicate error reporting parameter '" + param.name() + "'");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
