package com.taskweaver.core.template;

import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.model.ParameterSpec;
import com.taskweaver.core.model.WorkItem;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the variables available to prompt and urging templates.
 * <ul>
 *   <li>every declared input parameter (required ones bound to null when absent)</li>
 *   <li>every other request argument, except internal {@code _parameter*} keys</li>
 *   <li>{@code _config}: selected delegation settings</li>
 *   <li>{@code _parameter}: {@code name} and {@code value} of the current work item, null on the single path</li>
 * </ul>
 * Keys that are not valid template identifiers are dropped.
 */
public final class PromptBindings {

    public static final String CONFIG_KEY = "_config";
    public static final String PARAMETER_KEY = "_parameter";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private PromptBindings() {}

    public static Map<String, Object> build(Map<String, Object> requestArgs, DelegationConfig config, WorkItem item) {
        Map<String, Object> bindings = new LinkedHashMap<>();

        for (ParameterSpec param : config.inputParameters()) {
            if (requestArgs.containsKey(param.name())) {
                bindings.put(param.name(), requestArgs.get(param.name()));
            } else if (param.required()) {
                bindings.put(param.name(), null);
            }
        }
        for (Map.Entry<String, Object> entry : requestArgs.entrySet()) {
            String key = entry.getKey();
            if (!bindings.containsKey(key) && !key.toLowerCase(Locale.ROOT).startsWith(PARAMETER_KEY)) {
                bindings.put(key, entry.getValue());
            }
        }

        bindings.put(CONFIG_KEY, configView(config));

        Map<String, Object> parameter = new HashMap<>();
        parameter.put("name", item != null ? item.name() : null);
        parameter.put("value", item != null ? item.value() : null);
        bindings.put(PARAMETER_KEY, parameter);

        bindings.keySet().removeIf(key -> key == null || !IDENTIFIER.matcher(key).matches());
        return bindings;
    }

    private static Map<String, Object> configView(DelegationConfig config) {
        Map<String, Object> view = new HashMap<>();
        view.put("functionName", config.functionName());
        view.put("functionDescription", config.functionDescription());
        view.put("maxRecursionLevel", config.maxRecursionLevel());
        view.put("returnToolName", config.returnToolName());
        view.put("returnToolDescription", config.returnToolDescription());
        view.put("errorReportingToolName", config.errorReportingToolName());
        view.put("danglingBehavior", config.danglingBehavior() != null ? config.danglingBehavior().name() : null);
        view.put("executiveAssistant", config.executiveAssistant());
        if (config.parallelConfig() != null) {
            view.put("executionType", config.parallelConfig().executionType().name());
            view.put("resultStrategy", config.parallelConfig().resultStrategy() != null
                    ? config.parallelConfig().resultStrategy().name() : null);
        }
        return view;
    }
}
