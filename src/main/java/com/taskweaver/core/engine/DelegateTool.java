package com.taskweaver.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweaver.core.concurrent.CancellationToken;
import com.taskweaver.core.host.SessionHandle;
import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.tools.ToolSchemas;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.Map;

/**
 * The delegate function as seen by one parent session's model.
 * <p>
 * Holds the configuration currently in force for that session; updates pushed by
 * {@link DelegationToolProvider} apply to the next call. Closing the tool cancels
 * delegations it still has in flight.
 */
public class DelegateTool implements ToolCallback {

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final SessionHandle session;
    private final DelegationService delegationService;
    private final ObjectMapper objectMapper;
    private final CancellationToken lifetime = CancellationToken.create();

    private volatile DelegationConfig config;
    private volatile ToolDefinition definition;

    DelegateTool(SessionHandle session, DelegationConfig config, DelegationService delegationService,
                 ObjectMapper objectMapper) {
        this.session = session;
        this.delegationService = delegationService;
        this.objectMapper = objectMapper;
        updateConfig(config);
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        Map<String, Object> args;
        try {
            args = toolInput == null || toolInput.isBlank() ? Map.of() : objectMapper.readValue(toolInput, ARGS_TYPE);
        } catch (JsonProcessingException e) {
            return ResultFormatter.FAILED + ": arguments must be a JSON object (" + e.getOriginalMessage() + ")";
        }
        return invoke(args);
    }

    public String invoke(Map<String, Object> args) {
        CancellationToken call = CancellationToken.linkedTo(lifetime);
        try {
            return delegationService.delegate(args, config, session, call);
        } finally {
            call.release();
        }
    }

    void updateConfig(DelegationConfig updated) {
        String description = updated.functionDescription() != null && !updated.functionDescription().isBlank()
                ? updated.functionDescription() : updated.functionName();
        this.definition = new DefaultToolDefinition(updated.functionName(), description,
                ToolSchemas.inputSchema(objectMapper, updated.inputParameters()));
        this.config = updated;
    }

    DelegationConfig config() {
        return config;
    }

    void close() {
        lifetime.cancel("Session " + session.id() + " closed");
    }
}
