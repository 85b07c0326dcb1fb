package com.taskweaver.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweaver.core.host.SessionHandle;
import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.recursion.RecursionGuard;
import com.taskweaver.core.validation.DelegationConfigValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exposes the delegate function to host sessions and keeps one {@link DelegateTool}
 * per live session.
 * <p>
 * Sessions already at the nesting limit are not offered the tool. The host must
 * call {@link #sessionClosed(String)} when a session goes away; configuration
 * updates are pushed to every registered handler.
 */
@Service
public class DelegationToolProvider {

    private static final Logger log = LoggerFactory.getLogger(DelegationToolProvider.class);

    private final DelegationService delegationService;
    private final RecursionGuard recursionGuard;
    private final DelegationConfigValidator configValidator;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, DelegateTool> handlers = new ConcurrentHashMap<>();

    private volatile DelegationConfig config;

    public DelegationToolProvider(DelegationConfig config, DelegationService delegationService,
                                  RecursionGuard recursionGuard, DelegationConfigValidator configValidator,
                                  ObjectMapper objectMapper) {
        this.config = config;
        this.delegationService = delegationService;
        this.recursionGuard = recursionGuard;
        this.configValidator = configValidator;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the tools to register on {@code session}: the delegate function keyed by
     * its name, or nothing when the session may not delegate further.
     */
    public Map<String, ToolCallback> toolsFor(SessionHandle session) {
        DelegationConfig current = config;
        int level = recursionGuard.currentLevel(session);
        if (current.maxRecursionLevel() < 0 || level >= current.maxRecursionLevel()) {
            log.debug("Session {} is at recursion level {}, not offering {}", session.id(), level,
                    current.functionName());
            return Map.of();
        }
        DelegateTool tool = handlers.computeIfAbsent(session.id(),
                id -> new DelegateTool(session, current, delegationService, objectMapper));
        return Map.of(tool.getToolDefinition().name(), tool);
    }

    /**
     * Replaces the configuration and pushes it to every live handler.
     *
     * @throws com.taskweaver.core.error.ConfigurationException when {@code updated} is invalid
     */
    public void updateConfig(DelegationConfig updated) {
        configValidator.validate(updated);
        this.config = updated;
        handlers.values().forEach(handler -> handler.updateConfig(updated));
        log.info("Updated delegation configuration '{}' for {} live session(s)",
                updated.functionName(), handlers.size());
    }

    /**
     * Unregisters the handler of a closed session and cancels its in-flight delegations.
     */
    public void sessionClosed(String sessionId) {
        DelegateTool removed = handlers.remove(sessionId);
        if (removed != null) {
            removed.close();
            log.debug("Unregistered delegate handler of session {}", sessionId);
        }
    }

    public int activeHandlerCount() {
        return handlers.size();
    }

    public DelegationConfig currentConfig() {
        return config;
    }
}
