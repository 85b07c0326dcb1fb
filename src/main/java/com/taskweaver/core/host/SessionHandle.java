package com.taskweaver.core.host;

import org.springframework.ai.tool.ToolCallback;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A conversation session owned by the host application.
 * <p>
 * Child sessions are created through {@link Host#createChildSession}; the engine
 * never owns their storage, it only drives them through this interface.
 */
public interface SessionHandle {

    String id();

    /** Id of the session this one was spawned from, or null for a root session. */
    String parentSessionId();

    /** Names of the assistants attached to this session, in host order. */
    List<String> assistantNames();

    /**
     * Posts a message. The returned future completes when the model turn triggered by
     * the message has ended (immediately for kinds that do not trigger a turn).
     */
    CompletableFuture<Void> sendMessage(MessageKind kind, String text);

    /** Makes the given tools callable by the session's model, keyed by tool name. */
    void registerTools(Map<String, ToolCallback> tools);

    void setToolExecutionMode(ToolExecutionMode mode);

    CancellationControl cancellationControl();

    void dispose();
}
