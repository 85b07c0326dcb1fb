package com.taskweaver.core.host;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.tool.ToolCallback;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link SessionHandle} whose model turns follow a script.
 * <p>
 * Every {@link MessageKind#MESSAGE} consumes the next scripted {@link Turn}; once the
 * script is exhausted, turns end without calling any tool.
 */
public class ScriptedSession implements SessionHandle {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** One scripted model turn. */
    @FunctionalInterface
    public interface Turn {
        CompletableFuture<Void> play(ScriptedSession session, String message);
    }

    public record SentMessage(MessageKind kind, String text) {}

    private final String id;
    private final String parentSessionId;
    private final List<String> assistantNames;
    private final Deque<Turn> script = new ConcurrentLinkedDeque<>();
    private final Map<String, ToolCallback> tools = new ConcurrentHashMap<>();
    private final List<SentMessage> sent = new CopyOnWriteArrayList<>();
    private final List<ToolExecutionMode> modes = new CopyOnWriteArrayList<>();
    private final List<String> toolReplies = new CopyOnWriteArrayList<>();
    private final AtomicInteger cancelCount = new AtomicInteger();
    private volatile RuntimeException cancelFailure;

    public ScriptedSession(String id) {
        this(id, null, List.of("Helper"));
    }

    public ScriptedSession(String id, String parentSessionId, List<String> assistantNames) {
        this.id = id;
        this.parentSessionId = parentSessionId;
        this.assistantNames = assistantNames;
    }

    public ScriptedSession then(Turn turn) {
        script.add(turn);
        return this;
    }

    /** A turn that calls {@code tool} with {@code args} (as JSON) and then ends. */
    public static Turn callTool(String tool, Map<String, Object> args) {
        return (session, message) -> {
            session.invokeTool(tool, args);
            return CompletableFuture.completedFuture(null);
        };
    }

    /** A turn that ends without calling a tool. */
    public static Turn idle() {
        return (session, message) -> CompletableFuture.completedFuture(null);
    }

    /** A turn that never ends on its own. */
    public static Turn hang() {
        return (session, message) -> new CompletableFuture<>();
    }

    public String invokeTool(String tool, Map<String, Object> args) {
        ToolCallback callback = tools.get(tool);
        if (callback == null) {
            throw new IllegalStateException("Tool " + tool + " is not registered on " + id);
        }
        try {
            String reply = callback.call(MAPPER.writeValueAsString(args));
            toolReplies.add(reply);
            return reply;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String parentSessionId() {
        return parentSessionId;
    }

    @Override
    public List<String> assistantNames() {
        return assistantNames;
    }

    @Override
    public CompletableFuture<Void> sendMessage(MessageKind kind, String text) {
        sent.add(new SentMessage(kind, text));
        if (kind != MessageKind.MESSAGE) {
            return CompletableFuture.completedFuture(null);
        }
        Turn next = script.poll();
        return next != null ? next.play(this, text) : CompletableFuture.completedFuture(null);
    }

    @Override
    public void registerTools(Map<String, ToolCallback> registered) {
        tools.putAll(registered);
    }

    @Override
    public void setToolExecutionMode(ToolExecutionMode mode) {
        modes.add(mode);
    }

    @Override
    public CancellationControl cancellationControl() {
        return () -> {
            cancelCount.incrementAndGet();
            if (cancelFailure != null) {
                throw cancelFailure;
            }
        };
    }

    @Override
    public void dispose() {
        tools.clear();
    }

    public void failOnCancel(RuntimeException failure) {
        this.cancelFailure = failure;
    }

    public Map<String, ToolCallback> tools() {
        return tools;
    }

    public List<SentMessage> sent() {
        return new ArrayList<>(sent);
    }

    public List<String> sentTexts() {
        return sent.stream().map(SentMessage::text).toList();
    }

    public List<ToolExecutionMode> modes() {
        return new ArrayList<>(modes);
    }

    public List<String> toolReplies() {
        return new ArrayList<>(toolReplies);
    }

    public int cancelCount() {
        return cancelCount.get();
    }
}
