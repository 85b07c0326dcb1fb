package com.taskweaver.core.host;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * In-memory {@link Host} that creates {@link ScriptedSession}s from a factory.
 */
public class ScriptedHost implements Host {

    private final Map<String, SessionHandle> sessions = new ConcurrentHashMap<>();
    private final List<String> assistants;
    private final List<ScriptedSession> children = new CopyOnWriteArrayList<>();
    private final AtomicInteger counter = new AtomicInteger();
    private final BiFunction<String, String, ScriptedSession> childFactory;

    /**
     * @param assistants   assistant names known to the host
     * @param childFactory builds a child from its generated id and its parent's id
     */
    public ScriptedHost(List<String> assistants, BiFunction<String, String, ScriptedSession> childFactory) {
        this.assistants = assistants;
        this.childFactory = childFactory;
    }

    public ScriptedHost register(SessionHandle session) {
        sessions.put(session.id(), session);
        return this;
    }

    @Override
    public SessionHandle createChildSession(SessionHandle parent, String assistantName) {
        String id = "child-" + counter.incrementAndGet();
        ScriptedSession child = childFactory.apply(id, parent != null ? parent.id() : null);
        children.add(child);
        sessions.put(child.id(), child);
        return child;
    }

    @Override
    public List<String> listAssistants(String name) {
        if (name == null) {
            return new ArrayList<>(assistants);
        }
        return assistants.stream()
                .filter(a -> a.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT)))
                .toList();
    }

    @Override
    public Optional<SessionHandle> openSession(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    public List<ScriptedSession> children() {
        return new ArrayList<>(children);
    }
}
