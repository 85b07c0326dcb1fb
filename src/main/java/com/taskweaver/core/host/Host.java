package com.taskweaver.core.host;

import java.util.List;
import java.util.Optional;

/**
 * Services the embedding host application provides to the engine.
 */
public interface Host {

    /**
     * Starts a new session as a child of {@code parent}, driven by the named assistant.
     */
    SessionHandle createChildSession(SessionHandle parent, String assistantName);

    /**
     * Lists assistant names. With a non-null {@code name}, only assistants whose name
     * matches it (ignoring case) are returned.
     */
    List<String> listAssistants(String name);

    /**
     * Opens an existing session by id.
     *
     * @return the session, or empty when the host does not know the id
     */
    Optional<SessionHandle> openSession(String id);
}
