package com.taskweaver.core.recursion;

import com.taskweaver.core.error.ConfigurationException;
import com.taskweaver.core.error.RecursionLimitExceededException;
import com.taskweaver.core.host.Host;
import com.taskweaver.core.host.SessionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Computes how deeply a session is nested below its root and rejects delegation past
 * the configured limit. A root session is level 0, its children level 1, and so on.
 */
@Component
public class RecursionGuard {

    private static final Logger log = LoggerFactory.getLogger(RecursionGuard.class);

    /** Hop limit that stops the walk on cyclic parent links. */
    static final int MAX_ANCESTOR_HOPS = 100;

    private final Host host;

    public RecursionGuard(Host host) {
        this.host = host;
    }

    /**
     * Walks the parent chain of {@code session}. A parent the host cannot open still
     * counts as one level and ends the walk. Unexpected failures yield level 0.
     */
    public int currentLevel(SessionHandle session) {
        if (session == null) {
            return 0;
        }
        try {
            int level = 0;
            String parentId = session.parentSessionId();
            while (parentId != null && level < MAX_ANCESTOR_HOPS) {
                level++;
                Optional<SessionHandle> parent = openQuietly(parentId);
                if (parent.isEmpty()) {
                    break;
                }
                parentId = parent.get().parentSessionId();
            }
            if (level >= MAX_ANCESTOR_HOPS) {
                log.warn("Stopped walking ancestors of session {} after {} hops", session.id(), MAX_ANCESTOR_HOPS);
            }
            return level;
        } catch (RuntimeException e) {
            log.warn("Could not compute recursion level of session {}: {}", session.id(), e.getMessage());
            return 0;
        }
    }

    /**
     * @throws ConfigurationException          when {@code maxRecursionLevel} is negative
     * @throws RecursionLimitExceededException when {@code level >= maxRecursionLevel}
     */
    public void validate(int level, int maxRecursionLevel) {
        if (maxRecursionLevel < 0) {
            throw new ConfigurationException("maxRecursionLevel must not be negative, was " + maxRecursionLevel);
        }
        if (level >= maxRecursionLevel) {
            throw new RecursionLimitExceededException(level, maxRecursionLevel);
        }
    }

    /**
     * Validates the limit first, then computes the level of {@code session} and checks it.
     */
    public int check(SessionHandle session, int maxRecursionLevel) {
        if (maxRecursionLevel < 0) {
            throw new ConfigurationException("maxRecursionLevel must not be negative, was " + maxRecursionLevel);
        }
        int level = currentLevel(session);
        validate(level, maxRecursionLevel);
        return level;
    }

    private Optional<SessionHandle> openQuietly(String sessionId) {
        try {
            return host.openSession(sessionId);
        } catch (RuntimeException e) {
            log.debug("Could not open ancestor session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }
}
