package com.taskweaver.core.session;

import com.taskweaver.core.error.DelegationException;
import com.taskweaver.core.host.Host;
import com.taskweaver.core.host.SessionHandle;
import com.taskweaver.core.model.DelegationConfig;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the assistant that drives child sessions.
 * <p>
 * A configured executive assistant wins and must exist on the host. Otherwise the
 * first assistant of the delegating session is used, then the first assistant the
 * host knows about.
 */
@Component
public class AssistantSelector {

    private final Host host;

    public AssistantSelector(Host host) {
        this.host = host;
    }

    public String select(DelegationConfig config, SessionHandle contextSession) {
        String executive = config.executiveAssistant();
        if (executive != null && !executive.isBlank()) {
            return host.listAssistants(executive).stream()
                    .filter(name -> name.equalsIgnoreCase(executive))
                    .findFirst()
                    .orElseThrow(() -> new DelegationException(
                            "Executive assistant '" + executive + "' was not found"));
        }
        if (contextSession != null) {
            List<String> attached = contextSession.assistantNames();
            if (attached != null && !attached.isEmpty()) {
                return attached.get(0);
            }
        }
        List<String> available = host.listAssistants(null);
        if (available == null || available.isEmpty()) {
            throw new DelegationException("No assistant is available to run the subtask");
        }
        return available.get(0);
    }
}
