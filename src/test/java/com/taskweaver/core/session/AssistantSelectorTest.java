package com.taskweaver.core.session;

import com.taskweaver.core.error.DelegationException;
import com.taskweaver.core.host.ScriptedHost;
import com.taskweaver.core.host.ScriptedSession;
import com.taskweaver.core.model.DelegationConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssistantSelectorTest {

    private final ScriptedHost host = new ScriptedHost(List.of("Researcher", "Writer"),
            (id, parentId) -> new ScriptedSession(id));
    private final AssistantSelector selector = new AssistantSelector(host);

    @Test
    void executiveAssistantWinsIgnoringCase() {
        var config = DelegationConfig.builder().executiveAssistant("writer").build();

        assertEquals("Writer", selector.select(config, new ScriptedSession("s", null, List.of("Researcher"))));
    }

    @Test
    void unknownExecutiveAssistantFails() {
        var config = DelegationConfig.builder().executiveAssistant("Planner").build();

        var thrown = assertThrows(DelegationException.class, () -> selector.select(config, null));
        assertEquals("Executive assistant 'Planner' was not found", thrown.getMessage());
    }

    @Test
    void fallsBackToTheContextSessionAssistant() {
        var session = new ScriptedSession("s", null, List.of("Writer", "Researcher"));

        assertEquals("Writer", selector.select(DelegationConfig.builder().build(), session));
    }

    @Test
    void fallsBackToTheFirstHostAssistant() {
        assertEquals("Researcher", selector.select(DelegationConfig.builder().build(), null));
        assertEquals("Researcher", selector.select(DelegationConfig.builder().build(),
                new ScriptedSession("s", null, List.of())));
    }

    @Test
    void failsWhenNoAssistantExists() {
        var empty = new AssistantSelector(new ScriptedHost(List.of(), (id, parentId) -> new ScriptedSession(id)));

        assertThrows(DelegationException.class, () -> empty.select(DelegationConfig.builder().build(), null));
    }
}
