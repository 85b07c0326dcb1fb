package com.taskweaver.core.engine;

import com.taskweaver.core.error.ConfigurationException;
import com.taskweaver.core.host.ScriptedSession;
import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.model.ParameterSpec;
import com.taskweaver.core.model.ParameterType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class DelegationToolProviderTest {

    private EngineFixture fixture;
    private DelegationToolProvider provider;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.echoing();
        provider = fixture.toolProvider(DelegationConfig.builder()
                .inputParameters(List.of(ParameterSpec.required("task", ParameterType.STRING, "What to do")))
                .promptMessage("{task}")
                .build());
    }

    @Test
    @DisplayName("offers the delegate function to a root session")
    void offersTool() {
        Map<String, ToolCallback> tools = provider.toolsFor(fixture.root);

        ToolCallback tool = tools.get("create_subtask");
        assertNotNull(tool);
        assertTrue(tool.getToolDefinition().inputSchema().contains("\"task\""));
        assertEquals("Succeeded", tool.call("{\"task\":\"list the files\"}"));
        assertSame(tool, provider.toolsFor(fixture.root).get("create_subtask"));
        assertEquals(1, provider.activeHandlerCount());
    }

    @Test
    @DisplayName("withholds the function from sessions at the nesting limit")
    void withholdsAtLimit() {
        var nested = new ScriptedSession("nested", "root", List.of("Helper"));
        fixture.host.register(nested);

        assertTrue(provider.toolsFor(nested).isEmpty());
        assertEquals(0, provider.activeHandlerCount());
    }

    @Test
    @DisplayName("answers unparseable arguments with a failure")
    void badArguments() {
        String reply = provider.toolsFor(fixture.root).get("create_subtask").call("[1, 2");

        assertTrue(reply.startsWith("Failed: arguments must be a JSON object"), reply);
    }

    @Test
    @DisplayName("pushes configuration updates to live handlers")
    void pushesUpdates() {
        var tool = (DelegateTool) provider.toolsFor(fixture.root).get("create_subtask");

        provider.updateConfig(provider.currentConfig().toBuilder().functionName("spawn_helper").build());

        assertEquals("spawn_helper", tool.getToolDefinition().name());
        assertEquals("spawn_helper", tool.config().functionName());
    }

    @Test
    @DisplayName("rejects an invalid update and keeps the old configuration")
    void rejectsInvalidUpdate() {
        var before = provider.currentConfig();

        assertThrows(ConfigurationException.class,
                () -> provider.updateConfig(before.toBuilder().returnToolName("").build()));
        assertSame(before, provider.currentConfig());
    }

    @Test
    @DisplayName("closing a session drops its handler and cancels its delegations")
    void sessionClosed() {
        var tool = provider.toolsFor(fixture.root).get("create_subtask");

        provider.sessionClosed("root");

        assertEquals(0, provider.activeHandlerCount());
        assertThrows(CancellationException.class, () -> tool.call("{\"task\":\"too late\"}"));
        assertTrue(fixture.host.children().isEmpty());
    }
}
