package com.taskweaver.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweaver.core.concurrent.CancellationToken;
import com.taskweaver.core.host.ScriptedSession;
import com.taskweaver.core.model.DelegationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DelegateToolTest {

    private final ScriptedSession session = new ScriptedSession("root");
    private DelegationService service;
    private DelegateTool tool;

    @BeforeEach
    void setUp() {
        service = mock(DelegationService.class);
        tool = new DelegateTool(session, DelegationConfig.builder().build(), service, new ObjectMapper());
    }

    @Test
    @DisplayName("a finished call is detached from the session lifetime")
    void finishedCallIsReleased() {
        when(service.delegate(anyMap(), any(DelegationConfig.class), eq(session), any(CancellationToken.class)))
                .thenReturn("Succeeded");

        assertEquals("Succeeded", tool.invoke(Map.of("task", "x")));

        ArgumentCaptor<CancellationToken> token = ArgumentCaptor.forClass(CancellationToken.class);
        verify(service).delegate(anyMap(), any(DelegationConfig.class), eq(session), token.capture());
        tool.close();
        assertFalse(token.getValue().isCancelled());
    }

    @Test
    @DisplayName("closing the tool cancels a call still in flight")
    void closeCancelsRunningCall() {
        when(service.delegate(anyMap(), any(DelegationConfig.class), eq(session), any(CancellationToken.class)))
                .thenAnswer(invocation -> {
                    CancellationToken token = invocation.getArgument(3);
                    tool.close();
                    return token.isCancelled() ? "cancelled" : "running";
                });

        assertEquals("cancelled", tool.invoke(Map.of("task", "x")));
    }

    @Test
    void toolDefinitionFollowsTheConfiguration() {
        tool.updateConfig(DelegationConfig.builder().functionName("split_work").functionDescription("").build());

        assertEquals("split_work", tool.getToolDefinition().name());
        assertEquals("split_work", tool.getToolDefinition().description());
        assertEquals(List.of(), tool.config().inputParameters());
    }
}
