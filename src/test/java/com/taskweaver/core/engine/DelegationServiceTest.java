package com.taskweaver.core.engine;

import com.taskweaver.core.error.ConfigurationException;
import com.taskweaver.core.error.DanglingExhaustedException;
import com.taskweaver.core.events.DelegationEvent;
import com.taskweaver.core.events.DelegationEventType;
import com.taskweaver.core.host.ScriptedSession;
import com.taskweaver.core.model.DanglingBehavior;
import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.model.ParallelConfig;
import com.taskweaver.core.model.ParallelExecutionType;
import com.taskweaver.core.model.ParameterSpec;
import com.taskweaver.core.model.ParameterType;
import com.taskweaver.core.model.ResultStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DelegationServiceTest {

    private static final ParameterSpec TASK = ParameterSpec.required("task", ParameterType.STRING, "What to do");

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.echoing();
    }

    private static DelegationConfig single() {
        return DelegationConfig.builder()
                .inputParameters(List.of(TASK))
                .promptMessage("Please {task}")
                .build();
    }

    private static DelegationConfig parallel(ParallelConfig parallelConfig) {
        return DelegationConfig.builder()
                .promptMessage("Handle {_parameter.value}")
                .parallelConfig(parallelConfig)
                .build();
    }

    @Nested
    @DisplayName("single child")
    class SingleTests {

        @Test
        @DisplayName("runs one child of the calling session and reports success")
        void success() {
            String result = fixture.service.delegate(Map.of("task", "count the files"), single(), fixture.root);

            assertEquals("Succeeded", result);
            var child = fixture.host.children().get(0);
            assertEquals("root", child.parentSessionId());
            assertEquals("Please count the files", child.sentTexts().get(0));
            assertEquals(1.0, fixture.registry.find("taskweaver.delegations.total")
                    .tag("result", "succeeded").counter().count());
        }

        @Test
        @DisplayName("reports the child's failure as text")
        void childFailure() {
            var silent = new EngineFixture((id, parentId) -> new ScriptedSession(id, parentId, List.of()));
            var config = single().toBuilder()
                    .danglingBehavior(DanglingBehavior.REPORT_ERROR)
                    .errorMessage("No answer")
                    .build();

            assertEquals("Failed: No answer", silent.service.delegate(Map.of("task", "x"), config, silent.root));
        }

        @Test
        @DisplayName("propagates exhausted reminders")
        void danglingPropagates() {
            var silent = new EngineFixture((id, parentId) -> new ScriptedSession(id, parentId, List.of()));

            assertThrows(DanglingExhaustedException.class,
                    () -> silent.service.delegate(Map.of("task", "x"), single(), silent.root));
        }

        @Test
        @DisplayName("publishes start and completion events")
        void events() {
            List<DelegationEvent> events = new ArrayList<>();
            fixture.eventBus.register(events::add);

            fixture.service.delegate(Map.of("task", "x"), single(), fixture.root);

            assertEquals(List.of(DelegationEventType.DELEGATION_STARTED, DelegationEventType.DELEGATION_COMPLETED),
                    events.stream().map(DelegationEvent::type).toList());
            assertEquals("succeeded", events.get(1).outcome());
            assertEquals("Succeeded", events.get(1).detail());
        }
    }

    @Nested
    @DisplayName("request checks")
    class RequestCheckTests {

        @Test
        @DisplayName("refuses to nest past the recursion limit without creating a child")
        void recursionLimit() {
            var nested = new ScriptedSession("nested", "root", List.of("Helper"));
            fixture.host.register(nested);

            String result = fixture.service.delegate(Map.of("task", "x"), single(), nested);

            assertEquals("Maximum recursion level reached: 1 (current level: 1). Cannot create further subtasks.",
                    result);
            assertTrue(fixture.host.children().isEmpty());
        }

        @Test
        @DisplayName("lists missing required inputs")
        void missingInputs() {
            var config = single().toBuilder()
                    .inputParameters(List.of(TASK, ParameterSpec.required("deadline", ParameterType.DATETIME, "")))
                    .build();

            assertEquals("Missing required parameters: 'task' (What to do), 'deadline'",
                    fixture.service.delegate(Map.of(), config, fixture.root));
            assertTrue(fixture.host.children().isEmpty());
        }

        @Test
        @DisplayName("an explicit null satisfies a required input")
        void nullInputIsPresent() {
            Map<String, Object> args = new HashMap<>();
            args.put("task", null);

            assertEquals("Succeeded", fixture.service.delegate(args, single(), fixture.root));
        }

        @Test
        @DisplayName("invalid configuration propagates")
        void invalidConfiguration() {
            var config = single().toBuilder().functionName(" ").build();

            assertThrows(ConfigurationException.class,
                    () -> fixture.service.delegate(Map.of("task", "x"), config, fixture.root));
        }

        @Test
        @DisplayName("an unknown executive assistant fails the call")
        void unknownExecutive() {
            var config = single().toBuilder().executiveAssistant("Ghost").build();

            assertEquals("Failed: Executive assistant 'Ghost' was not found",
                    fixture.service.delegate(Map.of("task", "x"), config, fixture.root));
        }
    }

    @Nested
    @DisplayName("parallel fan-out")
    class ParallelTests {

        @Test
        @DisplayName("runs one child per list element and summarizes")
        void listBased() {
            var config = parallel(ParallelConfig.builder()
                    .executionType(ParallelExecutionType.LIST_BASED)
                    .listParameterName("cities")
                    .resultStrategy(ResultStrategy.WAIT_FOR_ALL)
                    .build());

            String result = fixture.service.delegate(Map.of("cities", List.of("Oslo", "Lima")), config, fixture.root);

            assertTrue(result.startsWith("Parallel execution completed: 2/2 sessions succeeded."), result);
            assertTrue(result.contains("done: Handle Oslo"));
            assertTrue(result.contains("done: Handle Lima"));
            assertEquals(2, fixture.host.children().size());
        }

        @Test
        @DisplayName("streams each result to the calling session")
        void streaming() {
            var config = parallel(ParallelConfig.builder()
                    .executionType(ParallelExecutionType.EXTERNAL_LIST)
                    .externalList(List.of("a", "b"))
                    .resultStrategy(ResultStrategy.STREAM_INDIVIDUAL)
                    .build());

            String result = fixture.service.delegate(Map.of(), config, fixture.root);

            assertEquals("Parallel execution completed with streaming: 2/2 sessions succeeded.", result);
            assertEquals(2, fixture.root.sentTexts().stream()
                    .filter(text -> text.startsWith("Parallel session ExternalList=")).count());
        }

        @Test
        @DisplayName("reports an unusable list as text")
        void sourceError() {
            var config = parallel(ParallelConfig.builder()
                    .executionType(ParallelExecutionType.LIST_BASED)
                    .listParameterName("cities")
                    .build());

            assertEquals("Parallel execution failed: List parameter 'cities' is missing or null",
                    fixture.service.delegate(Map.of(), config, fixture.root));
        }

        @Test
        @DisplayName("reports when no parameter is usable as a work item")
        void noValidParameters() {
            var config = parallel(ParallelConfig.builder()
                    .executionType(ParallelExecutionType.PARAMETER_BASED)
                    .build());

            assertEquals(ResultFormatter.NO_VALID_PARAMETERS,
                    fixture.service.delegate(Map.of("session", fixture.root), config, fixture.root));
        }
    }

    @Test
    void describesMissingInputs() {
        assertNull(DelegationService.describeMissingInputs(List.of(TASK), Map.of("task", "x")));
        assertEquals("'task' (What to do)", DelegationService.describeMissingInputs(List.of(TASK), Map.of()));
        assertNull(DelegationService.describeMissingInputs(
                List.of(ParameterSpec.optional("depth", ParameterType.INTEGER, "")), Map.of()));
    }
}
