package com.taskweaver.core.parallel;

import com.taskweaver.core.concurrent.CancellationToken;
import com.taskweaver.core.error.ParallelSourceException;
import com.taskweaver.core.host.ScriptedSession;
import com.taskweaver.core.model.ParallelConfig;
import com.taskweaver.core.model.ParallelExecutionType;
import com.taskweaver.core.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParallelSourceExtractorTest {

    private final ParallelSourceExtractor extractor = new ParallelSourceExtractor();

    private static ParallelConfig config(ParallelExecutionType type) {
        return ParallelConfig.builder().executionType(type).listParameterName("cities").build();
    }

    @Test
    @DisplayName("NONE and a missing configuration yield no items")
    void noneYieldsNothing() {
        assertTrue(extractor.extract(Map.of("task", "x"), config(ParallelExecutionType.NONE)).isEmpty());
        assertTrue(extractor.extract(Map.of("task", "x"), null).isEmpty());
    }

    @Nested
    @DisplayName("LIST_BASED")
    class ListBasedTests {

        @Test
        @DisplayName("one item per list element, in order")
        void itemsPerElement() {
            var items = extractor.extract(Map.of("cities", List.of("x", "y", "z")),
                    config(ParallelExecutionType.LIST_BASED));

            assertEquals(List.of(new WorkItem("cities", "x"), new WorkItem("cities", "y"),
                    new WorkItem("cities", "z")), items);
        }

        @Test
        @DisplayName("accepts arrays")
        void acceptsArrays() {
            var items = extractor.extract(Map.of("cities", new int[] {1, 2}),
                    config(ParallelExecutionType.LIST_BASED));

            assertEquals(List.of(1, 2), items.stream().map(WorkItem::value).toList());
        }

        @Test
        @DisplayName("keeps null elements")
        void keepsNullElements() {
            var items = extractor.extract(Map.of("cities", Arrays.asList("a", null)),
                    config(ParallelExecutionType.LIST_BASED));

            assertEquals(2, items.size());
            assertNull(items.get(1).value());
        }

        @Test
        @DisplayName("rejects a missing list parameter name")
        void missingListName() {
            var config = ParallelConfig.builder().executionType(ParallelExecutionType.LIST_BASED).build();

            var thrown = assertThrows(ParallelSourceException.class,
                    () -> extractor.extract(Map.of("cities", List.of("x")), config));
            assertEquals("A list parameter name must be configured for list-based execution", thrown.getMessage());
        }

        @Test
        @DisplayName("rejects a missing or null list")
        void missingList() {
            var thrown = assertThrows(ParallelSourceException.class,
                    () -> extractor.extract(Map.of(), config(ParallelExecutionType.LIST_BASED)));
            assertEquals("List parameter 'cities' is missing or null", thrown.getMessage());
        }

        @Test
        @DisplayName("rejects a string where a list is expected")
        void rejectsString() {
            var thrown = assertThrows(ParallelSourceException.class,
                    () -> extractor.extract(Map.of("cities", "x,y"), config(ParallelExecutionType.LIST_BASED)));
            assertEquals("List parameter 'cities' must be a list, not a string", thrown.getMessage());
        }

        @Test
        @DisplayName("rejects a scalar where a list is expected")
        void rejectsScalar() {
            var thrown = assertThrows(ParallelSourceException.class,
                    () -> extractor.extract(Map.of("cities", 3), config(ParallelExecutionType.LIST_BASED)));
            assertEquals("List parameter 'cities' must be a list, got Integer", thrown.getMessage());
        }

        @Test
        @DisplayName("rejects an empty list")
        void rejectsEmpty() {
            assertThrows(ParallelSourceException.class,
                    () -> extractor.extract(Map.of("cities", List.of()), config(ParallelExecutionType.LIST_BASED)));
        }
    }

    @Nested
    @DisplayName("EXTERNAL_LIST")
    class ExternalListTests {

        @Test
        @DisplayName("names every item ExternalList regardless of the request")
        void externalItems() {
            var config = ParallelConfig.builder()
                    .executionType(ParallelExecutionType.EXTERNAL_LIST)
                    .externalList(List.of("alpha", "beta"))
                    .build();

            var items = extractor.extract(Map.of("ignored", "value"), config);

            assertEquals(List.of(new WorkItem("ExternalList", "alpha"), new WorkItem("ExternalList", "beta")), items);
        }

        @Test
        @DisplayName("rejects an empty external list")
        void rejectsEmpty() {
            var thrown = assertThrows(ParallelSourceException.class,
                    () -> extractor.extract(Map.of(), config(ParallelExecutionType.EXTERNAL_LIST)));
            assertEquals("The external list must not be empty for external-list execution", thrown.getMessage());
        }
    }

    @Nested
    @DisplayName("PARAMETER_BASED")
    class ParameterBasedTests {

        @Test
        @DisplayName("one item per data argument, skipping the session")
        void itemsPerArgument() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("subtask1", "A");
            args.put("subtask2", "B");
            args.put("session", new ScriptedSession("parent"));

            var items = extractor.extract(args, config(ParallelExecutionType.PARAMETER_BASED));

            assertEquals(List.of(new WorkItem("subtask1", "A"), new WorkItem("subtask2", "B")), items);
        }

        @Test
        @DisplayName("honours configured exclusions ignoring case")
        void configuredExclusions() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("Context", "shared");
            args.put("part", "one");
            var config = ParallelConfig.builder()
                    .executionType(ParallelExecutionType.PARAMETER_BASED)
                    .excludedParameterNames(List.of("context"))
                    .build();

            var items = extractor.extract(args, config);

            assertEquals(List.of(new WorkItem("part", "one")), items);
        }

        @Test
        @DisplayName("keeps null values and skips host plumbing")
        void nullsAndPlumbing() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("maybe", null);
            args.put("token", CancellationToken.create());
            args.put("callback", (Runnable) () -> { });
            args.put("thread", Thread.currentThread());

            var items = extractor.extract(args, config(ParallelExecutionType.PARAMETER_BASED));

            assertEquals(1, items.size());
            assertEquals("maybe", items.get(0).name());
            assertNull(items.get(0).value());
        }

        @Test
        @DisplayName("may return no items")
        void mayBeEmpty() {
            var items = extractor.extract(Map.of("_session", "x"), config(ParallelExecutionType.PARAMETER_BASED));

            assertTrue(items.isEmpty());
        }
    }

    @Test
    @DisplayName("classifies plain data")
    void plainData() {
        assertTrue(ParallelSourceExtractor.isPlainData("text"));
        assertTrue(ParallelSourceExtractor.isPlainData(42));
        assertTrue(ParallelSourceExtractor.isPlainData(Map.of("k", 1)));
        assertTrue(ParallelSourceExtractor.isPlainData(List.of(1, 2)));
        assertFalse(ParallelSourceExtractor.isPlainData(new Object()));
    }
}
