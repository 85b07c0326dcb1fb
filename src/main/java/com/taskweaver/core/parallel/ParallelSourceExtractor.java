package com.taskweaver.core.parallel;

import com.taskweaver.core.concurrent.CancellationToken;
import com.taskweaver.core.error.ParallelSourceException;
import com.taskweaver.core.host.CancellationControl;
import com.taskweaver.core.host.Host;
import com.taskweaver.core.host.SessionHandle;
import com.taskweaver.core.model.ParallelConfig;
import com.taskweaver.core.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.lang.reflect.Array;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Derives the work items of a parallel delegation from its request arguments.
 * <p>
 * {@code LIST_BASED} and {@code EXTERNAL_LIST} fail loudly when they would yield no
 * items. {@code PARAMETER_BASED} may return an empty list; callers treat that as
 * "no valid parameters". {@code NONE} always returns an empty list, meaning a single
 * child runs with the whole request.
 */
@Component
public class ParallelSourceExtractor {

    private static final Logger log = LoggerFactory.getLogger(ParallelSourceExtractor.class);

    public static final String EXTERNAL_LIST_ITEM_NAME = "ExternalList";

    /** Request keys that carry host plumbing rather than task data, compared ignoring case. */
    static final Set<String> BUILT_IN_EXCLUSIONS = Set.of(
            "_session", "session", "hostsession", "parentsession", "cancellationtoken");

    private static final List<String> RESERVED_PACKAGES = List.of(
            "java.", "javax.", "jdk.", "sun.", "org.slf4j.", "org.springframework.", "com.taskweaver.");

    public List<WorkItem> extract(Map<String, Object> requestArgs, ParallelConfig config) {
        if (config == null) {
            return List.of();
        }
        return switch (config.executionType()) {
            case NONE -> List.of();
            case LIST_BASED -> fromList(requestArgs, config.listParameterName());
            case EXTERNAL_LIST -> fromExternalList(config.externalList());
            case PARAMETER_BASED -> fromParameters(requestArgs, config.excludedParameterNames());
        };
    }

    private List<WorkItem> fromList(Map<String, Object> requestArgs, String listName) {
        if (listName == null || listName.isBlank()) {
            throw new ParallelSourceException("A list parameter name must be configured for list-based execution");
        }
        Object raw = requestArgs.get(listName);
        if (raw == null) {
            throw new ParallelSourceException("List parameter '" + listName + "' is missing or null");
        }
        if (raw instanceof CharSequence) {
            throw new ParallelSourceException("List parameter '" + listName + "' must be a list, not a string");
        }
        List<WorkItem> items = new ArrayList<>();
        if (raw instanceof Iterable<?> iterable) {
            for (Object element : iterable) {
                items.add(new WorkItem(listName, element));
            }
        } else if (raw.getClass().isArray()) {
            int length = Array.getLength(raw);
            for (int i = 0; i < length; i++) {
                items.add(new WorkItem(listName, Array.get(raw, i)));
            }
        } else {
            throw new ParallelSourceException("List parameter '" + listName + "' must be a list, got "
                    + raw.getClass().getSimpleName());
        }
        if (items.isEmpty()) {
            throw new ParallelSourceException("List parameter '" + listName + "' must not be empty");
        }
        return items;
    }

    private List<WorkItem> fromExternalList(List<Object> externalList) {
        if (externalList == null || externalList.isEmpty()) {
            throw new ParallelSourceException("The external list must not be empty for external-list execution");
        }
        return externalList.stream()
                .map(value -> new WorkItem(EXTERNAL_LIST_ITEM_NAME, value))
                .toList();
    }

    private List<WorkItem> fromParameters(Map<String, Object> requestArgs, List<String> excludedNames) {
        Set<String> excluded = excludedNames.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<WorkItem> items = new ArrayList<>();
        for (Map.Entry<String, Object> entry : requestArgs.entrySet()) {
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            if (BUILT_IN_EXCLUSIONS.contains(key) || excluded.contains(key)) {
                continue;
            }
            if (!isPlainData(entry.getValue())) {
                log.debug("Skipping non-data parameter '{}' of type {}", entry.getKey(),
                        entry.getValue().getClass().getName());
                continue;
            }
            items.add(new WorkItem(entry.getKey(), entry.getValue()));
        }
        return items;
    }

    static boolean isPlainData(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof SessionHandle || value instanceof Host
                || value instanceof CancellationToken || value instanceof CancellationControl) {
            return false;
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                || value instanceof Character || value instanceof UUID || value instanceof Enum<?>
                || value instanceof TemporalAccessor || value instanceof Map<?, ?>
                || value instanceof Collection<?> || value.getClass().isArray()) {
            return true;
        }
        Class<?> type = value.getClass();
        if (type.isSynthetic() || type.getName().contains("$$Lambda")) {
            return false;
        }
        String typeName = type.getName();
        return RESERVED_PACKAGES.stream().noneMatch(typeName::startsWith);
    }
}
