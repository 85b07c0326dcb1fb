package com.taskweaver.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parallel execution settings of a delegation.
 *
 * @param executionType          where work items come from
 * @param maxConcurrency         upper bound on concurrently running children; {@code <= 0} means CPU count
 * @param resultStrategy         how outcomes are combined
 * @param listParameterName      request argument holding the list for {@link ParallelExecutionType#LIST_BASED}
 * @param externalList           configured values for {@link ParallelExecutionType#EXTERNAL_LIST}
 * @param excludedParameterNames request arguments ignored by {@link ParallelExecutionType#PARAMETER_BASED}
 * @param sessionTimeoutMs       per-child timeout in milliseconds
 */
public record ParallelConfig(
    ParallelExecutionType executionType,
    int maxConcurrency,
    ResultStrategy resultStrategy,
    String listParameterName,
    List<Object> externalList,
    List<String> excludedParameterNames,
    long sessionTimeoutMs
) {

    public static final long DEFAULT_SESSION_TIMEOUT_MS = 30L * 60 * 1000;

    public ParallelConfig {
        executionType = executionType != null ? executionType : ParallelExecutionType.NONE;
        externalList = externalList != null
                ? Collections.unmodifiableList(new ArrayList<>(externalList)) : List.of();
        excludedParameterNames = excludedParameterNames != null ? List.copyOf(excludedParameterNames) : List.of();
        sessionTimeoutMs = sessionTimeoutMs > 0 ? sessionTimeoutMs : DEFAULT_SESSION_TIMEOUT_MS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ParallelExecutionType executionType = ParallelExecutionType.NONE;
        private int maxConcurrency = Runtime.getRuntime().availableProcessors();
        private ResultStrategy resultStrategy = ResultStrategy.WAIT_FOR_ALL;
        private String listParameterName;
        private List<Object> externalList = List.of();
        private List<String> excludedParameterNames = List.of();
        private long sessionTimeoutMs = DEFAULT_SESSION_TIMEOUT_MS;

        private Builder() {}

        public Builder executionType(ParallelExecutionType executionType) {
            this.executionType = executionType;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder resultStrategy(ResultStrategy resultStrategy) {
            this.resultStrategy = resultStrategy;
            return this;
        }

        public Builder listParameterName(String listParameterName) {
            this.listParameterName = listParameterName;
            return this;
        }

        public Builder externalList(List<?> externalList) {
            this.externalList = externalList != null ? new ArrayList<>(externalList) : List.of();
            return this;
        }

        public Builder excludedParameterNames(List<String> excludedParameterNames) {
            this.excludedParameterNames = excludedParameterNames;
            return this;
        }

        public Builder sessionTimeoutMs(long sessionTimeoutMs) {
            this.sessionTimeoutMs = sessionTimeoutMs;
            return this;
        }

        public ParallelConfig build() {
            return new ParallelConfig(executionType, maxConcurrency, resultStrategy, listParameterName,
                    externalList, excludedParameterNames, sessionTimeoutMs);
        }
    }
}
