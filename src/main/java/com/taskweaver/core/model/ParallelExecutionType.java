package com.taskweaver.core.model;

/**
 * Where the work items of a parallel delegation come from.
 */
public enum ParallelExecutionType {
    NONE,
    PARAMETER_BASED,
    LIST_BASED,
    EXTERNAL_LIST
}
