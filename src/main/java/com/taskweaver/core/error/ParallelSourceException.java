package com.taskweaver.core.error;

/**
 * Thrown when work items cannot be derived from a request, for example when the
 * configured list argument is missing, empty or not a list.
 */
public class ParallelSourceException extends ConfigurationException {

    public ParallelSourceException(String message) {
        super(message);
    }
}
