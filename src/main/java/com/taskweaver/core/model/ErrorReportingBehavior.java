package com.taskweaver.core.model;

/**
 * What happens after a child calls the error-report tool.
 */
public enum ErrorReportingBehavior {
    PAUSE,
    REPORT_ERROR
}
