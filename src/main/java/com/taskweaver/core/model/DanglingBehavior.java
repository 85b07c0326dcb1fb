package com.taskweaver.core.model;

/**
 * What a coordinator does when a child's model turn ends without calling the return tool.
 */
public enum DanglingBehavior {
    /** Re-prompt the child with the urging message, at most three times. */
    URGE,
    /** Settle immediately with a failed result. */
    REPORT_ERROR,
    /** Keep waiting for a tool call without prompting. */
    PAUSE
}
