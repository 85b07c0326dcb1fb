package com.taskweaver.core.host;

/**
 * Tool-calling mode of a session's next model turn.
 */
public enum ToolExecutionMode {
    AUTO,
    /** The model must call at least one tool. */
    REQUIRE_ANY,
    NONE
}
