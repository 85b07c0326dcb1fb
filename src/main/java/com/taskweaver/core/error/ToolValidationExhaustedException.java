package com.taskweaver.core.error;

/**
 * Raised through a completion gate when a child kept calling a tool with invalid
 * arguments until the retry budget ran out.
 */
public class ToolValidationExhaustedException extends DelegationException {

    private final String toolName;

    public ToolValidationExhaustedException(String toolName, int attempts, String details) {
        super("Validation failed after " + attempts + " attempts: " + details);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
