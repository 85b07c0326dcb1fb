package com.taskweaver.core.engine;

import com.taskweaver.core.model.AggregateOutcome;
import com.taskweaver.core.model.ChildResult;
import com.taskweaver.core.model.WorkItemOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns delegation outcomes into the text returned to the delegating agent.
 */
public final class ResultFormatter {

    public static final String SUCCEEDED = "Succeeded";
    public static final String FAILED = "Failed";
    public static final String NO_VALID_PARAMETERS = "No valid parameters found for parallel execution.";

    private ResultFormatter() {}

    public static String formatSingle(ChildResult result) {
        if (result != null && result.success()) {
            return SUCCEEDED;
        }
        String message = result != null && result.errorMessage() != null && !result.errorMessage().isBlank()
                ? result.errorMessage()
                : "The child session reported an error.";
        return FAILED + ": " + message;
    }

    public static String formatParallel(AggregateOutcome outcome) {
        StringBuilder text = new StringBuilder();
        if (outcome.success()) {
            text.append(successSummary(outcome)).append('\n');
            if (outcome.failedCount() > 0) {
                String errors = formatErrors(outcome.outcomes());
                if (!errors.isEmpty()) {
                    text.append('\n')
                            .append("Errors (").append(outcome.failedCount()).append(" failed):\n")
                            .append(errors);
                }
            }
        } else {
            String details = outcome.errorMessage() != null && !outcome.errorMessage().isEmpty()
                    ? outcome.errorMessage()
                    : outcome.completedCount() + "/" + outcome.totalCount() + " sessions succeeded, "
                            + outcome.failedCount() + " failed";
            text.append("Parallel execution failed: ").append(details).append('\n');
            String errors = formatErrors(outcome.outcomes());
            if (!errors.isEmpty()) {
                text.append('\n').append(errors);
            }
        }
        return text.toString().stripTrailing();
    }

    private static String successSummary(AggregateOutcome outcome) {
        return switch (outcome.strategy()) {
            case STREAM_INDIVIDUAL -> "Parallel execution completed with streaming: "
                    + outcome.completedCount() + "/" + outcome.totalCount() + " sessions succeeded.";
            case WAIT_FOR_ALL -> "Parallel execution completed: "
                    + outcome.completedCount() + "/" + outcome.totalCount() + " sessions succeeded.\nResults:\n"
                    + resultList(outcome.outcomes()) + " " + SUCCEEDED;
            case FIRST_RESULT_WINS -> "First result received: " + outcome.firstSuccess()
                    .map(o -> o.childResult().result())
                    .orElse("No result");
        };
    }

    private static String resultList(List<WorkItemOutcome> outcomes) {
        List<String> lines = new ArrayList<>();
        for (WorkItemOutcome outcome : outcomes) {
            if (outcome.isSuccess() && outcome.childResult().result() != null
                    && !outcome.childResult().result().isEmpty()) {
                lines.add((lines.size() + 1) + ". " + outcome.childResult().result());
            }
        }
        return lines.isEmpty() ? "No successful results" : String.join("\n", lines);
    }

    private static String formatErrors(List<WorkItemOutcome> outcomes) {
        List<String> lines = new ArrayList<>();
        for (WorkItemOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                String label = outcome.name() != null ? "[" + outcome.name() + "=" + outcome.value() + "]" : "[Unknown]";
                lines.add("- " + label + ": " + outcome.failureMessage());
            }
        }
        return String.join("\n", lines);
    }
}
