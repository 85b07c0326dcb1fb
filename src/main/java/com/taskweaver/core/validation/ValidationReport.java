package com.taskweaver.core.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of checking tool arguments against a parameter schema.
 *
 * @param missingRequired names of required parameters whose key was absent
 * @param typeErrors      one message per present value of an incompatible type
 */
public record ValidationReport(List<String> missingRequired, List<String> typeErrors) {

    public ValidationReport {
        missingRequired = List.copyOf(missingRequired);
        typeErrors = List.copyOf(typeErrors);
    }

    public boolean isValid() {
        return missingRequired.isEmpty() && typeErrors.isEmpty();
    }

    public boolean hasMissingRequired() {
        return !missingRequired.isEmpty();
    }

    public boolean hasTypeErrors() {
        return !typeErrors.isEmpty();
    }

    /**
     * Human-readable description, e.g.
     * {@code Missing required parameters: a, b AND Type validation errors: ...}.
     */
    public String describe() {
        List<String> parts = new ArrayList<>();
        if (hasMissingRequired()) {
            parts.add("Missing required parameters: " + String.join(", ", missingRequired));
        }
        if (hasTypeErrors()) {
            parts.add("Type validation errors: " + String.join("; ", typeErrors));
        }
        return String.join(" AND ", parts);
    }
}
