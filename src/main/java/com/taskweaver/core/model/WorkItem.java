package com.taskweaver.core.model;

/**
 * One unit of parallel work, handed to exactly one child session.
 *
 * @param name  parameter name (or list name) the value came from
 * @param value the value for this child; may be null
 */
public record WorkItem(String name, Object value) {

    /** Label used in logs and summaries, e.g. {@code city=Paris}. */
    public String label() {
        return name + "=" + value;
    }
}
