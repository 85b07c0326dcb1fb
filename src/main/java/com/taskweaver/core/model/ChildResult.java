package com.taskweaver.core.model;

import java.io.Serializable;

/**
 * The settled result of one child session.
 *
 * @param success      whether the child reported a result through the return tool
 * @param errorMessage failure description when {@code success} is false
 * @param result       serialized result payload when {@code success} is true
 */
public record ChildResult(boolean success, String errorMessage, String result) implements Serializable {

    public static ChildResult success(String result) {
        return new ChildResult(true, null, result);
    }

    public static ChildResult failure(String errorMessage) {
        return new ChildResult(false, errorMessage, null);
    }
}
