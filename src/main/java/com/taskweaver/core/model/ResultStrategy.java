package com.taskweaver.core.model;

/**
 * How the outcomes of parallel children are combined.
 */
public enum ResultStrategy {
    /** Notify the parent session as each child finishes. */
    STREAM_INDIVIDUAL,
    /** Collect every outcome before returning. */
    WAIT_FOR_ALL,
    /** Return on the first success and cancel the remaining children. */
    FIRST_RESULT_WINS
}
