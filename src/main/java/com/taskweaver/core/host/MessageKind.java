package com.taskweaver.core.host;

/**
 * Kind of message posted into a host session.
 */
public enum MessageKind {
    /** Shown to the user only; does not trigger a model turn. */
    INFO_ONLY,
    /** Progress note; does not trigger a model turn. */
    STATUS_UPDATE,
    /** Regular message that starts a model turn. */
    MESSAGE
}
