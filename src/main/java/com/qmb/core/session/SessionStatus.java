package com.qmb.core.session;

/**
 * Lifecycle status of a build session.
 */
public enum SessionStatus {
    ACTIVE,
    /** Put aside when another session started; keeps its state and can be resumed. */
    SUSPENDED,
    RESET
}
