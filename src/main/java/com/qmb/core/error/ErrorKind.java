package com.qmb.core.error;

/**
 * Failure categories reported to callers. {@link #UNKNOWN_OPERATION} and {@link #INTERNAL}
 * are never raised by the core; they are assigned by the tool dispatch layer.
 */
public enum ErrorKind {
    VALIDATION,
    SESSION,
    WORKFLOW,
    UNKNOWN_OPERATION,
    INTERNAL
}
