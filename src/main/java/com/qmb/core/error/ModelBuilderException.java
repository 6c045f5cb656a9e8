package com.qmb.core.error;

/**
 * Base type for every precondition failure raised by the model builder core.
 * Failures are reported synchronously and never retried internally.
 */
public abstract class ModelBuilderException extends RuntimeException {

    private final ErrorKind kind;

    protected ModelBuilderException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
