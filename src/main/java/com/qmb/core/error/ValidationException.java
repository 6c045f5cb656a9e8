package com.qmb.core.error;

/**
 * Malformed or missing input: bad project name, absent spec or samples, bad option values.
 */
public class ValidationException extends ModelBuilderException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
