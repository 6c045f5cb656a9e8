package com.qmb.core.error;

/**
 * Operation attempted out of the required order (build before model type selection,
 * approve before build, revert to a future stage, export before approval).
 */
public class WorkflowException extends ModelBuilderException {

    public WorkflowException(String message) {
        super(ErrorKind.WORKFLOW, message);
    }
}
