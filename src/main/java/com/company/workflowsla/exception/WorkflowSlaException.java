package com.company.workflowsla.exception;

/**
 * Base type for errors raised by the approval and SLA engine.
 */
public abstract class WorkflowSlaException extends RuntimeException {

    protected WorkflowSlaException(String message) {
        super(message);
    }

    protected WorkflowSlaException(String message, Throwable cause) {
        super(message, cause);
    }
}
