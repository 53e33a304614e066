package com.company.workflowsla.exception;

/**
 * Unknown identifier. Usually a client bug rather than a state problem.
 */
public abstract class NotFoundException extends WorkflowSlaException {

    protected NotFoundException(String message) {
        super(message);
    }
}
