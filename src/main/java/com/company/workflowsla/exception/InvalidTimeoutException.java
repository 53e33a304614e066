package com.company.workflowsla.exception;

import java.time.Duration;

public class InvalidTimeoutException extends WorkflowSlaException {
    public InvalidTimeoutException(String field, Duration timeout) {
        this(field, timeout, "greater than zero");
    }

    public InvalidTimeoutException(String field, Duration timeout, String requirement) {
        super("Invalid " + field + ": " + timeout + " (must be " + requirement + ")");
    }
}
