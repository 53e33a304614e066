package com.company.workflowsla.exception;

/**
 * Event delivery failure inside a bus backend. Always recovered by the bus, never
 * surfaced to publishers.
 */
public class BackendUnavailableException extends WorkflowSlaException {
    public BackendUnavailableException(String backend, String eventType, Throwable cause) {
        super("Event backend " + backend + " unavailable for event " + eventType, cause);
    }
}
