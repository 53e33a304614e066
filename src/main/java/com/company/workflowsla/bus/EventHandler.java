package com.company.workflowsla.bus;

/**
 * In-process subscriber callback. Handlers are compared by identity when
 * subscribing and unsubscribing.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event);
}
