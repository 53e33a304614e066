package com.company.workflowsla.exception;

public class BreachNotFoundException extends NotFoundException {
    public BreachNotFoundException(Long breachId) {
        super("SLA breach not found: " + breachId);
    }
}
