package com.company.workflowsla.exception;

public class InvalidSlaDefinitionException extends WorkflowSlaException {
    public InvalidSlaDefinitionException(String slaId, String reason) {
        super("Invalid SLA definition " + slaId + ": " + reason);
    }
}
