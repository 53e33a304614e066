package com.company.workflowsla.exception;

public class SlaDefinitionNotFoundException extends NotFoundException {
    public SlaDefinitionNotFoundException(String slaId) {
        super("SLA definition not found: " + slaId);
    }
}
