package com.company.workflowsla.exception;

import lombok.Getter;

/**
 * Soft failure: the breach was acknowledged before. Callers may treat this as success.
 */
@Getter
public class AlreadyAcknowledgedException extends WorkflowSlaException {

    private final Long breachId;

    public AlreadyAcknowledgedException(Long breachId) {
        super("SLA breach already acknowledged: " + breachId);
        this.breachId = breachId;
    }
}
