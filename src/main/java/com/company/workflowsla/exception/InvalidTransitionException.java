package com.company.workflowsla.exception;

import com.company.workflowsla.domain.enums.ApprovalStatus;
import lombok.Getter;

/**
 * State machine violation. When {@link #isAlreadyResolved()} is true the approval
 * has already left its resolvable states, which callers may treat as benign.
 */
@Getter
public class InvalidTransitionException extends WorkflowSlaException {

    private final String approvalId;
    private final ApprovalStatus currentStatus;
    private final ApprovalStatus requestedStatus;

    public InvalidTransitionException(String approvalId, ApprovalStatus currentStatus, ApprovalStatus requestedStatus) {
        super("Approval " + approvalId + " cannot move from " + currentStatus + " to " + requestedStatus);
        this.approvalId = approvalId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public boolean isAlreadyResolved() {
        return currentStatus != null && currentStatus.isTerminal();
    }
}
