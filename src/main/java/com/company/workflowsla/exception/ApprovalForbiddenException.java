package com.company.workflowsla.exception;

import lombok.Getter;

@Getter
public class ApprovalForbiddenException extends WorkflowSlaException {

    private final String approvalId;
    private final String actingRole;
    private final String requiredRole;

    public ApprovalForbiddenException(String approvalId, String actingRole, String requiredRole) {
        super("Role " + actingRole + " may not resolve approval " + approvalId + " (requires " + requiredRole + ")");
        this.approvalId = approvalId;
        this.actingRole = actingRole;
        this.requiredRole = requiredRole;
    }
}
