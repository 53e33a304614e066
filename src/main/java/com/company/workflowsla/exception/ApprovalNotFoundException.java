package com.company.workflowsla.exception;

public class ApprovalNotFoundException extends NotFoundException {
    public ApprovalNotFoundException(String approvalId) {
        super("Approval not found: " + approvalId);
    }
}
