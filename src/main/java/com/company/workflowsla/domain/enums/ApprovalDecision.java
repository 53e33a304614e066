package com.company.workflowsla.domain.enums;

public enum ApprovalDecision {
    APPROVED(ApprovalStatus.APPROVED),
    DENIED(ApprovalStatus.DENIED);

    private final ApprovalStatus resultingStatus;

    ApprovalDecision(ApprovalStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public ApprovalStatus getResultingStatus() {
        return resultingStatus;
    }

    public String value() {
        return name().toLowerCase();
    }
}
