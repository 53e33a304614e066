package com.company.workflowsla.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Approval lifecycle. Transitions only move forward along
 * {@code PENDING -> {APPROVED, DENIED, ESCALATED, EXPIRED}} and
 * {@code ESCALATED -> {APPROVED, DENIED, EXPIRED}}.
 */
public enum ApprovalStatus {
    PENDING("Awaiting a decision by the approver role"),
    APPROVED("Approved by a human decision"),
    DENIED("Denied by a human decision"),
    ESCALATED("Deadline passed, awaiting a decision by the escalation role"),
    EXPIRED("Final deadline passed without a decision");

    private final String description;

    ApprovalStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public String value() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == APPROVED || this == DENIED || this == EXPIRED;
    }

    public boolean isResolvable() {
        return this == PENDING || this == ESCALATED;
    }

    public Set<ApprovalStatus> allowedTransitions() {
        switch (this) {
            case PENDING:
                return EnumSet.of(APPROVED, DENIED, ESCALATED, EXPIRED);
            case ESCALATED:
                return EnumSet.of(APPROVED, DENIED, EXPIRED);
            default:
                return EnumSet.noneOf(ApprovalStatus.class);
        }
    }

    public boolean canTransitionTo(ApprovalStatus target) {
        return allowedTransitions().contains(target);
    }

    public static ApprovalStatus fromString(String status) {
        if (status == null) {
            return PENDING;
        }
        return ApprovalStatus.valueOf(status.toUpperCase());
    }
}
