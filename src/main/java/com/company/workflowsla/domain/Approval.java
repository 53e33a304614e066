package com.company.workflowsla.domain;

import com.company.workflowsla.domain.enums.ApprovalStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One human decision gating a workflow action.
 *
 * <p>{@code expiresAt} is the current deadline: the original one while pending, the
 * secondary one ({@code escalationTimeoutMs} after escalation) while escalated.
 * {@code resolvedAt} is set when the approval reaches a terminal state and stays null
 * while pending or escalated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Approval {
    private String approvalId;
    private String workflowRunId;
    private String actionRunId;
    private String actionType;
    private ApprovalStatus status;
    private String approverRole;
    private String escalateRole;
    private Long timeoutMs;
    private Long escalationTimeoutMs;
    private Instant expiresAt;
    private Instant escalatedAt;
    private Instant resolvedAt;
    private String actorId;
    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasEscalationPath() {
        return escalateRole != null && !escalateRole.isBlank();
    }

    /**
     * Role allowed to resolve the approval in its current state, or null once terminal.
     */
    public String requiredRole() {
        if (status == ApprovalStatus.PENDING) {
            return approverRole;
        }
        if (status == ApprovalStatus.ESCALATED) {
            return escalateRole;
        }
        return null;
    }
}
