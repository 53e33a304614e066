package com.company.workflowsla.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.Map;

/**
 * Request to open an approval gate for one action run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateApprovalRequest {
    @NotBlank(message = "Workflow run ID is required")
    private String workflowRunId;

    @NotBlank(message = "Action run ID is required")
    private String actionRunId;

    @NotBlank(message = "Approver role is required")
    private String approverRole;

    // Optional fields
    private String escalateRole;        // empty means no escalation path
    private Duration timeout;           // null falls back to the action catalog
    private Duration escalationTimeout; // null means timeout x multiplier
    private String actionType;
    private Map<String, Object> metadata;
}
