package com.company.workflowsla.domain;

import com.company.workflowsla.domain.enums.LatencyClass;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only catalog entry for a workflow action type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionMetadata {
    private String actionType;
    private boolean idempotent;
    private LatencyClass latencyClass;
}
