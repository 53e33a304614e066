package com.company.workflowsla.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One reported workflow-run duration. Rolling SLO counters are recomputed from the
 * samples that fall inside the SLA's trailing window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaExecutionSample {
    private String slaId;
    private String executionId;
    private Long actualDurationMs;
    private Boolean breached;
    private Instant reportedAt;
}
