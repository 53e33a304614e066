package com.company.workflowsla.util;

import com.company.workflowsla.domain.enums.BreachSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaReportResult {
    private String slaId;
    private String executionId;
    private boolean accepted;           // false when the SLA is inactive
    private BreachSeverity severity;    // null when within thresholds
    private Long breachId;
    private long totalExecutions;
    private long breachedExecutions;
    private BigDecimal currentPercentage;

    public boolean isBreached() {
        return severity != null;
    }

    public static SlaReportResult ignored(String slaId, String executionId) {
        return SlaReportResult.builder()
                .slaId(slaId)
                .executionId(executionId)
                .accepted(false)
                .build();
    }
}
