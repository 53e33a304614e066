package com.company.workflowsla.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaDefinition {
    private String slaId;
    private String name;
    private String workflowId;
    private Long targetDurationMs;
    private Long warningThresholdMs;
    private Long criticalThresholdMs;
    private Integer windowHours;
    private BigDecimal targetPercentage;
    private Long totalExecutions;
    private Long breachedExecutions;
    private BigDecimal currentPercentage;
    private List<String> alertRecipients;
    private Boolean active;
    private Instant countersRefreshedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isActive() {
        return !Boolean.FALSE.equals(active);
    }

    public boolean hasMonotonicThresholds() {
        return targetDurationMs != null && warningThresholdMs != null && criticalThresholdMs != null
                && targetDurationMs <= warningThresholdMs
                && warningThresholdMs <= criticalThresholdMs;
    }
}
