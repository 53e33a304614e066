package com.company.workflowsla.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SloMetrics {
    private String slaId;
    private Integer windowHours;
    private Instant windowStart;
    private Long totalExecutions;
    private Long breachedExecutions;
    private BigDecimal sloPercentage;
    private BigDecimal targetPercentage;
    private Boolean meetsTarget;
    private Long criticalBreaches;
    private Long warningBreaches;
}
