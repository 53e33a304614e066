package com.company.workflowsla.domain;

import com.company.workflowsla.domain.enums.BreachSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaBreach {
    private Long breachId;
    private String slaId;
    private String executionId;
    private BreachSeverity severity;
    private Long actualDurationMs;
    private Long targetDurationMs;
    private Long breachMarginMs;
    private Boolean alertSent;
    private Instant alertSentAt;
    private List<String> alertRecipients;
    private Boolean acknowledged;
    private Instant acknowledgedAt;
    private String acknowledgedBy;
    private String resolutionNotes;
    private Instant detectedAt;
    private Instant updatedAt;
}
