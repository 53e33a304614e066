package com.company.workflowsla.util;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one escalation sweep or retention pass.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SweepResult {
    private int escalated;
    private int expired;
    private int skipped;
    private int failed;
    private int deleted;
    private boolean budgetExhausted;
    private long durationMs;

    public int getTransitioned() {
        return escalated + expired;
    }

    public void incrementEscalated() {
        escalated++;
    }

    public void incrementExpired() {
        expired++;
    }

    public void incrementSkipped() {
        skipped++;
    }

    public void incrementFailed() {
        failed++;
    }

    public void addDeleted(int count) {
        deleted += count;
    }
}
