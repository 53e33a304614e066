package com.company.workflowsla.scheduled;

import com.company.workflowsla.repository.ApprovalRepository;
import com.company.workflowsla.util.SweepResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Weekly removal of approved, denied and expired approvals older than the retention window.
 * Pending and escalated approvals are kept regardless of age.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "workflow.approval.cleanup.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ApprovalRetentionJob {

    private final ApprovalRepository approvalRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${workflow.approval.cleanup.retention-days:90}")
    private int retentionDays = 90;

    @Value("${workflow.approval.cleanup.batch-size:1000}")
    private int batchSize = 1000;

    @Value("${workflow.approval.cleanup.budget-ms:3600000}")
    private long budgetMs = 3600000;

    /**
     * Sunday 3 AM by default
     */
    @Scheduled(cron = "${workflow.approval.cleanup.cron:0 0 3 * * SUN}")
    public void scheduledCleanup() {
        try {
            cleanup();
        } catch (Exception e) {
            log.error("Approval retention cleanup failed", e);
            meterRegistry.counter("approvals.cleanup.failures").increment();
        }
    }

    public SweepResult cleanup() {
        Instant startedAt = clock.instant();
        Instant cutoff = startedAt.minus(Duration.ofDays(retentionDays));
        Instant deadline = startedAt.plusMillis(budgetMs);
        SweepResult result = new SweepResult();

        log.info("Deleting resolved approvals older than {} ({} days)", cutoff, retentionDays);

        int deleted;
        do {
            if (!clock.instant().isBefore(deadline)) {
                result.setBudgetExhausted(true);
                log.warn("Retention cleanup budget of {}ms exhausted, remaining approvals deferred to next run",
                        budgetMs);
                break;
            }
            deleted = approvalRepository.deleteResolvedBefore(cutoff, batchSize);
            result.addDeleted(deleted);
        } while (deleted >= batchSize);

        result.setDurationMs(Duration.between(startedAt, clock.instant()).toMillis());
        meterRegistry.counter("approvals.cleanup.deleted").increment(result.getDeleted());

        log.info("Retention cleanup removed {} approvals in {}ms", result.getDeleted(), result.getDurationMs());
        return result;
    }
}
