package com.company.workflowsla.scheduled;

import com.company.workflowsla.domain.Approval;
import com.company.workflowsla.domain.enums.ApprovalStatus;
import com.company.workflowsla.repository.ApprovalRepository;
import com.company.workflowsla.service.ApprovalService;
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
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Escalation sweep: forces deadline transitions on due approvals.
 *
 * <p>Safe to run concurrently with itself and with human resolutions: each transition is a
 * conditional update, so an approval already moved on by someone else is skipped. The sweep
 * stops once its budget is spent and leaves the rest to the next run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "workflow.approval.sweep.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ApprovalEscalationJob {

    private final ApprovalRepository approvalRepository;
    private final ApprovalService approvalService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${workflow.approval.sweep.batch-size:100}")
    private int batchSize = 100;

    @Value("${workflow.approval.sweep.budget-ms:300000}")
    private long budgetMs = 300000;

    @Scheduled(
            fixedDelayString = "${workflow.approval.sweep.interval-ms:300000}",
            initialDelayString = "${workflow.approval.sweep.initial-delay-ms:60000}"
    )
    public void scheduledSweep() {
        sweep();
    }

    public SweepResult sweep() {
        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plusMillis(budgetMs);
        SweepResult result = new SweepResult();

        // Failed or skipped approvals are not fetched again in this run
        Set<String> attempted = new HashSet<>();

        log.debug("Starting approval escalation sweep");

        sweepLoop:
        while (true) {
            List<Approval> due = approvalRepository.findDue(startedAt, batchSize, attempted);
            if (due.isEmpty()) {
                break;
            }

            for (Approval approval : due) {
                if (!clock.instant().isBefore(deadline)) {
                    result.setBudgetExhausted(true);
                    break sweepLoop;
                }
                process(approval, result, attempted);
            }
        }

        long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
        result.setDurationMs(durationMs);
        meterRegistry.timer("approvals.sweep.duration").record(Duration.ofMillis(durationMs));

        if (result.isBudgetExhausted()) {
            log.warn("Escalation sweep budget of {}ms exhausted, remaining approvals deferred to next run", budgetMs);
        }
        if (result.getTransitioned() > 0 || result.getFailed() > 0) {
            log.info("Escalation sweep completed: {} escalated, {} expired, {} skipped, {} failed in {}ms",
                    result.getEscalated(), result.getExpired(), result.getSkipped(), result.getFailed(), durationMs);
        } else {
            log.debug("Escalation sweep found nothing to transition");
        }

        return result;
    }

    private void process(Approval approval, SweepResult result, Set<String> attempted) {
        try {
            Optional<ApprovalStatus> transitioned = approvalService.applyDeadline(approval);

            if (transitioned.isEmpty()) {
                attempted.add(approval.getApprovalId());
                result.incrementSkipped();
            } else if (transitioned.get() == ApprovalStatus.ESCALATED) {
                result.incrementEscalated();
            } else {
                result.incrementExpired();
            }

        } catch (Exception e) {
            attempted.add(approval.getApprovalId());
            result.incrementFailed();
            log.error("Failed to apply deadline to approval {}", approval.getApprovalId(), e);
            meterRegistry.counter("approvals.sweep.failures").increment();
        }
    }
}
