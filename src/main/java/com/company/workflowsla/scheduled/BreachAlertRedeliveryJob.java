package com.company.workflowsla.scheduled;

import com.company.workflowsla.domain.SlaBreach;
import com.company.workflowsla.domain.SlaDefinition;
import com.company.workflowsla.repository.SlaBreachRepository;
import com.company.workflowsla.repository.SlaDefinitionRepository;
import com.company.workflowsla.service.BreachAlertDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Retries breach alerts that were never delivered.
 *
 * <p>Only breaches older than the grace period are considered, leaving fresh ones to the
 * after-commit delivery. Selected rows stay locked until the run commits, so overlapping
 * runs never pick the same breach.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "workflow.sla.alerts.redelivery.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class BreachAlertRedeliveryJob {

    private final SlaBreachRepository breachRepository;
    private final SlaDefinitionRepository definitionRepository;
    private final BreachAlertDispatcher alertDispatcher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${workflow.sla.alerts.redelivery.batch-size:100}")
    private int batchSize = 100;

    @Value("${workflow.sla.alerts.redelivery.grace-period-ms:300000}")
    private long gracePeriodMs = 300000;

    @Scheduled(
            fixedDelayString = "${workflow.sla.alerts.redelivery.interval-ms:300000}",
            initialDelayString = "${workflow.sla.alerts.redelivery.initial-delay-ms:60000}"
    )
    @Transactional
    public int redeliverPendingAlerts() {
        Instant cutoff = clock.instant().minus(Duration.ofMillis(gracePeriodMs));
        List<SlaBreach> pending = breachRepository.findUnalerted(cutoff, batchSize);

        if (pending.isEmpty()) {
            log.debug("No undelivered breach alerts");
            return 0;
        }

        log.info("Redelivering {} breach alerts", pending.size());

        Map<String, Optional<SlaDefinition>> definitions = new HashMap<>();
        int delivered = 0;
        int failed = 0;

        for (SlaBreach breach : pending) {
            try {
                Optional<SlaDefinition> definition =
                        definitions.computeIfAbsent(breach.getSlaId(), definitionRepository::findById);
                if (definition.isEmpty()) {
                    log.warn("Skipping alert for breach {}: SLA {} no longer exists",
                            breach.getBreachId(), breach.getSlaId());
                    failed++;
                    continue;
                }

                if (alertDispatcher.deliver(breach, definition.get())) {
                    delivered++;
                } else {
                    failed++;
                }

            } catch (Exception e) {
                log.error("Failed to redeliver alert for breach {}", breach.getBreachId(), e);
                failed++;
            }
        }

        meterRegistry.counter("sla.alerts.redelivered").increment(delivered);
        log.info("Breach alert redelivery: {} delivered, {} still pending", delivered, failed);
        return delivered;
    }
}
