package com.company.workflowsla.scheduled;

import com.company.workflowsla.domain.SlaDefinition;
import com.company.workflowsla.repository.SlaDefinitionRepository;
import com.company.workflowsla.repository.SlaExecutionSampleRepository;
import com.company.workflowsla.service.SlaMonitorService;
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
import java.util.List;

/**
 * Keeps rolling SLO counters current between reports: drops samples that aged out of
 * every window still queried and recomputes each active SLA's counters.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "workflow.sla.window.maintenance.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SlaWindowMaintenanceJob {

    private final SlaDefinitionRepository definitionRepository;
    private final SlaExecutionSampleRepository sampleRepository;
    private final SlaMonitorService slaMonitorService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // Samples stay queryable for SLO reports over windows longer than the SLA's own
    @Value("${workflow.sla.window.sample-retention-hours:720}")
    private int sampleRetentionHours = 720;

    @Scheduled(
            fixedDelayString = "${workflow.sla.window.maintenance-interval-ms:900000}",
            initialDelayString = "${workflow.sla.window.initial-delay-ms:120000}"
    )
    public void maintainWindows() {
        List<SlaDefinition> definitions = definitionRepository.findAllActive();
        if (definitions.isEmpty()) {
            log.debug("No active SLA definitions to maintain");
            return;
        }

        int refreshed = 0;
        int pruned = 0;

        for (SlaDefinition definition : definitions) {
            try {
                Instant cutoff = clock.instant().minus(
                        Duration.ofHours(Math.max(definition.getWindowHours(), sampleRetentionHours)));
                pruned += sampleRepository.deleteOlderThan(definition.getSlaId(), cutoff);

                slaMonitorService.refreshWindow(definition.getSlaId());
                refreshed++;

            } catch (Exception e) {
                log.error("Failed to maintain rolling window for SLA {}", definition.getSlaId(), e);
                meterRegistry.counter("sla.window.maintenance.failures").increment();
            }
        }

        log.info("SLA window maintenance: {} definitions refreshed, {} samples pruned", refreshed, pruned);
    }
}
