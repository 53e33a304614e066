package com.company.workflowsla.config;

import com.company.workflowsla.domain.enums.ApprovalStatus;
import com.company.workflowsla.repository.ApprovalRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final ApprovalRepository approvalRepository;

    @Bean
    public MeterBinder approvalMetrics() {
        return (registry) -> {
            registerStatusGauge(registry, ApprovalStatus.PENDING, "approvals.pending",
                    "Approvals awaiting the approver role");
            registerStatusGauge(registry, ApprovalStatus.ESCALATED, "approvals.escalated.open",
                    "Escalated approvals awaiting the escalation role");

            log.info("Approval metrics registered");
        };
    }

    private void registerStatusGauge(MeterRegistry registry, ApprovalStatus status, String name, String description) {
        Gauge.builder(name, approvalRepository, repo -> {
                    try {
                        return repo.countByStatus(status);
                    } catch (Exception e) {
                        log.warn("Failed to count {} approvals", status.value(), e);
                        return 0;
                    }
                })
                .description(description)
                .register(registry);
    }
}
