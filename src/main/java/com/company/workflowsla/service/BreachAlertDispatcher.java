package com.company.workflowsla.service;

import com.company.workflowsla.bus.Event;
import com.company.workflowsla.bus.EventBus;
import com.company.workflowsla.domain.SlaBreach;
import com.company.workflowsla.domain.SlaDefinition;
import com.company.workflowsla.event.SlaBreachRecordedEvent;
import com.company.workflowsla.event.WorkflowEvents;
import com.company.workflowsla.repository.SlaBreachRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Publishes {@code sla.breach} alerts on the bus and records successful delivery.
 *
 * <p>New breaches are alerted after the transaction that inserted them commits, so a
 * rolled-back report never produces an alert. Breaches whose alert could not be
 * delivered keep {@code alert_sent = false} and are picked up by
 * {@link com.company.workflowsla.scheduled.BreachAlertRedeliveryJob}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BreachAlertDispatcher {

    private final SlaBreachRepository breachRepository;
    private final EventBus eventBus;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${workflow.sla.alerts.enabled:true}")
    private boolean alertsEnabled = true;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onBreachRecorded(SlaBreachRecordedEvent event) {
        try {
            deliver(event.getBreach(), event.getDefinition());
        } catch (RuntimeException e) {
            // The report is already committed; redelivery retries while alert_sent is false
            log.error("Alert for SLA breach {} failed after commit, left for redelivery",
                    event.getBreach().getBreachId(), e);
            meterRegistry.counter("sla.alerts.failed", "sla", event.getBreach().getSlaId()).increment();
        }
    }

    /**
     * Publish the breach alert and mark it sent if the bus backend accepted it.
     *
     * @return {@code true} if the alert was delivered
     */
    public boolean deliver(SlaBreach breach, SlaDefinition definition) {
        if (!alertsEnabled) {
            log.debug("SLA alerts disabled, not publishing breach {}", breach.getBreachId());
            return false;
        }

        List<String> recipients = breach.getAlertRecipients() != null ? breach.getAlertRecipients() : List.of();
        Event event = WorkflowEvents.slaBreach(breach, definition, recipients, clock.instant());

        if (!eventBus.publish(event, WorkflowEvents.topicsFor(event))) {
            log.error("Alert for SLA breach {} could not be delivered", breach.getBreachId());
            meterRegistry.counter("sla.alerts.failed", "sla", breach.getSlaId()).increment();
            return false;
        }

        Instant sentAt = clock.instant();
        if (breachRepository.markAlertSent(breach.getBreachId(), sentAt) == 0) {
            log.warn("SLA breach {} was already marked as alerted", breach.getBreachId());
        }
        breach.setAlertSent(true);
        breach.setAlertSentAt(sentAt);

        meterRegistry.counter("sla.alerts.sent",
                "sla", breach.getSlaId(),
                "severity", breach.getSeverity().value()
        ).increment();
        return true;
    }
}
