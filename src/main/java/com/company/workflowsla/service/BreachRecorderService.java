package com.company.workflowsla.service;

import com.company.workflowsla.bus.Event;
import com.company.workflowsla.bus.EventBus;
import com.company.workflowsla.domain.SlaBreach;
import com.company.workflowsla.domain.SlaDefinition;
import com.company.workflowsla.domain.enums.BreachSeverity;
import com.company.workflowsla.event.SlaBreachRecordedEvent;
import com.company.workflowsla.event.WorkflowEvents;
import com.company.workflowsla.exception.AlreadyAcknowledgedException;
import com.company.workflowsla.exception.BreachNotFoundException;
import com.company.workflowsla.exception.SlaDefinitionNotFoundException;
import com.company.workflowsla.repository.SlaBreachRepository;
import com.company.workflowsla.repository.SlaDefinitionRepository;
import com.company.workflowsla.util.BreachRecordResult;
import com.company.workflowsla.util.SloCalculator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persists one breach per (SLA, execution) and queues the alert for new breaches.
 *
 * <p>Repeated reports for the same execution update the existing record; severity only
 * ever escalates. The {@code sla.breach} alert is queued once, when the record is created,
 * and {@link BreachAlertDispatcher} publishes it after the surrounding transaction commits.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BreachRecorderService {

    private final SlaBreachRepository breachRepository;
    private final SlaDefinitionRepository definitionRepository;
    private final EventBus eventBus;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${workflow.sla.alerts.default-recipients:}")
    private List<String> defaultRecipients = new ArrayList<>();

    public BreachRecordResult recordOrUpdate(String slaId, String executionId, BreachSeverity severity,
                                             long actualDurationMs, long targetDurationMs) {
        SlaDefinition definition = definitionRepository.findById(slaId)
                .orElseThrow(() -> new SlaDefinitionNotFoundException(slaId));
        return recordOrUpdate(definition, executionId, severity, actualDurationMs, targetDurationMs);
    }

    public BreachRecordResult recordOrUpdate(SlaDefinition definition, String executionId,
                                             BreachSeverity severity, long actualDurationMs,
                                             long targetDurationMs) {
        Optional<SlaBreach> existing = breachRepository.findBySlaAndExecution(definition.getSlaId(), executionId);
        if (existing.isPresent()) {
            return update(existing.get(), severity, actualDurationMs, targetDurationMs);
        }

        Instant now = clock.instant();
        List<String> recipients = resolveRecipients(definition);

        SlaBreach candidate = SlaBreach.builder()
                .slaId(definition.getSlaId())
                .executionId(executionId)
                .severity(severity)
                .actualDurationMs(actualDurationMs)
                .targetDurationMs(targetDurationMs)
                .breachMarginMs(SloCalculator.breachMargin(actualDurationMs, targetDurationMs))
                .alertSent(false)
                .alertRecipients(recipients)
                .acknowledged(false)
                .detectedAt(now)
                .updatedAt(now)
                .build();

        Optional<SlaBreach> inserted = breachRepository.insertIfAbsent(candidate);
        if (inserted.isEmpty()) {
            // Another report for this execution won the insert
            log.debug("Breach for SLA {} execution {} already recorded, updating instead",
                    definition.getSlaId(), executionId);
            SlaBreach winner = breachRepository.findBySlaAndExecution(definition.getSlaId(), executionId)
                    .orElseThrow(() -> new IllegalStateException(
                            "Breach for " + definition.getSlaId() + "/" + executionId + " vanished after conflict"));
            return update(winner, severity, actualDurationMs, targetDurationMs);
        }

        SlaBreach breach = inserted.get();
        meterRegistry.counter("sla.breaches.created",
                "sla", breach.getSlaId(),
                "severity", breach.getSeverity().value()
        ).increment();

        log.warn("SLA breach {} recorded: sla={} execution={} severity={} actual={}ms target={}ms margin={}ms",
                breach.getBreachId(), breach.getSlaId(), executionId, severity.value(),
                actualDurationMs, targetDurationMs, breach.getBreachMarginMs());

        applicationEventPublisher.publishEvent(new SlaBreachRecordedEvent(breach, definition));
        return new BreachRecordResult(breach, true, true);
    }

    /**
     * @throws BreachNotFoundException     unknown breach id
     * @throws AlreadyAcknowledgedException the breach was acknowledged before; safe to treat as success
     */
    public SlaBreach acknowledge(Long breachId, String actorId, String notes) {
        SlaBreach breach = breachRepository.findById(breachId)
                .orElseThrow(() -> new BreachNotFoundException(breachId));

        if (Boolean.TRUE.equals(breach.getAcknowledged())) {
            throw new AlreadyAcknowledgedException(breachId);
        }

        Instant now = clock.instant();
        if (breachRepository.acknowledge(breachId, actorId, notes, now) == 0) {
            throw new AlreadyAcknowledgedException(breachId);
        }

        breach.setAcknowledged(true);
        breach.setAcknowledgedAt(now);
        breach.setAcknowledgedBy(actorId);
        breach.setResolutionNotes(notes);
        breach.setUpdatedAt(now);

        log.info("SLA breach {} acknowledged by {}", breachId, actorId);
        Event event = WorkflowEvents.slaBreachAcknowledged(breach, actorId, notes, now);
        eventBus.publish(event, WorkflowEvents.topicsFor(event));
        return breach;
    }

    private BreachRecordResult update(SlaBreach existing, BreachSeverity severity,
                                      long actualDurationMs, long targetDurationMs) {
        if (existing.getSeverity().isHigherThan(severity)) {
            log.debug("Ignoring {} report for breach {}: already {}",
                    severity.value(), existing.getBreachId(), existing.getSeverity().value());
            return new BreachRecordResult(existing, false, false);
        }

        Instant now = clock.instant();
        long margin = SloCalculator.breachMargin(actualDurationMs, targetDurationMs);
        int updated = breachRepository.updateEscalating(
                existing.getBreachId(), severity, actualDurationMs, targetDurationMs, margin, now);

        if (updated == 1) {
            if (severity.isHigherThan(existing.getSeverity())) {
                log.warn("SLA breach {} escalated from {} to {}",
                        existing.getBreachId(), existing.getSeverity().value(), severity.value());
            }
            existing.setSeverity(severity);
            existing.setActualDurationMs(actualDurationMs);
            existing.setTargetDurationMs(targetDurationMs);
            existing.setBreachMarginMs(margin);
            existing.setUpdatedAt(now);

            meterRegistry.counter("sla.breaches.updated",
                    "sla", existing.getSlaId(),
                    "severity", severity.value()
            ).increment();
        }

        return new BreachRecordResult(existing, false, false);
    }

    /**
     * Per-SLA recipients followed by the configured defaults, without duplicates.
     */
    List<String> resolveRecipients(SlaDefinition definition) {
        Set<String> recipients = new LinkedHashSet<>();
        if (definition.getAlertRecipients() != null) {
            definition.getAlertRecipients().stream()
                    .filter(r -> r != null && !r.isBlank())
                    .map(String::trim)
                    .forEach(recipients::add);
        }
        if (defaultRecipients != null) {
            defaultRecipients.stream()
                    .filter(r -> r != null && !r.isBlank())
                    .map(String::trim)
                    .forEach(recipients::add);
        }
        return new ArrayList<>(recipients);
    }
}
