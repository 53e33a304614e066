package com.company.workflowsla.service;

import com.company.workflowsla.domain.SlaDefinition;
import com.company.workflowsla.domain.SlaExecutionSample;
import com.company.workflowsla.domain.SloMetrics;
import com.company.workflowsla.domain.enums.BreachSeverity;
import com.company.workflowsla.exception.InvalidSlaDefinitionException;
import com.company.workflowsla.exception.SlaDefinitionNotFoundException;
import com.company.workflowsla.repository.SlaBreachRepository;
import com.company.workflowsla.repository.SlaDefinitionRepository;
import com.company.workflowsla.repository.SlaExecutionSampleRepository;
import com.company.workflowsla.repository.SlaExecutionSampleRepository.WindowCounts;
import com.company.workflowsla.util.BreachRecordResult;
import com.company.workflowsla.util.SlaReportResult;
import com.company.workflowsla.util.SloCalculator;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Measures reported workflow-run durations against SLA definitions.
 *
 * <p>Rolling counters are recomputed from the execution samples inside the trailing
 * window while holding the SLA row lock, so concurrent reports for one SLA are
 * serialized and reports for different SLAs proceed independently.
 *
 * <p>Per SLA it exposes the gauges {@code workflow.sla.percentage} and
 * {@code workflow.sla.target.seconds} and the timer {@code workflow.execution.duration}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaMonitorService {

    private static final BigDecimal DEFAULT_TARGET_PERCENTAGE = new BigDecimal("99.00");
    private static final int DEFAULT_WINDOW_HOURS = 24;

    private final SlaDefinitionRepository definitionRepository;
    private final SlaExecutionSampleRepository sampleRepository;
    private final SlaBreachRepository breachRepository;
    private final BreachRecorderService breachRecorder;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // Gauges hold weak references; the map keeps their state alive
    private final ConcurrentMap<String, SlaGaugeState> gaugeStates = new ConcurrentHashMap<>();

    public SlaDefinition defineSla(SlaDefinition definition) {
        validate(definition);
        if (definition.getWindowHours() == null) {
            definition.setWindowHours(DEFAULT_WINDOW_HOURS);
        }
        if (definition.getTargetPercentage() == null) {
            definition.setTargetPercentage(DEFAULT_TARGET_PERCENTAGE);
        }
        if (definition.getActive() == null) {
            definition.setActive(true);
        }
        definition.setUpdatedAt(clock.instant());

        SlaDefinition saved = definitionRepository.upsert(definition);
        updateGauges(saved);
        log.info("Defined SLA {} ({}): target={}ms warning={}ms critical={}ms window={}h goal={}%",
                saved.getSlaId(), saved.getName(), saved.getTargetDurationMs(), saved.getWarningThresholdMs(),
                saved.getCriticalThresholdMs(), saved.getWindowHours(), saved.getTargetPercentage());
        return saved;
    }

    public SlaDefinition getSla(String slaId) {
        return definitionRepository.findById(slaId)
                .orElseThrow(() -> new SlaDefinitionNotFoundException(slaId));
    }

    public void setActive(String slaId, boolean active) {
        if (definitionRepository.setActive(slaId, active, clock.instant()) == 0) {
            throw new SlaDefinitionNotFoundException(slaId);
        }
        log.info("SLA {} {}", slaId, active ? "activated" : "deactivated");
    }

    /**
     * Record one completed workflow run. Reports for inactive SLAs are ignored.
     * Reporting the same execution again does not count it twice.
     */
    @Transactional
    public SlaReportResult reportExecution(String slaId, String executionId, Duration actualDuration) {
        if (actualDuration == null || actualDuration.isNegative()) {
            throw new IllegalArgumentException("Actual duration must be zero or positive: " + actualDuration);
        }

        SlaDefinition definition = definitionRepository.findByIdForUpdate(slaId)
                .orElseThrow(() -> new SlaDefinitionNotFoundException(slaId));

        if (!definition.isActive()) {
            log.info("Ignoring execution {} reported for inactive SLA {}", executionId, slaId);
            return SlaReportResult.ignored(slaId, executionId);
        }

        long actualMs = actualDuration.toMillis();
        Optional<BreachSeverity> severity = BreachSeverity.classify(
                actualMs, definition.getWarningThresholdMs(), definition.getCriticalThresholdMs());
        Instant now = clock.instant();

        sampleRepository.upsert(SlaExecutionSample.builder()
                .slaId(slaId)
                .executionId(executionId)
                .actualDurationMs(actualMs)
                .breached(severity.isPresent())
                .reportedAt(now)
                .build());

        WindowCounts counts = recomputeCounters(definition, now);

        Timer.builder("workflow.execution.duration")
                .description("Reported workflow run durations")
                .tag("sla", slaId)
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(actualDuration);

        meterRegistry.counter("sla.executions.reported",
                "sla", slaId,
                "breached", String.valueOf(severity.isPresent())
        ).increment();

        SlaReportResult.SlaReportResultBuilder result = SlaReportResult.builder()
                .slaId(slaId)
                .executionId(executionId)
                .accepted(true)
                .totalExecutions(counts.getTotal())
                .breachedExecutions(counts.getBreached())
                .currentPercentage(definition.getCurrentPercentage());

        if (severity.isPresent()) {
            BreachRecordResult breach = breachRecorder.recordOrUpdate(
                    definition, executionId, severity.get(), actualMs, definition.getTargetDurationMs());
            result.severity(breach.getBreach().getSeverity())
                    .breachId(breach.getBreach().getBreachId());
        } else {
            log.debug("Execution {} met SLA {} ({}ms)", executionId, slaId, actualMs);
        }

        return result.build();
    }

    /**
     * Recompute the rolling counters from the samples still inside the window.
     */
    @Transactional
    public SlaDefinition refreshWindow(String slaId) {
        SlaDefinition definition = definitionRepository.findByIdForUpdate(slaId)
                .orElseThrow(() -> new SlaDefinitionNotFoundException(slaId));
        recomputeCounters(definition, clock.instant());
        return definition;
    }

    /**
     * SLO figures for a trailing window, defaulting to the SLA's own window.
     */
    public SloMetrics calculateSloMetrics(String slaId, Integer windowHours) {
        SlaDefinition definition = getSla(slaId);
        int hours = windowHours != null && windowHours > 0 ? windowHours : definition.getWindowHours();
        Instant windowStart = clock.instant().minus(Duration.ofHours(hours));

        WindowCounts counts = sampleRepository.countSince(slaId, windowStart);
        Map<BreachSeverity, Long> bySeverity = breachRepository.countBySeveritySince(slaId, windowStart);
        BigDecimal percentage = SloCalculator.percentage(counts.getTotal(), counts.getBreached());

        return SloMetrics.builder()
                .slaId(slaId)
                .windowHours(hours)
                .windowStart(windowStart)
                .totalExecutions(counts.getTotal())
                .breachedExecutions(counts.getBreached())
                .sloPercentage(percentage)
                .targetPercentage(definition.getTargetPercentage())
                .meetsTarget(SloCalculator.meetsTarget(percentage, definition.getTargetPercentage()))
                .criticalBreaches(bySeverity.getOrDefault(BreachSeverity.CRITICAL, 0L))
                .warningBreaches(bySeverity.getOrDefault(BreachSeverity.WARNING, 0L))
                .build();
    }

    private WindowCounts recomputeCounters(SlaDefinition definition, Instant now) {
        Instant windowStart = now.minus(Duration.ofHours(definition.getWindowHours()));
        WindowCounts counts = sampleRepository.countSince(definition.getSlaId(), windowStart);
        BigDecimal percentage = SloCalculator.percentage(counts.getTotal(), counts.getBreached());

        definitionRepository.updateCounters(
                definition.getSlaId(), counts.getTotal(), counts.getBreached(), percentage, now);

        definition.setTotalExecutions(counts.getTotal());
        definition.setBreachedExecutions(counts.getBreached());
        definition.setCurrentPercentage(percentage);
        definition.setCountersRefreshedAt(now);
        updateGauges(definition);

        if (definition.getTargetPercentage() != null
                && !SloCalculator.meetsTarget(percentage, definition.getTargetPercentage())) {
            log.warn("SLA {} below target: {}% < {}% ({} of {} executions breached)",
                    definition.getSlaId(), percentage, definition.getTargetPercentage(),
                    counts.getBreached(), counts.getTotal());
        }
        return counts;
    }

    private void updateGauges(SlaDefinition definition) {
        SlaGaugeState state = gaugeStates.computeIfAbsent(definition.getSlaId(), this::registerGauges);
        if (definition.getCurrentPercentage() != null) {
            state.percentage = definition.getCurrentPercentage().doubleValue();
        }
        if (definition.getTargetDurationMs() != null) {
            state.targetSeconds = definition.getTargetDurationMs() / 1000.0;
        }
    }

    private SlaGaugeState registerGauges(String slaId) {
        SlaGaugeState state = new SlaGaugeState();
        Gauge.builder("workflow.sla.percentage", state, s -> s.percentage)
                .description("Share of executions within the SLA over its rolling window")
                .tag("sla", slaId)
                .register(meterRegistry);
        Gauge.builder("workflow.sla.target.seconds", state, s -> s.targetSeconds)
                .description("SLA target duration")
                .tag("sla", slaId)
                .register(meterRegistry);
        return state;
    }

    private void validate(SlaDefinition definition) {
        String slaId = definition.getSlaId();
        if (slaId == null || slaId.isBlank()) {
            throw new InvalidSlaDefinitionException(slaId, "id is required");
        }
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new InvalidSlaDefinitionException(slaId, "name is required");
        }
        if (definition.getTargetDurationMs() == null || definition.getTargetDurationMs() <= 0) {
            throw new InvalidSlaDefinitionException(slaId, "target duration must be positive");
        }
        if (!definition.hasMonotonicThresholds()) {
            throw new InvalidSlaDefinitionException(slaId, "thresholds must satisfy target <= warning <= critical");
        }
        if (definition.getWindowHours() != null && definition.getWindowHours() <= 0) {
            throw new InvalidSlaDefinitionException(slaId, "window must be at least one hour");
        }
        BigDecimal target = definition.getTargetPercentage();
        if (target != null && (target.signum() < 0 || target.compareTo(BigDecimal.valueOf(100)) > 0)) {
            throw new InvalidSlaDefinitionException(slaId, "target percentage must be between 0 and 100");
        }
    }

    private static class SlaGaugeState {
        private volatile double percentage = 100.0;
        private volatile double targetSeconds = Double.NaN;
    }
}
