package com.company.workflowsla.service;

import com.company.workflowsla.bus.EventBus;
import com.company.workflowsla.bus.InMemoryEventBackend;
import com.company.workflowsla.domain.SlaBreach;
import com.company.workflowsla.domain.SlaDefinition;
import com.company.workflowsla.domain.SlaExecutionSample;
import com.company.workflowsla.domain.SloMetrics;
import com.company.workflowsla.domain.enums.BreachSeverity;
import com.company.workflowsla.event.SlaBreachRecordedEvent;
import com.company.workflowsla.event.WorkflowEvents;
import com.company.workflowsla.exception.InvalidSlaDefinitionException;
import com.company.workflowsla.exception.SlaDefinitionNotFoundException;
import com.company.workflowsla.repository.SlaBreachRepository;
import com.company.workflowsla.repository.SlaDefinitionRepository;
import com.company.workflowsla.repository.SlaExecutionSampleRepository;
import com.company.workflowsla.repository.SlaExecutionSampleRepository.WindowCounts;
import com.company.workflowsla.util.MutableClock;
import com.company.workflowsla.util.SlaReportResult;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlaMonitorService")
class SlaMonitorServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private SlaDefinitionRepository definitionRepository;

    @Mock
    private SlaExecutionSampleRepository sampleRepository;

    @Mock
    private SlaBreachRepository breachRepository;

    private InMemoryEventBackend backend;
    private SimpleMeterRegistry meterRegistry;
    private SlaMonitorService slaMonitor;

    @BeforeEach
    void setUp() {
        backend = new InMemoryEventBackend();
        meterRegistry = new SimpleMeterRegistry();
        MutableClock clock = new MutableClock(NOW);
        EventBus eventBus = new EventBus(backend, meterRegistry);

        // No transaction here, so the recorded breach goes straight to the dispatcher
        BreachAlertDispatcher alertDispatcher = new BreachAlertDispatcher(
                breachRepository, eventBus, meterRegistry, clock);
        BreachRecorderService breachRecorder = new BreachRecorderService(
                breachRepository, definitionRepository, eventBus,
                event -> alertDispatcher.onBreachRecorded((SlaBreachRecordedEvent) event),
                meterRegistry, clock);
        ReflectionTestUtils.setField(breachRecorder, "defaultRecipients", List.of());

        slaMonitor = new SlaMonitorService(
                definitionRepository, sampleRepository, breachRepository, breachRecorder, meterRegistry, clock);
    }

    @Nested
    @DisplayName("reportExecution")
    class ReportExecution {

        @Test
        @DisplayName("Should record one warning breach and publish sla.breach once for 40s against 30/35/50s")
        void shouldRecordWarningBreach() {
            // Given
            when(definitionRepository.findByIdForUpdate("sla-1")).thenReturn(Optional.of(definition(true)));
            when(sampleRepository.countSince(eq("sla-1"), any())).thenReturn(new WindowCounts(1, 1));
            when(breachRepository.findBySlaAndExecution("sla-1", "exec-1")).thenReturn(Optional.empty());
            when(breachRepository.insertIfAbsent(any())).thenAnswer(invocation -> {
                SlaBreach breach = invocation.getArgument(0);
                breach.setBreachId(7L);
                return Optional.of(breach);
            });
            when(breachRepository.markAlertSent(7L, NOW)).thenReturn(1);

            // When
            SlaReportResult result = slaMonitor.reportExecution("sla-1", "exec-1", Duration.ofSeconds(40));

            // Then
            assertThat(result.isAccepted()).isTrue();
            assertThat(result.getSeverity()).isEqualTo(BreachSeverity.WARNING);
            assertThat(result.getBreachId()).isEqualTo(7L);
            assertThat(backend.getEvents(WorkflowEvents.SLA_BREACH)).hasSize(1);
            assertThat(backend.getEvents(WorkflowEvents.SLA_BREACH).get(0).getData())
                    .containsEntry("severity", "warning")
                    .containsEntry("breach_margin_ms", 10_000L);
            verify(definitionRepository).updateCounters("sla-1", 1, 1, new BigDecimal("0.00"), NOW);
        }

        @Test
        @DisplayName("Should record a sample without a breach when within the warning threshold")
        void shouldNotBreachWithinThreshold() {
            // Given
            when(definitionRepository.findByIdForUpdate("sla-1")).thenReturn(Optional.of(definition(true)));
            when(sampleRepository.countSince(eq("sla-1"), any())).thenReturn(new WindowCounts(1, 0));
            ArgumentCaptor<SlaExecutionSample> sample = ArgumentCaptor.forClass(SlaExecutionSample.class);

            // When
            SlaReportResult result = slaMonitor.reportExecution("sla-1", "exec-2", Duration.ofSeconds(34));

            // Then
            assertThat(result.isBreached()).isFalse();
            assertThat(result.getCurrentPercentage()).isEqualByComparingTo("100");
            verify(sampleRepository).upsert(sample.capture());
            assertThat(sample.getValue().getBreached()).isFalse();
            assertThat(sample.getValue().getActualDurationMs()).isEqualTo(34_000L);
            verifyNoInteractions(breachRepository);
            assertThat(backend.getEvents()).isEmpty();
        }

        @Test
        @DisplayName("Should recompute the percentage from the window counts")
        void shouldRecomputePercentage() {
            // Given
            when(definitionRepository.findByIdForUpdate("sla-1")).thenReturn(Optional.of(definition(true)));
            when(sampleRepository.countSince(eq("sla-1"), eq(NOW.minus(Duration.ofHours(24)))))
                    .thenReturn(new WindowCounts(100, 3));

            // When
            SlaReportResult result = slaMonitor.reportExecution("sla-1", "exec-3", Duration.ofSeconds(10));

            // Then
            assertThat(result.getTotalExecutions()).isEqualTo(100);
            assertThat(result.getBreachedExecutions()).isEqualTo(3);
            assertThat(result.getCurrentPercentage()).isEqualByComparingTo("97.0");
        }

        @Test
        @DisplayName("Should expose the SLA percentage and target gauges and time the reported duration")
        void shouldRecordSlaMetrics() {
            // Given
            when(definitionRepository.findByIdForUpdate("sla-1")).thenReturn(Optional.of(definition(true)));
            when(sampleRepository.countSince(eq("sla-1"), any())).thenReturn(new WindowCounts(100, 3));

            // When
            slaMonitor.reportExecution("sla-1", "exec-5", Duration.ofSeconds(12));

            // Then
            Gauge percentage = meterRegistry.find("workflow.sla.percentage").tag("sla", "sla-1").gauge();
            assertThat(percentage).isNotNull();
            assertThat(percentage.value()).isEqualTo(97.0);

            Gauge target = meterRegistry.find("workflow.sla.target.seconds").tag("sla", "sla-1").gauge();
            assertThat(target).isNotNull();
            assertThat(target.value()).isEqualTo(30.0);

            Timer duration = meterRegistry.find("workflow.execution.duration").tag("sla", "sla-1").timer();
            assertThat(duration).isNotNull();
            assertThat(duration.count()).isEqualTo(1L);
            assertThat(duration.totalTime(TimeUnit.SECONDS)).isEqualTo(12.0);
        }

        @Test
        @DisplayName("Should keep a single gauge per SLA across reports")
        void shouldReuseGaugeAcrossReports() {
            // Given
            when(definitionRepository.findByIdForUpdate("sla-1")).thenReturn(Optional.of(definition(true)));
            when(sampleRepository.countSince(eq("sla-1"), any()))
                    .thenReturn(new WindowCounts(1, 0), new WindowCounts(2, 1));
            when(breachRepository.findBySlaAndExecution("sla-1", "exec-7")).thenReturn(Optional.empty());
            when(breachRepository.insertIfAbsent(any())).thenAnswer(invocation -> {
                SlaBreach breach = invocation.getArgument(0);
                breach.setBreachId(8L);
                return Optional.of(breach);
            });
            when(breachRepository.markAlertSent(8L, NOW)).thenReturn(1);

            // When
            slaMonitor.reportExecution("sla-1", "exec-6", Duration.ofSeconds(5));
            slaMonitor.reportExecution("sla-1", "exec-7", Duration.ofSeconds(60));

            // Then
            assertThat(meterRegistry.find("workflow.sla.percentage").gauges()).hasSize(1);
            assertThat(meterRegistry.get("workflow.sla.percentage").tag("sla", "sla-1").gauge().value())
                    .isEqualTo(50.0);
            assertThat(meterRegistry.get("workflow.execution.duration").tag("sla", "sla-1").timer().count())
                    .isEqualTo(2L);
        }

        @Test
        @DisplayName("Should ignore reports for an inactive SLA")
        void shouldIgnoreInactiveSla() {
            // Given
            when(definitionRepository.findByIdForUpdate("sla-1")).thenReturn(Optional.of(definition(false)));

            // When
            SlaReportResult result = slaMonitor.reportExecution("sla-1", "exec-4", Duration.ofSeconds(60));

            // Then
            assertThat(result.isAccepted()).isFalse();
            verifyNoInteractions(sampleRepository, breachRepository);
            verify(definitionRepository, never()).updateCounters(any(), anyLong(), anyLong(), any(), any());
        }

        @Test
        @DisplayName("Should fail for an unknown SLA")
        void shouldFailForUnknownSla() {
            when(definitionRepository.findByIdForUpdate("nope")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> slaMonitor.reportExecution("nope", "exec-1", Duration.ofSeconds(1)))
                    .isInstanceOf(SlaDefinitionNotFoundException.class);
        }

        @Test
        @DisplayName("Should reject a negative duration")
        void shouldRejectNegativeDuration() {
            assertThatThrownBy(() -> slaMonitor.reportExecution("sla-1", "exec-1", Duration.ofSeconds(-1)))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(definitionRepository);
        }
    }

    @Test
    @DisplayName("Should reject thresholds that are not monotonically non-decreasing")
    void shouldRejectNonMonotonicThresholds() {
        // Given
        SlaDefinition invalid = definition(true);
        invalid.setWarningThresholdMs(60_000L);

        // When / Then
        assertThatThrownBy(() -> slaMonitor.defineSla(invalid))
                .isInstanceOf(InvalidSlaDefinitionException.class);
        verify(definitionRepository, never()).upsert(any());
    }

    @Test
    @DisplayName("Should fill defaults when defining an SLA")
    void shouldDefineWithDefaults() {
        // Given
        SlaDefinition definition = definition(true);
        definition.setWindowHours(null);
        definition.setTargetPercentage(null);
        when(definitionRepository.upsert(definition)).thenReturn(definition);

        // When
        SlaDefinition saved = slaMonitor.defineSla(definition);

        // Then
        assertThat(saved.getWindowHours()).isEqualTo(24);
        assertThat(saved.getTargetPercentage()).isEqualByComparingTo("99.00");
        assertThat(meterRegistry.get("workflow.sla.target.seconds").tag("sla", "sla-1").gauge().value())
                .isEqualTo(30.0);
    }

    @Test
    @DisplayName("Should compute SLO metrics for the requested window")
    void shouldCalculateSloMetrics() {
        // Given
        Instant windowStart = NOW.minus(Duration.ofHours(48));
        when(definitionRepository.findById("sla-1")).thenReturn(Optional.of(definition(true)));
        when(sampleRepository.countSince("sla-1", windowStart)).thenReturn(new WindowCounts(100, 3));
        when(breachRepository.countBySeveritySince("sla-1", windowStart))
                .thenReturn(Map.of(BreachSeverity.CRITICAL, 1L, BreachSeverity.WARNING, 2L));

        // When
        SloMetrics metrics = slaMonitor.calculateSloMetrics("sla-1", 48);

        // Then
        assertThat(metrics.getWindowStart()).isEqualTo(windowStart);
        assertThat(metrics.getSloPercentage()).isEqualByComparingTo("97.0");
        assertThat(metrics.getMeetsTarget()).isFalse();
        assertThat(metrics.getCriticalBreaches()).isEqualTo(1L);
        assertThat(metrics.getWarningBreaches()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Should reject activating an unknown SLA")
    void shouldFailToActivateUnknownSla() {
        // Given
        when(definitionRepository.setActive("missing", true, NOW)).thenReturn(0);

        // When / Then
        assertThatThrownBy(() -> slaMonitor.setActive("missing", true))
                .isInstanceOf(SlaDefinitionNotFoundException.class);
    }

    private SlaDefinition definition(boolean active) {
        return SlaDefinition.builder()
                .slaId("sla-1")
                .name("Lead enrichment")
                .targetDurationMs(30_000L)
                .warningThresholdMs(35_000L)
                .criticalThresholdMs(50_000L)
                .windowHours(24)
                .targetPercentage(new BigDecimal("99.00"))
                .alertRecipients(List.of("ops@example.com"))
                .active(active)
                .build();
    }
}
