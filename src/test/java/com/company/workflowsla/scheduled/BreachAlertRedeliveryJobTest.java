package com.company.workflowsla.scheduled;

import com.company.workflowsla.domain.SlaBreach;
import com.company.workflowsla.domain.SlaDefinition;
import com.company.workflowsla.domain.enums.BreachSeverity;
import com.company.workflowsla.repository.SlaBreachRepository;
import com.company.workflowsla.repository.SlaDefinitionRepository;
import com.company.workflowsla.service.BreachAlertDispatcher;
import com.company.workflowsla.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BreachAlertRedeliveryJob")
class BreachAlertRedeliveryJobTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Instant CUTOFF = NOW.minus(Duration.ofMinutes(5));

    @Mock
    private SlaBreachRepository breachRepository;

    @Mock
    private SlaDefinitionRepository definitionRepository;

    @Mock
    private BreachAlertDispatcher alertDispatcher;

    private SimpleMeterRegistry meterRegistry;
    private BreachAlertRedeliveryJob job;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        job = new BreachAlertRedeliveryJob(
                breachRepository, definitionRepository, alertDispatcher, meterRegistry, new MutableClock(NOW));
        ReflectionTestUtils.setField(job, "batchSize", 50);
        ReflectionTestUtils.setField(job, "gracePeriodMs", Duration.ofMinutes(5).toMillis());
    }

    @Test
    @DisplayName("Should do nothing when every breach has been alerted")
    void shouldSkipWhenNothingPending() {
        // Given
        when(breachRepository.findUnalerted(CUTOFF, 50)).thenReturn(List.of());

        // When
        int delivered = job.redeliverPendingAlerts();

        // Then
        assertThat(delivered).isZero();
        verifyNoInteractions(alertDispatcher, definitionRepository);
    }

    @Test
    @DisplayName("Should redeliver pending alerts older than the grace period, loading each SLA once")
    void shouldRedeliverPendingAlerts() {
        // Given
        SlaDefinition definition = sla("sla-1");
        SlaBreach first = breach(1L, "sla-1");
        SlaBreach second = breach(2L, "sla-1");
        when(breachRepository.findUnalerted(CUTOFF, 50)).thenReturn(List.of(first, second));
        when(definitionRepository.findById("sla-1")).thenReturn(Optional.of(definition));
        when(alertDispatcher.deliver(first, definition)).thenReturn(true);
        when(alertDispatcher.deliver(second, definition)).thenReturn(true);

        // When
        int delivered = job.redeliverPendingAlerts();

        // Then
        assertThat(delivered).isEqualTo(2);
        verify(definitionRepository, times(1)).findById("sla-1");
        assertThat(meterRegistry.counter("sla.alerts.redelivered").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should keep going when one alert fails and leave it for the next run")
    void shouldIsolateFailures() {
        // Given
        SlaDefinition definition = sla("sla-1");
        SlaBreach failing = breach(1L, "sla-1");
        SlaBreach undelivered = breach(2L, "sla-1");
        SlaBreach ok = breach(3L, "sla-1");
        when(breachRepository.findUnalerted(CUTOFF, 50)).thenReturn(List.of(failing, undelivered, ok));
        when(definitionRepository.findById("sla-1")).thenReturn(Optional.of(definition));
        when(alertDispatcher.deliver(failing, definition)).thenThrow(new IllegalStateException("db hiccup"));
        when(alertDispatcher.deliver(undelivered, definition)).thenReturn(false);
        when(alertDispatcher.deliver(ok, definition)).thenReturn(true);

        // When
        int delivered = job.redeliverPendingAlerts();

        // Then
        assertThat(delivered).isEqualTo(1);
        verify(alertDispatcher).deliver(ok, definition);
    }

    @Test
    @DisplayName("Should skip breaches whose SLA no longer exists")
    void shouldSkipMissingDefinition() {
        // Given
        SlaBreach orphan = breach(4L, "gone");
        when(breachRepository.findUnalerted(CUTOFF, 50)).thenReturn(List.of(orphan));
        when(definitionRepository.findById("gone")).thenReturn(Optional.empty());

        // When
        int delivered = job.redeliverPendingAlerts();

        // Then
        assertThat(delivered).isZero();
        verify(alertDispatcher, never()).deliver(any(), any());
    }

    private SlaDefinition sla(String slaId) {
        return SlaDefinition.builder()
                .slaId(slaId)
                .name(slaId)
                .targetDurationMs(30_000L)
                .warningThresholdMs(35_000L)
                .criticalThresholdMs(50_000L)
                .active(true)
                .build();
    }

    private SlaBreach breach(Long breachId, String slaId) {
        return SlaBreach.builder()
                .breachId(breachId)
                .slaId(slaId)
                .executionId("exec-" + breachId)
                .severity(BreachSeverity.WARNING)
                .actualDurationMs(40_000L)
                .targetDurationMs(30_000L)
                .breachMarginMs(10_000L)
                .alertSent(false)
                .alertRecipients(List.of("ops@example.com"))
                .acknowledged(false)
                .detectedAt(NOW.minus(Duration.ofHours(1)))
                .updatedAt(NOW.minus(Duration.ofHours(1)))
                .build();
    }
}
