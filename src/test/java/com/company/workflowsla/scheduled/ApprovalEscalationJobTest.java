package com.company.workflowsla.scheduled;

import com.company.workflowsla.bus.EventBus;
import com.company.workflowsla.bus.InMemoryEventBackend;
import com.company.workflowsla.domain.Approval;
import com.company.workflowsla.domain.enums.ApprovalStatus;
import com.company.workflowsla.event.WorkflowEvents;
import com.company.workflowsla.repository.ApprovalRepository;
import com.company.workflowsla.service.ActionCatalog;
import com.company.workflowsla.service.ApprovalService;
import com.company.workflowsla.util.MutableClock;
import com.company.workflowsla.util.SweepResult;
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
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ApprovalEscalationJob")
class ApprovalEscalationJobTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T09:00:00Z");

    @Mock
    private ApprovalRepository approvalRepository;

    @Mock
    private ApprovalService approvalService;

    @Mock
    private ActionCatalog actionCatalog;

    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(CREATED.plus(Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("Should transition a due approval once when swept twice in quick succession")
    void shouldTransitionOnceAcrossOverlappingSweeps() {
        // Given
        InMemoryEventBackend backend = new InMemoryEventBackend();
        ApprovalService realService = new ApprovalService(
                approvalRepository, actionCatalog, new EventBus(backend, meterRegistry), meterRegistry, clock);
        ApprovalEscalationJob job = newJob(realService);

        // The second sweep reads the approval before the first one's update is visible
        when(approvalRepository.findDue(any(), anyInt(), any()))
                .thenReturn(List.of(due("a-1", "director")), List.of(),
                        List.of(due("a-1", "director")), List.of());
        when(approvalRepository.escalate(eq("a-1"), any(), any(), anyMap())).thenReturn(1, 0);

        // When
        SweepResult first = job.sweep();
        SweepResult second = job.sweep();

        // Then
        assertThat(first.getEscalated()).isEqualTo(1);
        assertThat(second.getEscalated()).isZero();
        assertThat(second.getSkipped()).isEqualTo(1);
        assertThat(backend.getEvents(WorkflowEvents.APPROVAL_ESCALATED)).hasSize(1);
    }

    @Test
    @DisplayName("Should keep sweeping after one approval fails")
    void shouldIsolateItemFailures() {
        // Given
        Approval failing = due("a-1", null);
        Approval healthy = due("a-2", null);
        when(approvalRepository.findDue(any(), anyInt(), any()))
                .thenReturn(List.of(failing, healthy), List.of());
        when(approvalService.applyDeadline(failing)).thenThrow(new IllegalStateException("db hiccup"));
        when(approvalService.applyDeadline(healthy)).thenReturn(Optional.of(ApprovalStatus.EXPIRED));

        // When
        SweepResult result = newJob(approvalService).sweep();

        // Then
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getExpired()).isEqualTo(1);
        assertThat(meterRegistry.counter("approvals.sweep.failures").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should defer remaining work once the budget is spent")
    void shouldStopWhenBudgetExhausted() {
        // Given
        ApprovalEscalationJob job = newJob(approvalService);
        ReflectionTestUtils.setField(job, "budgetMs", 0L);
        when(approvalRepository.findDue(any(), anyInt(), any())).thenReturn(List.of(due("a-1", "director")));

        // When
        SweepResult result = job.sweep();

        // Then
        assertThat(result.isBudgetExhausted()).isTrue();
        assertThat(result.getTransitioned()).isZero();
        verify(approvalService, never()).applyDeadline(any());
    }

    @Test
    @DisplayName("Should finish quietly when nothing is due")
    void shouldHandleEmptySweep() {
        // Given
        when(approvalRepository.findDue(any(), anyInt(), any())).thenReturn(List.of());

        // When
        SweepResult result = newJob(approvalService).sweep();

        // Then
        assertThat(result.getTransitioned()).isZero();
        assertThat(result.isBudgetExhausted()).isFalse();
    }

    private ApprovalEscalationJob newJob(ApprovalService service) {
        ApprovalEscalationJob job = new ApprovalEscalationJob(approvalRepository, service, meterRegistry, clock);
        ReflectionTestUtils.setField(job, "batchSize", 100);
        ReflectionTestUtils.setField(job, "budgetMs", 300000L);
        return job;
    }

    private Approval due(String approvalId, String escalateRole) {
        return Approval.builder()
                .approvalId(approvalId)
                .workflowRunId("run-1")
                .actionRunId("action-" + approvalId)
                .status(ApprovalStatus.PENDING)
                .approverRole("sales_manager")
                .escalateRole(escalateRole)
                .timeoutMs(Duration.ofMinutes(5).toMillis())
                .escalationTimeoutMs(Duration.ofMinutes(10).toMillis())
                .expiresAt(CREATED.plus(Duration.ofMinutes(5)))
                .metadata(new HashMap<>())
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .build();
    }
}
