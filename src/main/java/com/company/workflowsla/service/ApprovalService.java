package com.company.workflowsla.service;

import com.company.workflowsla.bus.Event;
import com.company.workflowsla.bus.EventBus;
import com.company.workflowsla.domain.ActionMetadata;
import com.company.workflowsla.domain.Approval;
import com.company.workflowsla.domain.enums.ApprovalDecision;
import com.company.workflowsla.domain.enums.ApprovalStatus;
import com.company.workflowsla.dto.request.CreateApprovalRequest;
import com.company.workflowsla.event.WorkflowEvents;
import com.company.workflowsla.exception.ApprovalForbiddenException;
import com.company.workflowsla.exception.ApprovalNotFoundException;
import com.company.workflowsla.exception.InvalidTimeoutException;
import com.company.workflowsla.exception.InvalidTransitionException;
import com.company.workflowsla.repository.ApprovalRepository;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Approval registry: creation, human resolution and deadline-driven transitions.
 *
 * <p>All status changes go through conditional updates in {@link ApprovalRepository};
 * an event is published only when the update actually changed a row.
 */
@Service
@Validated
@Slf4j
@RequiredArgsConstructor
public class ApprovalService {

    // A lost race can only move the approval forward, so a few re-reads always settle it.
    private static final int MAX_RESOLVE_ATTEMPTS = 3;

    private final ApprovalRepository approvalRepository;
    private final ActionCatalog actionCatalog;
    private final EventBus eventBus;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${workflow.approval.escalation-timeout-multiplier:2}")
    private int escalationTimeoutMultiplier = 2;

    public Approval create(@Valid CreateApprovalRequest request) {
        Duration timeout = resolveTimeout(request);
        Duration escalationTimeout = resolveEscalationTimeout(request, timeout);
        Instant now = clock.instant();

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.getMetadata() != null) {
            metadata.putAll(request.getMetadata());
        }
        actionCatalog.find(request.getActionType()).ifPresent(action -> annotateAction(metadata, action));

        Approval approval = Approval.builder()
                .approvalId(UUID.randomUUID().toString())
                .workflowRunId(request.getWorkflowRunId())
                .actionRunId(request.getActionRunId())
                .actionType(request.getActionType())
                .status(ApprovalStatus.PENDING)
                .approverRole(request.getApproverRole())
                .escalateRole(blankToNull(request.getEscalateRole()))
                .timeoutMs(timeout.toMillis())
                .escalationTimeoutMs(escalationTimeout.toMillis())
                .expiresAt(now.plus(timeout))
                .metadata(metadata)
                .createdAt(now)
                .updatedAt(now)
                .build();

        approvalRepository.insert(approval);

        meterRegistry.counter("approvals.created", "approver_role", approval.getApproverRole()).increment();
        log.info("Created approval {} for action run {} (approver: {}, escalate: {}, expires: {})",
                approval.getApprovalId(), approval.getActionRunId(), approval.getApproverRole(),
                approval.getEscalateRole(), approval.getExpiresAt());

        publish(WorkflowEvents.approvalCreated(approval, now));
        return approval;
    }

    public Approval get(String approvalId) {
        return approvalRepository.findById(approvalId)
                .orElseThrow(() -> new ApprovalNotFoundException(approvalId));
    }

    public List<Approval> findByWorkflowRun(String workflowRunId) {
        return approvalRepository.findByWorkflowRunId(workflowRunId);
    }

    public List<Approval> findPendingForRole(String role) {
        return approvalRepository.findResolvableByRole(role);
    }

    /**
     * Apply a human decision.
     *
     * @param actingRole role the caller acts under; must match the role currently required
     * @throws ApprovalNotFoundException  unknown id
     * @throws InvalidTransitionException the approval is no longer pending or escalated
     * @throws ApprovalForbiddenException the acting role may not resolve it in its current state
     */
    public Approval resolve(String approvalId, ApprovalDecision decision, String actorId,
                            String actingRole, Map<String, Object> metadata) {
        ApprovalStatus target = decision.getResultingStatus();

        for (int attempt = 1; attempt <= MAX_RESOLVE_ATTEMPTS; attempt++) {
            Approval approval = get(approvalId);
            ApprovalStatus current = approval.getStatus();

            if (!current.canTransitionTo(target)) {
                log.info("Rejected {} on approval {}: already {}", decision.value(), approvalId, current.value());
                throw new InvalidTransitionException(approvalId, current, target);
            }

            String requiredRole = approval.requiredRole();
            if (requiredRole == null || !requiredRole.equals(actingRole)) {
                log.warn("Role {} attempted to resolve approval {} requiring {}", actingRole, approvalId, requiredRole);
                throw new ApprovalForbiddenException(approvalId, actingRole, requiredRole);
            }

            Instant now = clock.instant();
            int updated = approvalRepository.resolve(approvalId, current, target, actorId, metadata, now);
            if (updated == 1) {
                approval.setStatus(target);
                approval.setActorId(actorId);
                approval.setResolvedAt(now);
                approval.setUpdatedAt(now);
                if (metadata != null) {
                    approval.getMetadata().putAll(metadata);
                }

                meterRegistry.counter("approvals.resolved", "decision", decision.value()).increment();
                log.info("Approval {} {} by {} ({})", approvalId, target.value(), actorId, actingRole);

                publish(WorkflowEvents.approvalResolved(approval, decision, actorId, now));
                return approval;
            }

            log.debug("Approval {} changed state concurrently, re-reading (attempt {})", approvalId, attempt);
        }

        Approval latest = get(approvalId);
        throw new InvalidTransitionException(approvalId, latest.getStatus(), target);
    }

    /**
     * Merge keys into the metadata bag. Allowed in every state, terminal included.
     */
    public Approval annotate(String approvalId, Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return get(approvalId);
        }
        int updated = approvalRepository.annotate(approvalId, metadata, clock.instant());
        if (updated == 0) {
            throw new ApprovalNotFoundException(approvalId);
        }
        return get(approvalId);
    }

    /**
     * Force the deadline transition for one due approval: escalate a pending approval that
     * has an escalation role, otherwise expire it.
     *
     * @return the new status, or empty if the approval was not due or already moved on
     */
    public Optional<ApprovalStatus> applyDeadline(Approval approval) {
        Instant now = clock.instant();

        if (approval.getStatus() == ApprovalStatus.PENDING && approval.hasEscalationPath()) {
            return escalate(approval, now);
        }
        if (approval.getStatus().isResolvable()) {
            return expire(approval, now);
        }
        return Optional.empty();
    }

    private Optional<ApprovalStatus> escalate(Approval approval, Instant now) {
        Instant newExpiresAt = now.plusMillis(approval.getEscalationTimeoutMs());

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("escalated_at", now.toString());
        audit.put("escalation_reason", "timeout");
        audit.put("original_approver_role", approval.getApproverRole());
        audit.put("escalated_to_role", approval.getEscalateRole());

        int updated = approvalRepository.escalate(approval.getApprovalId(), now, newExpiresAt, audit);
        if (updated == 0) {
            log.debug("Approval {} no longer due for escalation", approval.getApprovalId());
            return Optional.empty();
        }

        approval.setStatus(ApprovalStatus.ESCALATED);
        approval.setEscalatedAt(now);
        approval.setExpiresAt(newExpiresAt);
        approval.setUpdatedAt(now);
        if (approval.getMetadata() != null) {
            approval.getMetadata().putAll(audit);
        }

        meterRegistry.counter("approvals.escalated").increment();
        log.warn("Escalated approval {} from {} to {}, new deadline {}",
                approval.getApprovalId(), approval.getApproverRole(), approval.getEscalateRole(), newExpiresAt);

        publish(WorkflowEvents.approvalEscalated(approval, now));
        return Optional.of(ApprovalStatus.ESCALATED);
    }

    private Optional<ApprovalStatus> expire(Approval approval, Instant now) {
        ApprovalStatus from = approval.getStatus();
        int updated = approvalRepository.expire(approval.getApprovalId(), from, now);
        if (updated == 0) {
            log.debug("Approval {} no longer due for expiry", approval.getApprovalId());
            return Optional.empty();
        }

        approval.setStatus(ApprovalStatus.EXPIRED);
        approval.setResolvedAt(now);
        approval.setUpdatedAt(now);

        meterRegistry.counter("approvals.expired", "from", from.value()).increment();
        log.warn("Expired approval {} (was {})", approval.getApprovalId(), from.value());

        publish(WorkflowEvents.approvalExpired(approval, now));
        return Optional.of(ApprovalStatus.EXPIRED);
    }

    private Duration resolveTimeout(CreateApprovalRequest request) {
        Duration timeout = request.getTimeout();
        if (timeout == null) {
            if (request.getActionType() == null) {
                throw new InvalidTimeoutException("timeout", null);
            }
            timeout = actionCatalog.defaultApprovalTimeout(request.getActionType());
        }
        // Stored with millisecond precision
        if (timeout.toMillis() < 1) {
            throw new InvalidTimeoutException("timeout", timeout, "at least 1ms");
        }
        return timeout;
    }

    private Duration resolveEscalationTimeout(CreateApprovalRequest request, Duration timeout) {
        Duration escalationTimeout = request.getEscalationTimeout();
        if (escalationTimeout == null) {
            return timeout.multipliedBy(Math.max(1, escalationTimeoutMultiplier));
        }
        if (escalationTimeout.toMillis() < 1) {
            throw new InvalidTimeoutException("escalation timeout", escalationTimeout, "at least 1ms");
        }
        if (escalationTimeout.compareTo(timeout) < 0) {
            throw new InvalidTimeoutException("escalation timeout", escalationTimeout,
                    "not shorter than the timeout " + timeout);
        }
        return escalationTimeout;
    }

    private void annotateAction(Map<String, Object> metadata, ActionMetadata action) {
        metadata.putIfAbsent("action_idempotent", action.isIdempotent());
        metadata.putIfAbsent("action_latency_class", action.getLatencyClass().name());
    }

    private void publish(Event event) {
        eventBus.publish(event, WorkflowEvents.topicsFor(event));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
