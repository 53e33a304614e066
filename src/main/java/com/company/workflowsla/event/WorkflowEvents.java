package com.company.workflowsla.event;

import com.company.workflowsla.bus.Event;
import com.company.workflowsla.domain.Approval;
import com.company.workflowsla.domain.SlaBreach;
import com.company.workflowsla.domain.SlaDefinition;
import com.company.workflowsla.domain.enums.ApprovalDecision;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event types published by the engine and the factories that build their payloads.
 * Every event is published on the topic named after its type and stamped with the
 * engine clock's time of the change it announces.
 */
public final class WorkflowEvents {

    public static final String APPROVAL_CREATED = "approval.created";
    public static final String APPROVAL_RESOLVED = "approval.resolved";
    public static final String APPROVAL_ESCALATED = "approval.escalated";
    public static final String APPROVAL_EXPIRED = "approval.expired";
    public static final String SLA_BREACH = "sla.breach";
    public static final String SLA_BREACH_ACKNOWLEDGED = "sla.breach.acknowledged";

    private static final String SOURCE = "workflow-sla-service";

    private WorkflowEvents() {
    }

    public static Event approvalCreated(Approval approval, Instant occurredAt) {
        Map<String, Object> data = approvalData(approval);
        data.put("approver_role", approval.getApproverRole());
        data.put("escalate_role", approval.getEscalateRole());
        data.put("expires_at", String.valueOf(approval.getExpiresAt()));
        data.put("timeout_ms", approval.getTimeoutMs());
        return event(APPROVAL_CREATED, data, occurredAt);
    }

    public static Event approvalResolved(Approval approval, ApprovalDecision decision, String actorId,
                                         Instant occurredAt) {
        Map<String, Object> data = approvalData(approval);
        data.put("decision", decision.value());
        data.put("actor_id", actorId);
        data.put("resolved_at", String.valueOf(approval.getResolvedAt()));
        return event(APPROVAL_RESOLVED, data, occurredAt);
    }

    public static Event approvalEscalated(Approval approval, Instant occurredAt) {
        Map<String, Object> data = approvalData(approval);
        data.put("original_approver_role", approval.getApproverRole());
        data.put("escalated_to_role", approval.getEscalateRole());
        data.put("escalated_at", String.valueOf(approval.getEscalatedAt()));
        data.put("expires_at", String.valueOf(approval.getExpiresAt()));
        return event(APPROVAL_ESCALATED, data, occurredAt);
    }

    public static Event approvalExpired(Approval approval, Instant occurredAt) {
        Map<String, Object> data = approvalData(approval);
        data.put("expired_at", String.valueOf(approval.getResolvedAt()));
        return event(APPROVAL_EXPIRED, data, occurredAt);
    }

    public static Event slaBreach(SlaBreach breach, SlaDefinition definition, List<String> recipients,
                                  Instant occurredAt) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("breach_id", breach.getBreachId());
        data.put("sla_id", breach.getSlaId());
        data.put("sla_name", definition.getName());
        data.put("execution_id", breach.getExecutionId());
        data.put("severity", breach.getSeverity().value());
        data.put("actual_duration_ms", breach.getActualDurationMs());
        data.put("target_duration_ms", breach.getTargetDurationMs());
        data.put("breach_margin_ms", breach.getBreachMarginMs());
        data.put("recipients", List.copyOf(recipients));
        return event(SLA_BREACH, data, occurredAt);
    }

    public static Event slaBreachAcknowledged(SlaBreach breach, String actorId, String notes,
                                              Instant occurredAt) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("breach_id", breach.getBreachId());
        data.put("sla_id", breach.getSlaId());
        data.put("execution_id", breach.getExecutionId());
        data.put("acknowledged_by", actorId);
        data.put("resolution_notes", notes);
        return event(SLA_BREACH_ACKNOWLEDGED, data, occurredAt);
    }

    public static List<String> topicsFor(Event event) {
        return List.of(event.getType());
    }

    private static Map<String, Object> approvalData(Approval approval) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("approval_id", approval.getApprovalId());
        data.put("workflow_run_id", approval.getWorkflowRunId());
        data.put("action_run_id", approval.getActionRunId());
        data.put("status", approval.getStatus().value());
        return data;
    }

    private static Event event(String type, Map<String, Object> data, Instant occurredAt) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", SOURCE);
        metadata.put(Event.TIMESTAMP_KEY, occurredAt.toString());
        return new Event(type, data, metadata);
    }
}
