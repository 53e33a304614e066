package com.company.workflowsla.repository;

import com.company.workflowsla.domain.Approval;
import com.company.workflowsla.domain.enums.ApprovalStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Approval persistence. Every status change is a conditional UPDATE; callers decide
 * from the returned row count whether the transition happened.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ApprovalRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnMapper jsonMapper;

    private static final String SELECT_BASE = """
        SELECT approval_id, workflow_run_id, action_run_id, action_type, status,
               approver_role, escalate_role, timeout_ms, escalation_timeout_ms,
               expires_at, escalated_at, resolved_at, actor_id, metadata::text AS metadata,
               created_at, updated_at
        FROM workflow_approvals
        """;

    public Approval insert(Approval approval) {
        String sql = """
            INSERT INTO workflow_approvals (
                approval_id, workflow_run_id, action_run_id, action_type, status,
                approver_role, escalate_role, timeout_ms, escalation_timeout_ms,
                expires_at, escalated_at, resolved_at, actor_id, metadata,
                created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?)
            """;

        jdbcTemplate.update(sql,
                approval.getApprovalId(),
                approval.getWorkflowRunId(),
                approval.getActionRunId(),
                approval.getActionType(),
                approval.getStatus().name(),
                approval.getApproverRole(),
                approval.getEscalateRole(),
                approval.getTimeoutMs(),
                approval.getEscalationTimeoutMs(),
                toTimestamp(approval.getExpiresAt()),
                toTimestamp(approval.getEscalatedAt()),
                toTimestamp(approval.getResolvedAt()),
                approval.getActorId(),
                jsonMapper.writeMap(approval.getMetadata()),
                toTimestamp(approval.getCreatedAt()),
                toTimestamp(approval.getUpdatedAt())
        );

        log.debug("Inserted approval {} for action run {}", approval.getApprovalId(), approval.getActionRunId());
        return approval;
    }

    public Optional<Approval> findById(String approvalId) {
        List<Approval> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE approval_id = ?", new ApprovalRowMapper(jsonMapper), approvalId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Approval> findByWorkflowRunId(String workflowRunId) {
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE workflow_run_id = ? ORDER BY created_at ASC",
                new ApprovalRowMapper(jsonMapper), workflowRunId);
    }

    /**
     * Approvals the given role may resolve right now: pending ones it approves, escalated
     * ones it was escalated to.
     */
    public List<Approval> findResolvableByRole(String role) {
        String sql = SELECT_BASE + """
            WHERE (status = 'PENDING' AND approver_role = ?)
               OR (status = 'ESCALATED' AND escalate_role = ?)
            ORDER BY expires_at ASC
            """;
        return jdbcTemplate.query(sql, new ApprovalRowMapper(jsonMapper), role, role);
    }

    /**
     * Oldest-deadline-first batch of approvals whose current deadline has passed.
     *
     * @param excludeIds approvals already attempted in this sweep
     */
    public List<Approval> findDue(Instant now, int limit, Collection<String> excludeIds) {
        StringBuilder sql = new StringBuilder(SELECT_BASE).append("""
            WHERE status IN ('PENDING', 'ESCALATED')
              AND expires_at <= ?
            """);

        List<Object> params = new ArrayList<>();
        params.add(toTimestamp(now));

        if (excludeIds != null && !excludeIds.isEmpty()) {
            String placeholders = String.join(",", Collections.nCopies(excludeIds.size(), "?"));
            sql.append(" AND approval_id NOT IN (").append(placeholders).append(")");
            params.addAll(excludeIds);
        }

        sql.append(" ORDER BY expires_at ASC LIMIT ?");
        params.add(limit);

        return jdbcTemplate.query(sql.toString(), new ApprovalRowMapper(jsonMapper), params.toArray());
    }

    /**
     * Human decision. Applies only while the approval is still in {@code expectedStatus}.
     */
    public int resolve(String approvalId, ApprovalStatus expectedStatus, ApprovalStatus newStatus,
                       String actorId, Map<String, Object> metadata, Instant resolvedAt) {
        return jdbcTemplate.update("""
            UPDATE workflow_approvals
            SET status = ?,
                actor_id = ?,
                resolved_at = ?,
                metadata = metadata || CAST(? AS jsonb),
                updated_at = ?
            WHERE approval_id = ?
              AND status = ?
            """,
                newStatus.name(),
                actorId,
                toTimestamp(resolvedAt),
                jsonMapper.writeMap(metadata),
                toTimestamp(resolvedAt),
                approvalId,
                expectedStatus.name());
    }

    /**
     * Forced PENDING to ESCALATED once the original deadline passed.
     */
    public int escalate(String approvalId, Instant now, Instant newExpiresAt, Map<String, Object> auditMetadata) {
        return jdbcTemplate.update("""
            UPDATE workflow_approvals
            SET status = 'ESCALATED',
                escalated_at = ?,
                expires_at = ?,
                metadata = metadata || CAST(? AS jsonb),
                updated_at = ?
            WHERE approval_id = ?
              AND status = 'PENDING'
              AND expires_at <= ?
              AND escalate_role IS NOT NULL
              AND escalate_role <> ''
            """,
                toTimestamp(now),
                toTimestamp(newExpiresAt),
                jsonMapper.writeMap(auditMetadata),
                toTimestamp(now),
                approvalId,
                toTimestamp(now));
    }

    /**
     * Forced transition to EXPIRED from {@code fromStatus} once its deadline passed.
     */
    public int expire(String approvalId, ApprovalStatus fromStatus, Instant now) {
        return jdbcTemplate.update("""
            UPDATE workflow_approvals
            SET status = 'EXPIRED',
                resolved_at = ?,
                updated_at = ?
            WHERE approval_id = ?
              AND status = ?
              AND expires_at <= ?
            """,
                toTimestamp(now),
                toTimestamp(now),
                approvalId,
                fromStatus.name(),
                toTimestamp(now));
    }

    /**
     * Merge keys into the metadata bag. Allowed in every state.
     */
    public int annotate(String approvalId, Map<String, Object> metadata, Instant now) {
        return jdbcTemplate.update("""
            UPDATE workflow_approvals
            SET metadata = metadata || CAST(? AS jsonb),
                updated_at = ?
            WHERE approval_id = ?
            """,
                jsonMapper.writeMap(metadata),
                toTimestamp(now),
                approvalId);
    }

    /**
     * Delete one batch of terminal approvals resolved before the cutoff. Pending and
     * escalated rows are never touched.
     */
    public int deleteResolvedBefore(Instant cutoff, int batchSize) {
        return jdbcTemplate.update("""
            DELETE FROM workflow_approvals
            WHERE approval_id IN (
                SELECT approval_id FROM workflow_approvals
                WHERE status IN ('APPROVED', 'DENIED', 'EXPIRED')
                  AND resolved_at < ?
                ORDER BY resolved_at ASC
                LIMIT ?
            )
            """, toTimestamp(cutoff), batchSize);
    }

    public long countByStatus(ApprovalStatus status) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM workflow_approvals WHERE status = ?", Long.class, status.name());
        return count != null ? count : 0L;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static class ApprovalRowMapper implements RowMapper<Approval> {

        private final JsonColumnMapper jsonMapper;

        ApprovalRowMapper(JsonColumnMapper jsonMapper) {
            this.jsonMapper = jsonMapper;
        }

        @Override
        public Approval mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Approval.builder()
                    .approvalId(rs.getString("approval_id"))
                    .workflowRunId(rs.getString("workflow_run_id"))
                    .actionRunId(rs.getString("action_run_id"))
                    .actionType(rs.getString("action_type"))
                    .status(ApprovalStatus.fromString(rs.getString("status")))
                    .approverRole(rs.getString("approver_role"))
                    .escalateRole(rs.getString("escalate_role"))
                    .timeoutMs(rs.getObject("timeout_ms", Long.class))
                    .escalationTimeoutMs(rs.getObject("escalation_timeout_ms", Long.class))
                    .expiresAt(getInstant(rs, "expires_at"))
                    .escalatedAt(getInstant(rs, "escalated_at"))
                    .resolvedAt(getInstant(rs, "resolved_at"))
                    .actorId(rs.getString("actor_id"))
                    .metadata(jsonMapper.readMap(rs.getString("metadata")))
                    .createdAt(getInstant(rs, "created_at"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .build();
        }

        private static Instant getInstant(ResultSet rs, String columnName) throws SQLException {
            Timestamp timestamp = rs.getTimestamp(columnName);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
