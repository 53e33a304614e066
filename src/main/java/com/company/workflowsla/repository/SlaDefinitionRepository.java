package com.company.workflowsla.repository;

import com.company.workflowsla.domain.SlaDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class SlaDefinitionRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnMapper jsonMapper;

    private static final String SELECT_BASE = """
        SELECT sla_id, name, workflow_id, target_duration_ms, warning_threshold_ms,
               critical_threshold_ms, window_hours, target_percentage,
               total_executions, breached_executions, current_percentage,
               alert_recipients::text AS alert_recipients, active, counters_refreshed_at,
               created_at, updated_at
        FROM sla_definitions
        """;

    /**
     * Insert or update the contract fields. Rolling counters are owned by the monitor
     * and never overwritten here.
     */
    public SlaDefinition upsert(SlaDefinition definition) {
        Instant now = definition.getUpdatedAt() != null ? definition.getUpdatedAt() : Instant.now();
        Instant createdAt = definition.getCreatedAt() != null ? definition.getCreatedAt() : now;

        String sql = """
            INSERT INTO sla_definitions (
                sla_id, name, workflow_id, target_duration_ms, warning_threshold_ms,
                critical_threshold_ms, window_hours, target_percentage,
                alert_recipients, active, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?, ?)
            ON CONFLICT (sla_id) DO UPDATE SET
                name = EXCLUDED.name,
                workflow_id = EXCLUDED.workflow_id,
                target_duration_ms = EXCLUDED.target_duration_ms,
                warning_threshold_ms = EXCLUDED.warning_threshold_ms,
                critical_threshold_ms = EXCLUDED.critical_threshold_ms,
                window_hours = EXCLUDED.window_hours,
                target_percentage = EXCLUDED.target_percentage,
                alert_recipients = EXCLUDED.alert_recipients,
                active = EXCLUDED.active,
                updated_at = EXCLUDED.updated_at
            RETURNING sla_id, name, workflow_id, target_duration_ms, warning_threshold_ms,
                      critical_threshold_ms, window_hours, target_percentage,
                      total_executions, breached_executions, current_percentage,
                      alert_recipients::text AS alert_recipients, active, counters_refreshed_at,
                      created_at, updated_at
            """;

        SlaDefinition saved = jdbcTemplate.queryForObject(sql, new SlaDefinitionRowMapper(jsonMapper),
                definition.getSlaId(),
                definition.getName(),
                definition.getWorkflowId(),
                definition.getTargetDurationMs(),
                definition.getWarningThresholdMs(),
                definition.getCriticalThresholdMs(),
                definition.getWindowHours(),
                definition.getTargetPercentage(),
                jsonMapper.writeList(definition.getAlertRecipients()),
                definition.isActive(),
                Timestamp.from(createdAt),
                Timestamp.from(now)
        );

        log.debug("Upserted SLA definition {}", definition.getSlaId());
        return saved;
    }

    public Optional<SlaDefinition> findById(String slaId) {
        List<SlaDefinition> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE sla_id = ?", new SlaDefinitionRowMapper(jsonMapper), slaId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Row-locking read. Must run inside a transaction; serializes counter updates per SLA.
     */
    public Optional<SlaDefinition> findByIdForUpdate(String slaId) {
        List<SlaDefinition> results = jdbcTemplate.query(
                SELECT_BASE + " WHERE sla_id = ? FOR UPDATE", new SlaDefinitionRowMapper(jsonMapper), slaId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<SlaDefinition> findAllActive() {
        return jdbcTemplate.query(
                SELECT_BASE + " WHERE active = true ORDER BY sla_id", new SlaDefinitionRowMapper(jsonMapper));
    }

    public int updateCounters(String slaId, long totalExecutions, long breachedExecutions,
                              BigDecimal currentPercentage, Instant refreshedAt) {
        return jdbcTemplate.update("""
            UPDATE sla_definitions
            SET total_executions = ?,
                breached_executions = ?,
                current_percentage = ?,
                counters_refreshed_at = ?,
                updated_at = ?
            WHERE sla_id = ?
            """,
                totalExecutions,
                breachedExecutions,
                currentPercentage,
                Timestamp.from(refreshedAt),
                Timestamp.from(refreshedAt),
                slaId);
    }

    public int setActive(String slaId, boolean active, Instant now) {
        return jdbcTemplate.update(
                "UPDATE sla_definitions SET active = ?, updated_at = ? WHERE sla_id = ?",
                active, Timestamp.from(now), slaId);
    }

    private static class SlaDefinitionRowMapper implements RowMapper<SlaDefinition> {

        private final JsonColumnMapper jsonMapper;

        SlaDefinitionRowMapper(JsonColumnMapper jsonMapper) {
            this.jsonMapper = jsonMapper;
        }

        @Override
        public SlaDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp refreshed = rs.getTimestamp("counters_refreshed_at");
            return SlaDefinition.builder()
                    .slaId(rs.getString("sla_id"))
                    .name(rs.getString("name"))
                    .workflowId(rs.getString("workflow_id"))
                    .targetDurationMs(rs.getLong("target_duration_ms"))
                    .warningThresholdMs(rs.getLong("warning_threshold_ms"))
                    .criticalThresholdMs(rs.getLong("critical_threshold_ms"))
                    .windowHours(rs.getInt("window_hours"))
                    .targetPercentage(rs.getBigDecimal("target_percentage"))
                    .totalExecutions(rs.getLong("total_executions"))
                    .breachedExecutions(rs.getLong("breached_executions"))
                    .currentPercentage(rs.getBigDecimal("current_percentage"))
                    .alertRecipients(jsonMapper.readList(rs.getString("alert_recipients")))
                    .active(rs.getBoolean("active"))
                    .countersRefreshedAt(refreshed != null ? refreshed.toInstant() : null)
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
