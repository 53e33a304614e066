package com.company.workflowsla.repository;

import com.company.workflowsla.domain.SlaBreach;
import com.company.workflowsla.domain.enums.BreachSeverity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class SlaBreachRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnMapper jsonMapper;

    private static final String COLUMNS = """
        breach_id, sla_id, execution_id, severity, actual_duration_ms, target_duration_ms,
        breach_margin_ms, alert_sent, alert_sent_at, alert_recipients::text AS alert_recipients,
        acknowledged, acknowledged_at, acknowledged_by, resolution_notes, detected_at, updated_at
        """;

    /**
     * Insert unless a breach for the same (SLA, execution) exists.
     *
     * @return the new breach, or empty if another report created it first
     */
    public Optional<SlaBreach> insertIfAbsent(SlaBreach breach) {
        String sql = """
            INSERT INTO sla_breaches (
                sla_id, execution_id, severity, actual_duration_ms, target_duration_ms,
                breach_margin_ms, alert_sent, alert_recipients, acknowledged, detected_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, false, CAST(? AS jsonb), false, ?, ?)
            ON CONFLICT (sla_id, execution_id) DO NOTHING
            RETURNING
            """ + COLUMNS;

        List<SlaBreach> inserted = jdbcTemplate.query(sql, new SlaBreachRowMapper(jsonMapper),
                breach.getSlaId(),
                breach.getExecutionId(),
                breach.getSeverity().name(),
                breach.getActualDurationMs(),
                breach.getTargetDurationMs(),
                breach.getBreachMarginMs(),
                jsonMapper.writeList(breach.getAlertRecipients()),
                Timestamp.from(breach.getDetectedAt()),
                Timestamp.from(breach.getDetectedAt()));

        return inserted.isEmpty() ? Optional.empty() : Optional.of(inserted.get(0));
    }

    public Optional<SlaBreach> findById(Long breachId) {
        List<SlaBreach> results = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM sla_breaches WHERE breach_id = ?",
                new SlaBreachRowMapper(jsonMapper), breachId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<SlaBreach> findBySlaAndExecution(String slaId, String executionId) {
        List<SlaBreach> results = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM sla_breaches WHERE sla_id = ? AND execution_id = ?",
                new SlaBreachRowMapper(jsonMapper), slaId, executionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Oldest breaches whose alert was never delivered, detected before {@code detectedBefore}.
     * Rows are locked and rows locked by a concurrent redelivery are skipped, so call this
     * inside a transaction.
     */
    public List<SlaBreach> findUnalerted(Instant detectedBefore, int limit) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + """
                 FROM sla_breaches
                WHERE alert_sent = false
                  AND detected_at < ?
                ORDER BY detected_at ASC
                LIMIT ?
                FOR UPDATE SKIP LOCKED
                """,
                new SlaBreachRowMapper(jsonMapper), Timestamp.from(detectedBefore), limit);
    }

    /**
     * Overwrite severity and durations unless that would lower a critical breach to warning.
     */
    public int updateEscalating(Long breachId, BreachSeverity severity, long actualDurationMs,
                                long targetDurationMs, long breachMarginMs, Instant now) {
        return jdbcTemplate.update("""
            UPDATE sla_breaches
            SET severity = ?,
                actual_duration_ms = ?,
                target_duration_ms = ?,
                breach_margin_ms = ?,
                updated_at = ?
            WHERE breach_id = ?
              AND (severity = 'WARNING' OR ? = 'CRITICAL')
            """,
                severity.name(),
                actualDurationMs,
                targetDurationMs,
                breachMarginMs,
                Timestamp.from(now),
                breachId,
                severity.name());
    }

    public int markAlertSent(Long breachId, Instant sentAt) {
        return jdbcTemplate.update("""
            UPDATE sla_breaches
            SET alert_sent = true,
                alert_sent_at = ?,
                updated_at = ?
            WHERE breach_id = ?
              AND alert_sent = false
            """, Timestamp.from(sentAt), Timestamp.from(sentAt), breachId);
    }

    public int acknowledge(Long breachId, String actorId, String notes, Instant now) {
        return jdbcTemplate.update("""
            UPDATE sla_breaches
            SET acknowledged = true,
                acknowledged_at = ?,
                acknowledged_by = ?,
                resolution_notes = ?,
                updated_at = ?
            WHERE breach_id = ?
              AND acknowledged = false
            """, Timestamp.from(now), actorId, notes, Timestamp.from(now), breachId);
    }

    public Map<BreachSeverity, Long> countBySeveritySince(String slaId, Instant since) {
        Map<BreachSeverity, Long> counts = new EnumMap<>(BreachSeverity.class);
        for (BreachSeverity severity : BreachSeverity.values()) {
            counts.put(severity, 0L);
        }

        jdbcTemplate.query("""
            SELECT severity, COUNT(*) AS breach_count
            FROM sla_breaches
            WHERE sla_id = ?
              AND detected_at >= ?
            GROUP BY severity
            """,
                (RowCallbackHandler) rs -> counts.put(
                        BreachSeverity.fromString(rs.getString("severity")), rs.getLong("breach_count")),
                slaId, Timestamp.from(since));

        return counts;
    }

    private static class SlaBreachRowMapper implements RowMapper<SlaBreach> {

        private final JsonColumnMapper jsonMapper;

        SlaBreachRowMapper(JsonColumnMapper jsonMapper) {
            this.jsonMapper = jsonMapper;
        }

        @Override
        public SlaBreach mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SlaBreach.builder()
                    .breachId(rs.getLong("breach_id"))
                    .slaId(rs.getString("sla_id"))
                    .executionId(rs.getString("execution_id"))
                    .severity(BreachSeverity.fromString(rs.getString("severity")))
                    .actualDurationMs(rs.getLong("actual_duration_ms"))
                    .targetDurationMs(rs.getLong("target_duration_ms"))
                    .breachMarginMs(rs.getLong("breach_margin_ms"))
                    .alertSent(rs.getBoolean("alert_sent"))
                    .alertSentAt(rs.getTimestamp("alert_sent_at") != null ?
                            rs.getTimestamp("alert_sent_at").toInstant() : null)
                    .alertRecipients(jsonMapper.readList(rs.getString("alert_recipients")))
                    .acknowledged(rs.getBoolean("acknowledged"))
                    .acknowledgedAt(rs.getTimestamp("acknowledged_at") != null ?
                            rs.getTimestamp("acknowledged_at").toInstant() : null)
                    .acknowledgedBy(rs.getString("acknowledged_by"))
                    .resolutionNotes(rs.getString("resolution_notes"))
                    .detectedAt(rs.getTimestamp("detected_at").toInstant())
                    .updatedAt(rs.getTimestamp("updated_at").toInstant())
                    .build();
        }
    }
}
