package com.company.workflowsla.repository;

import com.company.workflowsla.domain.SlaExecutionSample;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * Raw duration samples, one per (SLA, execution). Re-reporting an execution keeps its
 * original report time and never clears a recorded breach.
 */
@Repository
@RequiredArgsConstructor
public class SlaExecutionSampleRepository {

    private final JdbcTemplate jdbcTemplate;

    public void upsert(SlaExecutionSample sample) {
        jdbcTemplate.update("""
            INSERT INTO sla_execution_samples (
                sla_id, execution_id, actual_duration_ms, breached, reported_at
            ) VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (sla_id, execution_id) DO UPDATE SET
                actual_duration_ms = GREATEST(sla_execution_samples.actual_duration_ms, EXCLUDED.actual_duration_ms),
                breached = sla_execution_samples.breached OR EXCLUDED.breached
            """,
                sample.getSlaId(),
                sample.getExecutionId(),
                sample.getActualDurationMs(),
                Boolean.TRUE.equals(sample.getBreached()),
                Timestamp.from(sample.getReportedAt()));
    }

    public WindowCounts countSince(String slaId, Instant windowStart) {
        return jdbcTemplate.queryForObject("""
            SELECT COUNT(*) AS total,
                   COUNT(*) FILTER (WHERE breached) AS breached
            FROM sla_execution_samples
            WHERE sla_id = ?
              AND reported_at >= ?
            """,
                (rs, rowNum) -> new WindowCounts(rs.getLong("total"), rs.getLong("breached")),
                slaId, Timestamp.from(windowStart));
    }

    public int deleteOlderThan(String slaId, Instant cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM sla_execution_samples WHERE sla_id = ? AND reported_at < ?",
                slaId, Timestamp.from(cutoff));
    }

    @Getter
    @AllArgsConstructor
    public static class WindowCounts {
        private final long total;
        private final long breached;
    }
}
