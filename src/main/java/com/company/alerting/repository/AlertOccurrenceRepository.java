package com.company.alerting.repository;

import com.company.alerting.domain.AlertOccurrence;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.company.alerting.util.TimeUtils.getInstant;
import static com.company.alerting.util.TimeUtils.toTimestamp;

/**
 * Append-only log of every arrival of an alert; rows are never updated or deleted.
 */
@Repository
@RequiredArgsConstructor
public class AlertOccurrenceRepository {

    private final JdbcTemplate jdbcTemplate;

    public void append(Long alertId, Instant receivedAt) {
        jdbcTemplate.update("INSERT INTO alert_occurrences (alert_id, received_at) VALUES (?, ?)",
                alertId, toTimestamp(receivedAt));
    }

    public int countByAlertId(Long alertId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM alert_occurrences WHERE alert_id = ?", Integer.class, alertId);
        return count != null ? count : 0;
    }

    public List<AlertOccurrence> findByAlertId(Long alertId) {
        return jdbcTemplate.query("""
            SELECT id, alert_id, received_at
            FROM alert_occurrences
            WHERE alert_id = ?
            ORDER BY received_at, id
            """,
                (rs, rowNum) -> AlertOccurrence.builder()
                        .id(rs.getLong("id"))
                        .alertId(rs.getLong("alert_id"))
                        .receivedAt(getInstant(rs, "received_at"))
                        .build(),
                alertId);
    }
}
