package com.company.alerting.repository;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.enums.AlertStatus;
import com.company.alerting.domain.enums.Severity;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.company.alerting.util.TimeUtils.getInstant;
import static com.company.alerting.util.TimeUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
@Slf4j
public class AlertRepository {

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    private static final String SELECT_BASE = """
        SELECT id, fingerprint, name, source, status, severity, service, host, environment,
               description, labels, annotations, tags, generator_url,
               starts_at, ends_at, last_received_at, acknowledged_at, resolved_at,
               duplicate_count, incident_id, created_at, updated_at
        FROM alerts
        """;

    public Alert insert(Alert alert) {
        String sql = """
            INSERT INTO alerts (
                fingerprint, name, source, status, severity, service, host, environment,
                description, labels, annotations, tags, generator_url,
                starts_at, ends_at, last_received_at, acknowledged_at, resolved_at,
                duplicate_count, incident_id, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, alert.getFingerprint());
            ps.setString(2, alert.getName());
            ps.setString(3, alert.getSource());
            ps.setString(4, alert.getStatus().name());
            ps.setString(5, alert.getSeverity().name());
            ps.setString(6, alert.getService());
            ps.setString(7, alert.getHost());
            ps.setString(8, alert.getEnvironment());
            ps.setString(9, alert.getDescription());
            ps.setString(10, json.write(alert.getLabels()));
            ps.setString(11, json.write(alert.getAnnotations()));
            ps.setString(12, json.write(alert.getTags()));
            ps.setString(13, alert.getGeneratorUrl());
            ps.setTimestamp(14, toTimestamp(alert.getStartsAt()));
            ps.setTimestamp(15, toTimestamp(alert.getEndsAt()));
            ps.setTimestamp(16, toTimestamp(alert.getLastReceivedAt()));
            ps.setTimestamp(17, toTimestamp(alert.getAcknowledgedAt()));
            ps.setTimestamp(18, toTimestamp(alert.getResolvedAt()));
            ps.setInt(19, alert.getDuplicateCount() != null ? alert.getDuplicateCount() : 1);
            ps.setObject(20, alert.getIncidentId());
            ps.setTimestamp(21, toTimestamp(alert.getCreatedAt()));
            ps.setTimestamp(22, toTimestamp(alert.getUpdatedAt()));
            return ps;
        }, keyHolder);

        alert.setId(keyHolder.getKey().longValue());
        return alert;
    }

    public Optional<Alert> findById(Long id) {
        List<Alert> results = jdbcTemplate.query(SELECT_BASE + " WHERE id = ?", new AlertRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Most recent non-archived alert with this fingerprint still inside the dedup window.
     */
    public Optional<Alert> findDedupCandidate(String fingerprint, Instant windowStart) {
        String sql = SELECT_BASE + """
            WHERE fingerprint = ?
            AND status <> 'ARCHIVED'
            AND last_received_at >= ?
            ORDER BY last_received_at DESC, id DESC
            LIMIT 1
            """;

        List<Alert> results = jdbcTemplate.query(sql, new AlertRowMapper(),
                fingerprint, toTimestamp(windowStart));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Alert> findByIncidentId(Long incidentId) {
        return jdbcTemplate.query(SELECT_BASE + " WHERE incident_id = ? ORDER BY id",
                new AlertRowMapper(), incidentId);
    }

    public long countByFingerprint(String fingerprint) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM alerts WHERE fingerprint = ?", Long.class, fingerprint);
        return count != null ? count : 0;
    }

    /**
     * Atomic in the database: concurrent duplicates never lose an increment.
     */
    public int recordDuplicate(Long alertId, Instant receivedAt) {
        return jdbcTemplate.update("""
            UPDATE alerts
            SET duplicate_count = duplicate_count + 1,
                last_received_at = ?,
                updated_at = ?
            WHERE id = ?
            """, toTimestamp(receivedAt), toTimestamp(receivedAt), alertId);
    }

    public int markResolved(Long alertId, Instant endsAt, Instant resolvedAt) {
        return jdbcTemplate.update("""
            UPDATE alerts
            SET status = 'RESOLVED', ends_at = ?, resolved_at = ?, updated_at = ?
            WHERE id = ? AND status NOT IN ('RESOLVED', 'ARCHIVED')
            """, toTimestamp(endsAt), toTimestamp(resolvedAt), toTimestamp(resolvedAt), alertId);
    }

    public int markSuppressed(Long alertId, Instant at) {
        return jdbcTemplate.update(
                "UPDATE alerts SET status = 'SUPPRESSED', updated_at = ? WHERE id = ?",
                toTimestamp(at), alertId);
    }

    public int markAcknowledged(Long alertId, Instant at) {
        return jdbcTemplate.update("""
            UPDATE alerts
            SET status = 'ACKNOWLEDGED', acknowledged_at = ?, updated_at = ?
            WHERE id = ? AND status = 'FIRING'
            """, toTimestamp(at), toTimestamp(at), alertId);
    }

    public int assignIncident(Long alertId, Long incidentId, Instant at) {
        return jdbcTemplate.update(
                "UPDATE alerts SET incident_id = ?, updated_at = ? WHERE id = ?",
                incidentId, toTimestamp(at), alertId);
    }

    public int acknowledgeFiringByIncident(Long incidentId, Instant at) {
        return jdbcTemplate.update("""
            UPDATE alerts
            SET status = 'ACKNOWLEDGED', acknowledged_at = ?, updated_at = ?
            WHERE incident_id = ? AND status = 'FIRING'
            """, toTimestamp(at), toTimestamp(at), incidentId);
    }

    public int resolveActiveByIncident(Long incidentId, Instant at) {
        return jdbcTemplate.update("""
            UPDATE alerts
            SET status = 'RESOLVED', ends_at = ?, resolved_at = ?, updated_at = ?
            WHERE incident_id = ? AND status IN ('FIRING', 'ACKNOWLEDGED')
            """, toTimestamp(at), toTimestamp(at), toTimestamp(at), incidentId);
    }

    public int countUnresolvedByIncident(Long incidentId) {
        Integer count = jdbcTemplate.queryForObject("""
            SELECT COUNT(*) FROM alerts
            WHERE incident_id = ? AND status NOT IN ('RESOLVED', 'ARCHIVED')
            """, Integer.class, incidentId);
        return count != null ? count : 0;
    }

    private class AlertRowMapper implements RowMapper<Alert> {
        @Override
        public Alert mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Alert.builder()
                    .id(rs.getLong("id"))
                    .fingerprint(rs.getString("fingerprint"))
                    .name(rs.getString("name"))
                    .source(rs.getString("source"))
                    .status(AlertStatus.valueOf(rs.getString("status")))
                    .severity(Severity.valueOf(rs.getString("severity")))
                    .service(rs.getString("service"))
                    .host(rs.getString("host"))
                    .environment(rs.getString("environment"))
                    .description(rs.getString("description"))
                    .labels(json.read(rs.getString("labels"), STRING_MAP))
                    .annotations(json.read(rs.getString("annotations"), STRING_MAP))
                    .tags(json.read(rs.getString("tags"), STRING_LIST))
                    .generatorUrl(rs.getString("generator_url"))
                    .startsAt(getInstant(rs, "starts_at"))
                    .endsAt(getInstant(rs, "ends_at"))
                    .lastReceivedAt(getInstant(rs, "last_received_at"))
                    .acknowledgedAt(getInstant(rs, "acknowledged_at"))
                    .resolvedAt(getInstant(rs, "resolved_at"))
                    .duplicateCount(rs.getInt("duplicate_count"))
                    .incidentId(rs.getObject("incident_id", Long.class))
                    .createdAt(getInstant(rs, "created_at"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .build();
        }
    }
}
