package com.company.alerting.repository;

import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.IncidentStatus;
import com.company.alerting.domain.enums.Severity;
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
import java.util.Optional;

import static com.company.alerting.util.TimeUtils.getInstant;
import static com.company.alerting.util.TimeUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
@Slf4j
public class IncidentRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT id, title, summary, service, status, severity,
               started_at, last_alert_at, acknowledged_at, resolved_at, created_at, updated_at
        FROM incidents
        """;

    public Incident insert(Incident incident) {
        String sql = """
            INSERT INTO incidents (
                title, summary, service, status, severity,
                started_at, last_alert_at, acknowledged_at, resolved_at, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, incident.getTitle());
            ps.setString(2, incident.getSummary());
            ps.setString(3, incident.getService());
            ps.setString(4, incident.getStatus().name());
            ps.setString(5, incident.getSeverity().name());
            ps.setTimestamp(6, toTimestamp(incident.getStartedAt()));
            ps.setTimestamp(7, toTimestamp(incident.getLastAlertAt()));
            ps.setTimestamp(8, toTimestamp(incident.getAcknowledgedAt()));
            ps.setTimestamp(9, toTimestamp(incident.getResolvedAt()));
            ps.setTimestamp(10, toTimestamp(incident.getCreatedAt()));
            ps.setTimestamp(11, toTimestamp(incident.getUpdatedAt()));
            return ps;
        }, keyHolder);

        incident.setId(keyHolder.getKey().longValue());
        return incident;
    }

    public Optional<Incident> findById(Long id) {
        List<Incident> results = jdbcTemplate.query(SELECT_BASE + " WHERE id = ?",
                new IncidentRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Row lock held until the surrounding transaction ends; serializes attach,
     * acknowledge, resolve and timer handling for one incident.
     */
    public Optional<Incident> findByIdForUpdate(Long id) {
        List<Incident> results = jdbcTemplate.query(SELECT_BASE + " WHERE id = ? FOR UPDATE",
                new IncidentRowMapper(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Open or acknowledged incident of this service with member activity since {@code windowStart}.
     */
    public Optional<Incident> findCorrelationCandidate(String service, Instant windowStart) {
        String sql = SELECT_BASE + """
            WHERE service = ?
            AND status IN ('OPEN', 'ACKNOWLEDGED')
            AND last_alert_at >= ?
            ORDER BY last_alert_at DESC, id DESC
            LIMIT 1
            """;

        List<Incident> results = jdbcTemplate.query(sql, new IncidentRowMapper(),
                service, toTimestamp(windowStart));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public int updateSeverity(Long id, Severity severity, Instant at) {
        return jdbcTemplate.update(
                "UPDATE incidents SET severity = ?, updated_at = ? WHERE id = ?",
                severity.name(), toTimestamp(at), id);
    }

    /**
     * Moves the correlation anchor forward only; an out-of-order arrival never rewinds it.
     */
    public int touchLastAlert(Long id, Instant at) {
        return jdbcTemplate.update("""
            UPDATE incidents
            SET last_alert_at = ?, updated_at = ?
            WHERE id = ? AND last_alert_at < ?
            """, toTimestamp(at), toTimestamp(at), id, toTimestamp(at));
    }

    /**
     * started_at tracks the earliest member alert; only ever moves back.
     */
    public int extendStartedAt(Long id, Instant startsAt, Instant at) {
        return jdbcTemplate.update("""
            UPDATE incidents
            SET started_at = ?, updated_at = ?
            WHERE id = ? AND started_at > ?
            """, toTimestamp(startsAt), toTimestamp(at), id, toTimestamp(startsAt));
    }

    public int markAcknowledged(Long id, Instant at) {
        return jdbcTemplate.update("""
            UPDATE incidents
            SET status = 'ACKNOWLEDGED', acknowledged_at = ?, updated_at = ?
            WHERE id = ? AND status = 'OPEN'
            """, toTimestamp(at), toTimestamp(at), id);
    }

    public int markResolved(Long id, Instant at) {
        return jdbcTemplate.update("""
            UPDATE incidents
            SET status = 'RESOLVED', resolved_at = ?, updated_at = ?
            WHERE id = ? AND status <> 'RESOLVED'
            """, toTimestamp(at), toTimestamp(at), id);
    }

    public long countByStatus(IncidentStatus status) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM incidents WHERE status = ?", Long.class, status.name());
        return count != null ? count : 0;
    }

    public long countByService(String service) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM incidents WHERE service = ?", Long.class, service);
        return count != null ? count : 0;
    }

    private static class IncidentRowMapper implements RowMapper<Incident> {
        @Override
        public Incident mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Incident.builder()
                    .id(rs.getLong("id"))
                    .title(rs.getString("title"))
                    .summary(rs.getString("summary"))
                    .service(rs.getString("service"))
                    .status(IncidentStatus.valueOf(rs.getString("status")))
                    .severity(Severity.valueOf(rs.getString("severity")))
                    .startedAt(getInstant(rs, "started_at"))
                    .lastAlertAt(getInstant(rs, "last_alert_at"))
                    .acknowledgedAt(getInstant(rs, "acknowledged_at"))
                    .resolvedAt(getInstant(rs, "resolved_at"))
                    .createdAt(getInstant(rs, "created_at"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .build();
        }
    }
}
