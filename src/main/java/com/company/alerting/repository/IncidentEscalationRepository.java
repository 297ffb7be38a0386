package com.company.alerting.repository;

import com.company.alerting.domain.IncidentEscalation;
import com.company.alerting.domain.enums.EscalationState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.company.alerting.util.TimeUtils.getInstant;
import static com.company.alerting.util.TimeUtils.toTimestamp;

/**
 * Durable escalation timers. Each transition is a compare-and-set on {@code version}.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class IncidentEscalationRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT incident_id, policy_id, state, current_level, repeats_remaining,
               level_entered_at, timeout_minutes, next_due_at, version, created_at, updated_at
        FROM incident_escalations
        """;

    /**
     * @throws org.springframework.dao.DuplicateKeyException when the incident already has an escalation
     */
    public void insert(IncidentEscalation escalation) {
        jdbcTemplate.update("""
            INSERT INTO incident_escalations (
                incident_id, policy_id, state, current_level, repeats_remaining,
                level_entered_at, timeout_minutes, next_due_at, version, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0, ?, ?)
            """,
                escalation.getIncidentId(),
                escalation.getPolicyId(),
                escalation.getState().name(),
                escalation.getCurrentLevel(),
                escalation.getRepeatsRemaining(),
                toTimestamp(escalation.getLevelEnteredAt()),
                escalation.getTimeoutMinutes(),
                toTimestamp(escalation.getNextDueAt()),
                toTimestamp(escalation.getCreatedAt()),
                toTimestamp(escalation.getUpdatedAt()));
        escalation.setVersion(0);
    }

    public Optional<IncidentEscalation> findByIncidentId(Long incidentId) {
        List<IncidentEscalation> results = jdbcTemplate.query(SELECT_BASE + " WHERE incident_id = ?",
                new EscalationRowMapper(), incidentId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Active escalations whose timer is due, oldest first.
     */
    public List<IncidentEscalation> findDue(Instant now, int limit) {
        String sql = SELECT_BASE + """
            WHERE state = 'ACTIVE'
            AND next_due_at <= ?
            ORDER BY next_due_at ASC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, new EscalationRowMapper(), toTimestamp(now), limit);
    }

    /**
     * Writes the new level/state only if nobody moved the row since {@code expectedVersion}
     * was read.
     *
     * @return true if this caller won the transition
     */
    public boolean compareAndSet(IncidentEscalation updated, long expectedVersion) {
        int rows = jdbcTemplate.update("""
            UPDATE incident_escalations
            SET state = ?,
                current_level = ?,
                repeats_remaining = ?,
                level_entered_at = ?,
                timeout_minutes = ?,
                next_due_at = ?,
                version = version + 1,
                updated_at = ?
            WHERE incident_id = ?
            AND version = ?
            """,
                updated.getState().name(),
                updated.getCurrentLevel(),
                updated.getRepeatsRemaining(),
                toTimestamp(updated.getLevelEnteredAt()),
                updated.getTimeoutMinutes(),
                toTimestamp(updated.getNextDueAt()),
                toTimestamp(updated.getUpdatedAt()),
                updated.getIncidentId(),
                expectedVersion);

        if (rows == 1) {
            updated.setVersion(expectedVersion + 1);
            return true;
        }
        log.debug("Escalation for incident {} moved past version {}", updated.getIncidentId(), expectedVersion);
        return false;
    }

    /**
     * Stops an active escalation; no-op for inactive or exhausted rows.
     */
    public int deactivate(Long incidentId, Instant at) {
        return jdbcTemplate.update("""
            UPDATE incident_escalations
            SET state = 'INACTIVE', next_due_at = NULL, version = version + 1, updated_at = ?
            WHERE incident_id = ? AND state = 'ACTIVE'
            """, toTimestamp(at), incidentId);
    }

    public long countActive() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM incident_escalations WHERE state = 'ACTIVE'", Long.class);
        return count != null ? count : 0;
    }

    private static class EscalationRowMapper implements RowMapper<IncidentEscalation> {
        @Override
        public IncidentEscalation mapRow(ResultSet rs, int rowNum) throws SQLException {
            return IncidentEscalation.builder()
                    .incidentId(rs.getLong("incident_id"))
                    .policyId(rs.getLong("policy_id"))
                    .state(EscalationState.valueOf(rs.getString("state")))
                    .currentLevel(rs.getInt("current_level"))
                    .repeatsRemaining(rs.getInt("repeats_remaining"))
                    .levelEnteredAt(getInstant(rs, "level_entered_at"))
                    .timeoutMinutes(rs.getInt("timeout_minutes"))
                    .nextDueAt(getInstant(rs, "next_due_at"))
                    .version(rs.getLong("version"))
                    .createdAt(getInstant(rs, "created_at"))
                    .updatedAt(getInstant(rs, "updated_at"))
                    .build();
        }
    }
}
