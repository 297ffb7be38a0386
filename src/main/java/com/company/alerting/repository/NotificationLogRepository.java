package com.company.alerting.repository;

import com.company.alerting.domain.NotificationLog;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.domain.enums.NotificationStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.time.Instant;
import java.util.List;

import static com.company.alerting.util.TimeUtils.getInstant;
import static com.company.alerting.util.TimeUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
public class NotificationLogRepository {

    private final JdbcTemplate jdbcTemplate;

    public Long insertPending(Long channelId, Long incidentId, NotificationEventType eventType, Instant at) {
        String sql = """
            INSERT INTO notification_logs (channel_id, incident_id, event_type, status, created_at)
            VALUES (?, ?, ?, 'PENDING', ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setLong(1, channelId);
            ps.setLong(2, incidentId);
            ps.setString(3, eventType.name());
            ps.setTimestamp(4, toTimestamp(at));
            return ps;
        }, keyHolder);

        return keyHolder.getKey().longValue();
    }

    public void markSent(Long logId, Instant sentAt) {
        jdbcTemplate.update(
                "UPDATE notification_logs SET status = 'SENT', sent_at = ? WHERE id = ?",
                toTimestamp(sentAt), logId);
    }

    public void markFailed(Long logId, String errorMessage) {
        jdbcTemplate.update(
                "UPDATE notification_logs SET status = 'FAILED', error_message = ? WHERE id = ?",
                errorMessage, logId);
    }

    /**
     * Fallback cooldown check when the cooldown cache is unreachable.
     */
    public boolean existsSince(Long channelId, Long incidentId, Instant since) {
        Integer count = jdbcTemplate.queryForObject("""
            SELECT COUNT(*) FROM notification_logs
            WHERE channel_id = ? AND incident_id = ? AND created_at >= ?
            """, Integer.class, channelId, incidentId, toTimestamp(since));
        return count != null && count > 0;
    }

    public List<NotificationLog> findByIncidentId(Long incidentId) {
        return jdbcTemplate.query("""
            SELECT id, channel_id, incident_id, event_type, status, error_message, sent_at, created_at
            FROM notification_logs
            WHERE incident_id = ?
            ORDER BY id
            """,
                (rs, rowNum) -> NotificationLog.builder()
                        .id(rs.getLong("id"))
                        .channelId(rs.getLong("channel_id"))
                        .incidentId(rs.getLong("incident_id"))
                        .eventType(NotificationEventType.valueOf(rs.getString("event_type")))
                        .status(NotificationStatus.valueOf(rs.getString("status")))
                        .errorMessage(rs.getString("error_message"))
                        .sentAt(getInstant(rs, "sent_at"))
                        .createdAt(getInstant(rs, "created_at"))
                        .build(),
                incidentId);
    }
}
