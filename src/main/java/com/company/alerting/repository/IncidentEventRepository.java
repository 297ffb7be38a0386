package com.company.alerting.repository;

import com.company.alerting.domain.IncidentEvent;
import com.company.alerting.domain.enums.IncidentEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.company.alerting.util.TimeUtils.getInstant;
import static com.company.alerting.util.TimeUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
public class IncidentEventRepository {

    private final JdbcTemplate jdbcTemplate;

    public void append(IncidentEvent event) {
        jdbcTemplate.update("""
            INSERT INTO incident_events (incident_id, event_type, description, actor, created_at)
            VALUES (?, ?, ?, ?, ?)
            """,
                event.getIncidentId(),
                event.getEventType().value(),
                event.getDescription(),
                event.getActor() != null ? event.getActor() : IncidentEvent.SYSTEM_ACTOR,
                toTimestamp(event.getCreatedAt()));
    }

    public List<IncidentEvent> findByIncidentId(Long incidentId) {
        return jdbcTemplate.query("""
            SELECT id, incident_id, event_type, description, actor, created_at
            FROM incident_events
            WHERE incident_id = ?
            ORDER BY created_at, id
            """,
                (rs, rowNum) -> IncidentEvent.builder()
                        .id(rs.getLong("id"))
                        .incidentId(rs.getLong("incident_id"))
                        .eventType(IncidentEventType.fromString(rs.getString("event_type")))
                        .description(rs.getString("description"))
                        .actor(rs.getString("actor"))
                        .createdAt(getInstant(rs, "created_at"))
                        .build(),
                incidentId);
    }
}
