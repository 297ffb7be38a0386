package com.company.alerting.repository;

import com.company.alerting.domain.OnCallSchedule;
import com.company.alerting.domain.enums.RotationType;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.company.alerting.util.TimeUtils.formatHandoff;
import static com.company.alerting.util.TimeUtils.getInstant;
import static com.company.alerting.util.TimeUtils.parseHandoff;
import static com.company.alerting.util.TimeUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
public class OnCallScheduleRepository {

    private static final TypeReference<List<OnCallSchedule.Member>> MEMBERS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public OnCallSchedule insert(OnCallSchedule schedule) {
        String sql = """
            INSERT INTO oncall_schedules (
                name, rotation_type, members, handoff_time, timezone,
                rotation_interval_hours, rotation_interval_days, effective_from, is_active
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, schedule.getName());
            ps.setString(2, schedule.getRotationType().name());
            ps.setString(3, json.write(schedule.getMembers()));
            ps.setString(4, formatHandoff(schedule.getHandoffTime()));
            ps.setString(5, schedule.getTimezone() != null ? schedule.getTimezone() : "UTC");
            setNullableInt(ps, 6, schedule.getRotationIntervalHours());
            setNullableInt(ps, 7, schedule.getRotationIntervalDays());
            ps.setTimestamp(8, toTimestamp(schedule.getEffectiveFrom()));
            ps.setBoolean(9, !Boolean.FALSE.equals(schedule.getActive()));
            return ps;
        }, keyHolder);

        schedule.setId(keyHolder.getKey().longValue());
        return schedule;
    }

    public OnCallSchedule.ScheduleOverride insertOverride(OnCallSchedule.ScheduleOverride override) {
        String sql = """
            INSERT INTO oncall_overrides (schedule_id, user_id, starts_at, ends_at, created_at)
            VALUES (?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setLong(1, override.getScheduleId());
            ps.setString(2, override.getUserId());
            ps.setTimestamp(3, toTimestamp(override.getStartsAt()));
            ps.setTimestamp(4, toTimestamp(override.getEndsAt()));
            ps.setTimestamp(5, toTimestamp(override.getCreatedAt()));
            return ps;
        }, keyHolder);

        override.setId(keyHolder.getKey().longValue());
        return override;
    }

    /**
     * Loads the schedule together with the overrides covering {@code at}.
     */
    public Optional<OnCallSchedule> findWithOverrides(Long id, Instant at) {
        List<OnCallSchedule> results = jdbcTemplate.query("""
            SELECT id, name, rotation_type, members, handoff_time, timezone,
                   rotation_interval_hours, rotation_interval_days, effective_from, is_active
            FROM oncall_schedules
            WHERE id = ?
            """, new ScheduleRowMapper(), id);

        if (results.isEmpty()) {
            return Optional.empty();
        }

        OnCallSchedule schedule = results.get(0);
        schedule.setOverrides(findOverrides(id, at));
        return Optional.of(schedule);
    }

    private List<OnCallSchedule.ScheduleOverride> findOverrides(Long scheduleId, Instant at) {
        return jdbcTemplate.query("""
            SELECT id, schedule_id, user_id, starts_at, ends_at, created_at
            FROM oncall_overrides
            WHERE schedule_id = ?
            AND starts_at <= ?
            AND ends_at > ?
            ORDER BY created_at DESC, id DESC
            """,
                (rs, rowNum) -> OnCallSchedule.ScheduleOverride.builder()
                        .id(rs.getLong("id"))
                        .scheduleId(rs.getLong("schedule_id"))
                        .userId(rs.getString("user_id"))
                        .startsAt(getInstant(rs, "starts_at"))
                        .endsAt(getInstant(rs, "ends_at"))
                        .createdAt(getInstant(rs, "created_at"))
                        .build(),
                scheduleId, toTimestamp(at), toTimestamp(at));
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private class ScheduleRowMapper implements RowMapper<OnCallSchedule> {
        @Override
        public OnCallSchedule mapRow(ResultSet rs, int rowNum) throws SQLException {
            List<OnCallSchedule.Member> members = json.read(rs.getString("members"), MEMBERS);
            return OnCallSchedule.builder()
                    .id(rs.getLong("id"))
                    .name(rs.getString("name"))
                    .rotationType(RotationType.fromString(rs.getString("rotation_type")))
                    .members(members != null ? members : new ArrayList<>())
                    .handoffTime(parseHandoff(rs.getString("handoff_time")))
                    .timezone(rs.getString("timezone"))
                    .rotationIntervalHours(rs.getObject("rotation_interval_hours", Integer.class))
                    .rotationIntervalDays(rs.getObject("rotation_interval_days", Integer.class))
                    .effectiveFrom(getInstant(rs, "effective_from"))
                    .active(rs.getBoolean("is_active"))
                    .build();
        }
    }
}
