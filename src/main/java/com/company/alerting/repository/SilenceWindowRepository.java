package com.company.alerting.repository;

import com.company.alerting.domain.SilenceWindow;
import lombok.RequiredArgsConstructor;
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

import static com.company.alerting.util.TimeUtils.getInstant;
import static com.company.alerting.util.TimeUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
public class SilenceWindowRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public SilenceWindow insert(SilenceWindow window) {
        String sql = """
            INSERT INTO silence_windows (name, matchers, starts_at, ends_at, is_active, created_by, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, window.getName());
            ps.setString(2, json.write(window.getMatchers()));
            ps.setTimestamp(3, toTimestamp(window.getStartsAt()));
            ps.setTimestamp(4, toTimestamp(window.getEndsAt()));
            ps.setBoolean(5, !Boolean.FALSE.equals(window.getActive()));
            ps.setString(6, window.getCreatedBy());
            ps.setTimestamp(7, toTimestamp(window.getCreatedAt()));
            return ps;
        }, keyHolder);

        window.setId(keyHolder.getKey().longValue());
        return window;
    }

    /**
     * Windows that are enabled and whose {@code [starts_at, ends_at]} contains {@code now}.
     */
    public List<SilenceWindow> findActive(Instant now) {
        String sql = """
            SELECT id, name, matchers, starts_at, ends_at, is_active, created_by, created_at
            FROM silence_windows
            WHERE is_active = TRUE
            AND starts_at <= ?
            AND ends_at >= ?
            ORDER BY id
            """;

        return jdbcTemplate.query(sql, new SilenceWindowRowMapper(), toTimestamp(now), toTimestamp(now));
    }

    private class SilenceWindowRowMapper implements RowMapper<SilenceWindow> {
        @Override
        public SilenceWindow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SilenceWindow.builder()
                    .id(rs.getLong("id"))
                    .name(rs.getString("name"))
                    .matchers(json.read(rs.getString("matchers"), SilenceWindow.Matchers.class))
                    .startsAt(getInstant(rs, "starts_at"))
                    .endsAt(getInstant(rs, "ends_at"))
                    .active(rs.getBoolean("is_active"))
                    .createdBy(rs.getString("created_by"))
                    .createdAt(getInstant(rs, "created_at"))
                    .build();
        }
    }
}
