package com.company.alerting.repository;

import com.company.alerting.domain.NotificationChannel;
import com.company.alerting.domain.enums.ChannelType;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class NotificationChannelRepository {

    private static final TypeReference<Map<String, Object>> CONFIG = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public NotificationChannel insert(NotificationChannel channel) {
        String sql = """
            INSERT INTO notification_channels (name, channel_type, config, filters, is_active)
            VALUES (?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, channel.getName());
            ps.setString(2, channel.getChannelType().name());
            ps.setString(3, json.write(channel.getConfig()));
            ps.setString(4, json.write(channel.getFilters()));
            ps.setBoolean(5, !Boolean.FALSE.equals(channel.getActive()));
            return ps;
        }, keyHolder);

        channel.setId(keyHolder.getKey().longValue());
        return channel;
    }

    public List<NotificationChannel> findActive() {
        return jdbcTemplate.query("""
            SELECT id, name, channel_type, config, filters, is_active
            FROM notification_channels
            WHERE is_active = TRUE
            ORDER BY id
            """, new ChannelRowMapper());
    }

    private class ChannelRowMapper implements RowMapper<NotificationChannel> {
        @Override
        public NotificationChannel mapRow(ResultSet rs, int rowNum) throws SQLException {
            Map<String, Object> config = json.read(rs.getString("config"), CONFIG);
            return NotificationChannel.builder()
                    .id(rs.getLong("id"))
                    .name(rs.getString("name"))
                    .channelType(ChannelType.fromString(rs.getString("channel_type")))
                    .config(config != null ? config : new HashMap<>())
                    .filters(json.read(rs.getString("filters"), NotificationChannel.Filters.class))
                    .active(rs.getBoolean("is_active"))
                    .build();
        }
    }
}
