package com.company.alerting.repository;

import com.company.alerting.config.RedisCacheConfig;
import com.company.alerting.domain.EscalationPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static com.company.alerting.util.TimeUtils.getInstant;
import static com.company.alerting.util.TimeUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
public class EscalationPolicyRepository {

    private static final TypeReference<List<EscalationPolicy.Level>> LEVELS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    @CacheEvict(value = RedisCacheConfig.ESCALATION_POLICIES, allEntries = true)
    public EscalationPolicy insert(EscalationPolicy policy) {
        String sql = """
            INSERT INTO escalation_policies (name, levels, repeat_count, created_at)
            VALUES (?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, policy.getName());
            ps.setString(2, json.write(policy.getLevels()));
            ps.setInt(3, policy.getRepeatCount());
            ps.setTimestamp(4, toTimestamp(policy.getCreatedAt()));
            return ps;
        }, keyHolder);

        policy.setId(keyHolder.getKey().longValue());
        return policy;
    }

    /**
     * Cached: read on every incident creation, changed rarely.
     * Returns null when the policy does not exist.
     */
    @Cacheable(value = RedisCacheConfig.ESCALATION_POLICIES, key = "#id", unless = "#result == null")
    public EscalationPolicy findById(Long id) {
        List<EscalationPolicy> results = jdbcTemplate.query("""
            SELECT id, name, levels, repeat_count, created_at
            FROM escalation_policies
            WHERE id = ?
            """, new PolicyRowMapper(), id);
        return results.isEmpty() ? null : results.get(0);
    }

    private class PolicyRowMapper implements RowMapper<EscalationPolicy> {
        @Override
        public EscalationPolicy mapRow(ResultSet rs, int rowNum) throws SQLException {
            List<EscalationPolicy.Level> levels = json.read(rs.getString("levels"), LEVELS);
            return EscalationPolicy.builder()
                    .id(rs.getLong("id"))
                    .name(rs.getString("name"))
                    .levels(levels != null ? levels : new ArrayList<>())
                    .repeatCount(Math.max(0, rs.getInt("repeat_count")))
                    .createdAt(getInstant(rs, "created_at"))
                    .build();
        }
    }
}
