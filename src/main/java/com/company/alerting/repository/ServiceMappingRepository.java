package com.company.alerting.repository;

import com.company.alerting.config.RedisCacheConfig;
import com.company.alerting.domain.ServiceMapping;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.util.List;

import static com.company.alerting.util.TimeUtils.getInstant;
import static com.company.alerting.util.TimeUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
public class ServiceMappingRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    @CacheEvict(value = RedisCacheConfig.SERVICE_MAPPINGS, allEntries = true)
    public ServiceMapping insert(ServiceMapping mapping) {
        String sql = """
            INSERT INTO service_escalation_mappings
                (service_pattern, severity_filter, escalation_policy_id, priority, created_at)
            VALUES (?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, mapping.getServicePattern());
            ps.setString(2, json.write(mapping.getSeverityFilter()));
            ps.setLong(3, mapping.getEscalationPolicyId());
            ps.setInt(4, mapping.getPriority());
            ps.setTimestamp(5, toTimestamp(mapping.getCreatedAt()));
            return ps;
        }, keyHolder);

        mapping.setId(keyHolder.getKey().longValue());
        return mapping;
    }

    /**
     * All mappings in evaluation order: priority ascending, then oldest first.
     */
    @Cacheable(value = RedisCacheConfig.SERVICE_MAPPINGS, key = "'ordered'")
    public List<ServiceMapping> findAllOrdered() {
        return jdbcTemplate.query("""
            SELECT id, service_pattern, severity_filter, escalation_policy_id, priority, created_at
            FROM service_escalation_mappings
            ORDER BY priority ASC, created_at ASC, id ASC
            """,
                (rs, rowNum) -> ServiceMapping.builder()
                        .id(rs.getLong("id"))
                        .servicePattern(rs.getString("service_pattern"))
                        .severityFilter(json.read(rs.getString("severity_filter"), STRING_LIST))
                        .escalationPolicyId(rs.getLong("escalation_policy_id"))
                        .priority(rs.getInt("priority"))
                        .createdAt(getInstant(rs, "created_at"))
                        .build());
    }
}
