package com.company.alerting.cache;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.repository.NotificationLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Per (channel, incident) notification cooldown held as a Redis key with TTL.
 * When Redis is unreachable the notification log table answers instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationCooldownCache {

    private static final String KEY_PREFIX = "notify_cooldown:";

    private final RedisTemplate<String, Object> redisTemplate;
    private final NotificationLogRepository logRepository;
    private final AlertingProperties properties;

    /**
     * Claims the cooldown slot. Returns false if a notification for this pair went out
     * within the cooldown; otherwise starts a new cooldown and returns true.
     */
    public boolean tryAcquire(Long channelId, Long incidentId, Instant now) {
        String key = KEY_PREFIX + channelId + ":" + incidentId;
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(
                    key, now.toString(), properties.getNotificationCooldown());
            return Boolean.TRUE.equals(acquired);
        } catch (DataAccessException e) {
            log.warn("Cooldown cache unavailable ({}), checking notification log", e.getMessage());
            return !logRepository.existsSince(channelId, incidentId, now.minus(properties.getNotificationCooldown()));
        }
    }
}
