package com.company.alerting.cache;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.repository.NotificationLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationCooldownCacheTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOps;

    @Mock
    private NotificationLogRepository logRepository;

    private NotificationCooldownCache cache;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        cache = new NotificationCooldownCache(redisTemplate, logRepository, new AlertingProperties());
    }

    @Test
    void first_claim_sets_key_with_cooldown_ttl() {
        when(valueOps.setIfAbsent("notify_cooldown:7:42", NOW.toString(), Duration.ofSeconds(300))).thenReturn(true);

        assertThat(cache.tryAcquire(7L, 42L, NOW)).isTrue();
        verifyNoInteractions(logRepository);
    }

    @Test
    void existing_key_means_cooldown() {
        when(valueOps.setIfAbsent(eq("notify_cooldown:7:42"), any(), any(Duration.class))).thenReturn(false);

        assertThat(cache.tryAcquire(7L, 42L, NOW)).isFalse();
    }

    @Test
    void unreachable_cache_falls_back_to_notification_log() {
        when(valueOps.setIfAbsent(anyString(), any(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("connection refused"));
        when(logRepository.existsSince(7L, 42L, NOW.minusSeconds(300))).thenReturn(true);
        when(logRepository.existsSince(7L, 43L, NOW.minusSeconds(300))).thenReturn(false);

        assertThat(cache.tryAcquire(7L, 42L, NOW)).isFalse();
        assertThat(cache.tryAcquire(7L, 43L, NOW)).isTrue();
    }
}
