package com.company.alerting.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Processing windows, cooldowns and delivery settings (bound from prefix {@code alerting}).
 *
 * YAML:
 * alerting:
 *   dedup-window: 300s
 *   correlation-window: 600s
 *   notification-cooldown: 300s
 *   escalation:
 *     scan-interval-ms: 15000
 *     batch-size: 100
 *     misfire-grace: 60s
 *   cache:
 *     policy-ttl: 5m
 *     mapping-ttl: 1m
 *   delivery:
 *     connect-timeout: 5s
 *     read-timeout: 10s
 */
@Data
@Validated
@ConfigurationProperties(prefix = "alerting")
public class AlertingProperties {

    /** Identical fingerprints received within this span merge into one alert. */
    private Duration dedupWindow = Duration.ofSeconds(300);

    /** Same-service alerts within this span of the last member activity join one incident. */
    private Duration correlationWindow = Duration.ofSeconds(600);

    /** Minimum spacing between notifications to one channel for one incident. */
    private Duration notificationCooldown = Duration.ofSeconds(300);

    private String dashboardUrl = "http://localhost:3000";

    private Escalation escalation = new Escalation();

    private Delivery delivery = new Delivery();

    private Cache cache = new Cache();

    @Data
    public static class Escalation {
        private boolean enabled = true;
        private long scanIntervalMs = 15000;
        private int batchSize = 100;
        /** A timer fired later than this after its due time restarts level spacing from the fire time. */
        private Duration misfireGrace = Duration.ofSeconds(60);
    }

    /** Lifetime of cached reference data; edits show up after at most this long. */
    @Data
    public static class Cache {
        private Duration policyTtl = Duration.ofMinutes(5);
        private Duration mappingTtl = Duration.ofMinutes(1);
    }

    @Data
    public static class Delivery {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
        private String pagerDutyEventsUrl = "https://events.pagerduty.com/v2/enqueue";
        private String mailFrom = "alerts@localhost";
        private int maxErrorLength = 500;
    }
}
