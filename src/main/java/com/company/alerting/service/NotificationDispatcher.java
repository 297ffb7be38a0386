package com.company.alerting.service;

import com.company.alerting.cache.NotificationCooldownCache;
import com.company.alerting.config.AlertingProperties;
import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.NotificationChannel;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.repository.AlertRepository;
import com.company.alerting.repository.NotificationChannelRepository;
import com.company.alerting.repository.NotificationLogRepository;
import com.company.alerting.service.notification.ChannelSender;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fans an incident event out to every matching channel.
 *
 * <p>Each channel is handled on its own: a failing or slow channel never stops the
 * others, and nothing is thrown to the caller. Every attempt is logged in
 * notification_logs (pending, then sent or failed).
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final NotificationChannelRepository channelRepository;
    private final NotificationLogRepository logRepository;
    private final AlertRepository alertRepository;
    private final NotificationCooldownCache cooldownCache;
    private final Map<ChannelType, ChannelSender> senders = new EnumMap<>(ChannelType.class);
    private final AlertingProperties properties;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public NotificationDispatcher(NotificationChannelRepository channelRepository,
                                  NotificationLogRepository logRepository,
                                  AlertRepository alertRepository,
                                  NotificationCooldownCache cooldownCache,
                                  List<ChannelSender> channelSenders,
                                  AlertingProperties properties,
                                  CircuitBreakerRegistry circuitBreakerRegistry,
                                  Tracer tracer,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.channelRepository = channelRepository;
        this.logRepository = logRepository;
        this.alertRepository = alertRepository;
        this.cooldownCache = cooldownCache;
        this.properties = properties;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        channelSenders.forEach(sender -> senders.put(sender.type(), sender));
    }

    /**
     * @return number of channels a delivery was attempted on
     */
    public int dispatch(Incident incident, NotificationEventType eventType) {
        List<Alert> alerts = alertRepository.findByIncidentId(incident.getId());
        Set<String> services = new TreeSet<>();
        if (incident.getService() != null) {
            services.add(incident.getService());
        }
        alerts.stream().map(Alert::getService).filter(s -> s != null).forEach(services::add);

        int attempted = 0;
        for (NotificationChannel channel : channelRepository.findActive()) {
            if (!matchesFilters(channel, incident, services)) {
                continue;
            }
            try {
                if (deliver(channel, incident, alerts, eventType)) {
                    attempted++;
                }
            } catch (RuntimeException e) {
                log.error("Notification to channel {} for incident {} failed unexpectedly",
                        channel.getId(), incident.getId(), e);
            }
        }
        return attempted;
    }

    static boolean matchesFilters(NotificationChannel channel, Incident incident, Set<String> services) {
        NotificationChannel.Filters filters = channel.getFilters();
        if (filters == null) {
            return true;
        }
        if (filters.getSeverity() != null && !filters.getSeverity().isEmpty()
                && !filters.getSeverity().contains(incident.getSeverity().value())) {
            return false;
        }
        if (filters.getService() != null && !filters.getService().isEmpty()
                && filters.getService().stream().noneMatch(services::contains)) {
            return false;
        }
        return true;
    }

    private boolean deliver(NotificationChannel channel, Incident incident, List<Alert> alerts,
                            NotificationEventType eventType) {
        Instant now = clock.instant();
        if (!cooldownCache.tryAcquire(channel.getId(), incident.getId(), now)) {
            log.debug("Channel {} in cooldown for incident {}", channel.getId(), incident.getId());
            meterRegistry.counter("notifications.cooldown_skipped").increment();
            return false;
        }

        Long logId = logRepository.insertPending(channel.getId(), incident.getId(), eventType, now);
        ChannelSender sender = senders.get(channel.getChannelType());
        if (sender == null) {
            fail(logId, channel, incident, "No sender for channel type " + channel.getChannelType());
            return true;
        }

        Span span = tracer.spanBuilder("notification.deliver")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("channel.id", channel.getId());
            span.setAttribute("channel.type", channel.getChannelType().name());
            span.setAttribute("incident.id", incident.getId());
            span.setAttribute("event.type", eventType.value());

            breakerFor(channel).executeRunnable(
                    () -> sender.send(incident, alerts, channel.getConfig(), eventType));

            logRepository.markSent(logId, clock.instant());
            meterRegistry.counter("notifications.sent", "channel_type", channel.getChannelType().name()).increment();
            log.info("Notified channel {} ({}) of {} for incident {}",
                    channel.getId(), channel.getChannelType(), eventType.value(), incident.getId());
        } catch (CallNotPermittedException e) {
            span.setStatus(StatusCode.ERROR, "circuit open");
            fail(logId, channel, incident, "Circuit open for channel " + channel.getId());
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "delivery failed");
            fail(logId, channel, incident, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            span.end();
        }
        return true;
    }

    private void fail(Long logId, NotificationChannel channel, Incident incident, String error) {
        logRepository.markFailed(logId, truncate(error));
        meterRegistry.counter("notifications.failed", "channel_type", channel.getChannelType().name()).increment();
        log.warn("Notification to channel {} for incident {} failed: {}", channel.getId(), incident.getId(), error);
    }

    private String truncate(String error) {
        int max = properties.getDelivery().getMaxErrorLength();
        return error.length() > max ? error.substring(0, max) : error;
    }

    // Named per channel, configured from resilience4j.circuitbreaker.configs.default
    private CircuitBreaker breakerFor(NotificationChannel channel) {
        return circuitBreakerRegistry.circuitBreaker("channel-" + channel.getId());
    }
}
