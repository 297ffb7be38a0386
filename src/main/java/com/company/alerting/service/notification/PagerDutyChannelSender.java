package com.company.alerting.service.notification;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.domain.enums.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PagerDuty Events API v2. Config: {@code routing_key}. One dedup key per incident so
 * the resolve closes the page opened on creation.
 */
@Component
@RequiredArgsConstructor
public class PagerDutyChannelSender implements ChannelSender {

    private final WebhookClient webhookClient;
    private final NotificationMessageFormatter formatter;
    private final AlertingProperties properties;

    @Override
    public ChannelType type() {
        return ChannelType.PAGERDUTY;
    }

    @Override
    public void send(Incident incident, List<Alert> alerts, Map<String, Object> config, NotificationEventType eventType) {
        String routingKey = ChannelSender.requireString(config, "routing_key");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("routing_key", routingKey);
        body.put("dedup_key", dedupKey(incident));

        if (eventType == NotificationEventType.INCIDENT_RESOLVED) {
            body.put("event_action", "resolve");
        } else {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("summary", formatter.title(incident, eventType));
            payload.put("source", incident.getService() != null ? incident.getService() : "alert-correlation-service");
            payload.put("severity", pagerDutySeverity(incident.getSeverity()));
            payload.put("custom_details", Map.of(
                    "incident_id", incident.getId(),
                    "alert_count", alerts.size(),
                    "url", formatter.incidentUrl(incident)));

            body.put("event_action", "trigger");
            body.put("payload", payload);
        }

        webhookClient.postJson(properties.getDelivery().getPagerDutyEventsUrl(), body, Map.of());
    }

    static String dedupKey(Incident incident) {
        return "incident-" + incident.getId();
    }

    static String pagerDutySeverity(Severity severity) {
        if (severity == null) {
            return "warning";
        }
        switch (severity) {
            case CRITICAL:
                return "critical";
            case HIGH:
                return "error";
            case WARNING:
                return "warning";
            default:
                return "info";
        }
    }
}
