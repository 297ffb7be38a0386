package com.company.alerting.service.notification;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.NotificationEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic JSON webhook. Config: {@code url}, optional {@code headers} map and
 * {@code secret} (sent as {@value #SECRET_HEADER}).
 */
@Component
@RequiredArgsConstructor
public class WebhookChannelSender implements ChannelSender {

    static final String SECRET_HEADER = "X-Alert-Secret";

    private final WebhookClient webhookClient;
    private final NotificationMessageFormatter formatter;

    @Override
    public ChannelType type() {
        return ChannelType.WEBHOOK;
    }

    @Override
    public void send(Incident incident, List<Alert> alerts, Map<String, Object> config, NotificationEventType eventType) {
        String url = ChannelSender.requireString(config, "url");
        webhookClient.postJson(url, payload(incident, alerts, eventType), headers(config));
    }

    Map<String, Object> payload(Incident incident, List<Alert> alerts, NotificationEventType eventType) {
        Map<String, Object> incidentBody = new LinkedHashMap<>();
        incidentBody.put("id", incident.getId());
        incidentBody.put("title", incident.getTitle());
        incidentBody.put("service", incident.getService());
        incidentBody.put("status", incident.getStatus().value());
        incidentBody.put("severity", incident.getSeverity().value());
        incidentBody.put("started_at", String.valueOf(incident.getStartedAt()));
        incidentBody.put("url", formatter.incidentUrl(incident));

        List<Map<String, Object>> alertBodies = new ArrayList<>();
        for (Alert alert : alerts) {
            Map<String, Object> a = new LinkedHashMap<>();
            a.put("id", alert.getId());
            a.put("name", alert.getName());
            a.put("fingerprint", alert.getFingerprint());
            a.put("service", alert.getService());
            a.put("severity", alert.getSeverity().value());
            a.put("status", alert.getStatus().value());
            a.put("labels", alert.getLabels() != null ? alert.getLabels() : Map.of());
            alertBodies.add(a);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event_type", eventType.value());
        body.put("incident", incidentBody);
        body.put("alerts", alertBodies);
        return body;
    }

    @SuppressWarnings("unchecked")
    Map<String, String> headers(Map<String, Object> config) {
        Map<String, String> headers = new HashMap<>();
        Object custom = config.get("headers");
        if (custom instanceof Map) {
            ((Map<String, Object>) custom).forEach((k, v) -> {
                if (v != null) {
                    headers.put(k, v.toString());
                }
            });
        }
        Object secret = config.get("secret");
        if (secret != null && !secret.toString().isBlank()) {
            headers.put(SECRET_HEADER, secret.toString());
        }
        return headers;
    }
}
