package com.company.alerting.service.notification;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.NotificationEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Microsoft Teams incoming webhook (MessageCard). Config: {@code webhook_url}.
 */
@Component
@RequiredArgsConstructor
public class TeamsChannelSender implements ChannelSender {

    private final WebhookClient webhookClient;
    private final NotificationMessageFormatter formatter;

    @Override
    public ChannelType type() {
        return ChannelType.TEAMS;
    }

    @Override
    public void send(Incident incident, List<Alert> alerts, Map<String, Object> config, NotificationEventType eventType) {
        String url = ChannelSender.requireString(config, "webhook_url");

        Map<String, Object> openDashboard = new LinkedHashMap<>();
        openDashboard.put("@type", "OpenUri");
        openDashboard.put("name", "Open incident");
        openDashboard.put("targets", List.of(Map.of("os", "default", "uri", formatter.incidentUrl(incident))));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("@type", "MessageCard");
        body.put("@context", "http://schema.org/extensions");
        body.put("themeColor", formatter.color(incident, eventType).substring(1));
        body.put("summary", formatter.title(incident, eventType));
        body.put("title", formatter.title(incident, eventType));
        body.put("text", formatter.text(incident, alerts, eventType).replace("\n", "<br>"));
        body.put("potentialAction", List.of(openDashboard));

        webhookClient.postJson(url, body, Map.of());
    }
}
