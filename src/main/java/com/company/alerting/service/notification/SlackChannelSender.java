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
 * Slack incoming webhook. Config: {@code webhook_url}, optional {@code channel}.
 */
@Component
@RequiredArgsConstructor
public class SlackChannelSender implements ChannelSender {

    private final WebhookClient webhookClient;
    private final NotificationMessageFormatter formatter;

    @Override
    public ChannelType type() {
        return ChannelType.SLACK;
    }

    @Override
    public void send(Incident incident, List<Alert> alerts, Map<String, Object> config, NotificationEventType eventType) {
        String url = ChannelSender.requireString(config, "webhook_url");

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", formatter.color(incident, eventType));
        attachment.put("title", formatter.title(incident, eventType));
        attachment.put("title_link", formatter.incidentUrl(incident));
        attachment.put("text", formatter.text(incident, alerts, eventType));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", formatter.title(incident, eventType));
        body.put("attachments", List.of(attachment));
        if (config.get("channel") != null) {
            body.put("channel", config.get("channel").toString());
        }

        webhookClient.postJson(url, body, Map.of());
    }
}
