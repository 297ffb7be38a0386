package com.company.alerting.service.notification;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.domain.enums.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PagerDutyChannelSenderTest {

    @Mock
    private WebhookClient webhookClient;

    private AlertingProperties properties;
    private PagerDutyChannelSender sender;

    @BeforeEach
    void setUp() {
        properties = new AlertingProperties();
        sender = new PagerDutyChannelSender(webhookClient, new NotificationMessageFormatter(properties), properties);
    }

    @Test
    @SuppressWarnings("unchecked")
    void creation_triggers_event_keyed_by_incident() {
        sender.send(WebhookChannelSenderTest.incident(), List.of(WebhookChannelSenderTest.alert()),
                Map.of("routing_key", "R0UT1NG"), NotificationEventType.INCIDENT_CREATED);

        ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
        verify(webhookClient).postJson(eq(properties.getDelivery().getPagerDutyEventsUrl()), body.capture(), anyMap());

        assertThat(body.getValue())
                .containsEntry("routing_key", "R0UT1NG")
                .containsEntry("dedup_key", "incident-42")
                .containsEntry("event_action", "trigger");
        Map<String, Object> payload = (Map<String, Object>) body.getValue().get("payload");
        assertThat(payload)
                .containsEntry("severity", "critical")
                .containsEntry("source", "payment-api")
                .containsEntry("summary", "[CRITICAL] New Incident: payment-api HighCPU");
    }

    @Test
    @SuppressWarnings("unchecked")
    void resolution_resolves_same_dedup_key() {
        sender.send(WebhookChannelSenderTest.incident(), List.of(),
                Map.of("routing_key", "R0UT1NG"), NotificationEventType.INCIDENT_RESOLVED);

        ArgumentCaptor<Map<String, Object>> body = ArgumentCaptor.forClass(Map.class);
        verify(webhookClient).postJson(eq(properties.getDelivery().getPagerDutyEventsUrl()), body.capture(), anyMap());

        assertThat(body.getValue())
                .containsEntry("dedup_key", "incident-42")
                .containsEntry("event_action", "resolve")
                .doesNotContainKey("payload");
    }

    @Test
    void severity_mapping() {
        assertThat(PagerDutyChannelSender.pagerDutySeverity(Severity.CRITICAL)).isEqualTo("critical");
        assertThat(PagerDutyChannelSender.pagerDutySeverity(Severity.HIGH)).isEqualTo("error");
        assertThat(PagerDutyChannelSender.pagerDutySeverity(Severity.WARNING)).isEqualTo("warning");
        assertThat(PagerDutyChannelSender.pagerDutySeverity(Severity.LOW)).isEqualTo("info");
        assertThat(PagerDutyChannelSender.pagerDutySeverity(null)).isEqualTo("warning");
    }
}
