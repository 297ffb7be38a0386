package com.company.alerting.service.notification;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Channel-neutral wording of incident notifications.
 */
@Component
@RequiredArgsConstructor
public class NotificationMessageFormatter {

    private static final int MAX_LISTED_ALERTS = 10;

    private final AlertingProperties properties;

    public String title(Incident incident, NotificationEventType eventType) {
        return "[" + severityLabel(incident) + "] " + eventType.getLabel() + ": " + incident.getTitle();
    }

    public String incidentUrl(Incident incident) {
        String base = properties.getDashboardUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/incidents/" + incident.getId();
    }

    public String text(Incident incident, List<Alert> alerts, NotificationEventType eventType) {
        StringBuilder sb = new StringBuilder();
        sb.append(title(incident, eventType)).append('\n');
        sb.append("Status: ").append(incident.getStatus().value());
        if (incident.getService() != null) {
            sb.append(" | Service: ").append(incident.getService());
        }
        sb.append(" | Alerts: ").append(alerts.size()).append('\n');

        if (eventType == NotificationEventType.INCIDENT_RESOLVED && incident.getStartedAt() != null) {
            Instant end = incident.getResolvedAt() != null ? incident.getResolvedAt() : Instant.now();
            sb.append("Duration: ")
                    .append(TimeUtils.formatDuration(Duration.between(incident.getStartedAt(), end)))
                    .append('\n');
        }

        if (incident.getSummary() != null && !incident.getSummary().isBlank()) {
            sb.append(incident.getSummary()).append('\n');
        }

        alerts.stream().limit(MAX_LISTED_ALERTS).forEach(alert ->
                sb.append("- ").append(alert.getName())
                        .append(" (").append(alert.getSeverity().value())
                        .append(", ").append(alert.getStatus().value()).append(")\n"));
        if (alerts.size() > MAX_LISTED_ALERTS) {
            sb.append("... and ").append(alerts.size() - MAX_LISTED_ALERTS).append(" more\n");
        }

        sb.append(incidentUrl(incident));
        return sb.toString();
    }

    public String color(Incident incident, NotificationEventType eventType) {
        if (eventType == NotificationEventType.INCIDENT_RESOLVED) {
            return "#2EB67D";
        }
        Severity severity = incident.getSeverity() != null ? incident.getSeverity() : Severity.WARNING;
        switch (severity) {
            case CRITICAL:
                return "#E01E5A";
            case HIGH:
                return "#F2711C";
            case WARNING:
                return "#ECB22E";
            default:
                return "#36C5F0";
        }
    }

    private static String severityLabel(Incident incident) {
        return incident.getSeverity() != null
                ? incident.getSeverity().name().toUpperCase(Locale.ROOT)
                : "UNKNOWN";
    }
}
