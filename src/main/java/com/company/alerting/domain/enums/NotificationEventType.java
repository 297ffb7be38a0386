package com.company.alerting.domain.enums;

import java.util.Locale;

public enum NotificationEventType {
    INCIDENT_CREATED("New Incident"),
    SEVERITY_CHANGED("Severity Escalated"),
    INCIDENT_RESOLVED("Incident Resolved");

    private final String label;

    NotificationEventType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
