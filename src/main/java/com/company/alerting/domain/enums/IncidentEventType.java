package com.company.alerting.domain.enums;

import java.util.Locale;

public enum IncidentEventType {
    CREATED,
    ALERT_ADDED,
    SEVERITY_CHANGED,
    ACKNOWLEDGED,
    RESOLVED,
    AUTO_RESOLVED,
    ESCALATED,
    ESCALATION_EXHAUSTED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IncidentEventType fromString(String type) {
        return IncidentEventType.valueOf(type.trim().toUpperCase(Locale.ROOT));
    }
}
