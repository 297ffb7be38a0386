package com.company.alerting.domain.enums;

import java.util.Locale;

public enum IncidentStatus {
    OPEN,
    ACKNOWLEDGED,
    RESOLVED;

    /**
     * Open and acknowledged incidents still accept new alerts.
     */
    public boolean isActive() {
        return this != RESOLVED;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IncidentStatus fromString(String status) {
        return IncidentStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
    }
}
