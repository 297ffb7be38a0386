package com.company.alerting.domain.enums;

import java.util.Locale;

public enum AlertStatus {
    FIRING("Alert is actively firing"),
    ACKNOWLEDGED("A responder has acknowledged the alert"),
    RESOLVED("The underlying problem is resolved"),
    SUPPRESSED("Alert matched an active silence window"),
    ARCHIVED("Alert was archived and no longer deduplicates");

    private final String description;

    AlertStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFinal() {
        return this == RESOLVED || this == ARCHIVED;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertStatus fromString(String status) {
        if (status == null) {
            return FIRING;
        }
        try {
            return AlertStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FIRING;
        }
    }
}
