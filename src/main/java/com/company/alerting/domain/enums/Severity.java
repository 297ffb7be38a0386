package com.company.alerting.domain.enums;

import java.util.Locale;

public enum Severity {
    INFO(1, "Informational - no action required"),
    LOW(2, "Low severity - minor issue"),
    WARNING(3, "Warning - requires attention"),
    HIGH(4, "High severity - urgent attention needed"),
    CRITICAL(5, "Critical severity - immediate action required");

    private final int level;
    private final String description;

    Severity(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    public boolean isHigherThan(Severity other) {
        return other == null || this.level > other.level;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return b.isHigherThan(a) ? b : a;
    }

    /**
     * Unknown or missing severities degrade to WARNING so the alert is never dropped.
     */
    public static Severity fromString(String severity) {
        if (severity == null || severity.isBlank()) {
            return WARNING;
        }
        try {
            return Severity.valueOf(severity.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return WARNING;
        }
    }
}
