package com.company.alerting.domain.enums;

import java.util.Locale;

public enum RotationType {
    HOURLY,
    DAILY,
    WEEKLY,
    CUSTOM;

    public static RotationType fromString(String type) {
        if (type == null) {
            return WEEKLY;
        }
        try {
            return RotationType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return WEEKLY;
        }
    }
}
