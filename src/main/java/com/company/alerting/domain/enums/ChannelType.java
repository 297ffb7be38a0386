package com.company.alerting.domain.enums;

import java.util.Locale;

public enum ChannelType {
    SLACK,
    TEAMS,
    EMAIL,
    WEBHOOK,
    PAGERDUTY;

    public static ChannelType fromString(String type) {
        return ChannelType.valueOf(type.trim().toUpperCase(Locale.ROOT));
    }
}
