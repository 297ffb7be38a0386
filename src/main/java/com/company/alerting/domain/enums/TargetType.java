package com.company.alerting.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TargetType {
    USER,
    SCHEDULE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TargetType fromString(String type) {
        return TargetType.valueOf(type.trim().toUpperCase(Locale.ROOT));
    }
}
