package com.company.alerting.domain.enums;

public enum NotificationStatus {
    PENDING("Delivery is about to be attempted"),
    SENT("Notification was delivered"),
    FAILED("Delivery failed");

    private final String description;

    NotificationStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFinal() {
        return this == SENT || this == FAILED;
    }
}
