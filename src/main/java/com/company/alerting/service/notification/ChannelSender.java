package com.company.alerting.service.notification;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.exception.NotificationDeliveryException;

import java.util.List;
import java.util.Map;

/**
 * Delivers one incident notification to one kind of channel.
 * Any failure is reported as an exception; returning normally means delivered.
 */
public interface ChannelSender {

    ChannelType type();

    void send(Incident incident, List<Alert> alerts, Map<String, Object> config, NotificationEventType eventType);

    static String requireString(Map<String, Object> config, String key) {
        Object value = config != null ? config.get(key) : null;
        if (value == null || value.toString().isBlank()) {
            throw new NotificationDeliveryException("Channel config is missing '" + key + "'");
        }
        return value.toString();
    }
}
