package com.company.alerting.support;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.exception.NotificationDeliveryException;
import com.company.alerting.service.notification.ChannelSender;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Channel sender that records deliveries, or fails every call when built with an error.
 */
public class RecordingSender implements ChannelSender {

    private final ChannelType type;
    private final String failure;
    private final List<String> deliveries = new CopyOnWriteArrayList<>();

    public RecordingSender(ChannelType type) {
        this(type, null);
    }

    public RecordingSender(ChannelType type, String failure) {
        this.type = type;
        this.failure = failure;
    }

    @Override
    public ChannelType type() {
        return type;
    }

    @Override
    public void send(Incident incident, List<Alert> alerts, Map<String, Object> config, NotificationEventType eventType) {
        if (failure != null) {
            throw new NotificationDeliveryException(failure);
        }
        deliveries.add(incident.getId() + ":" + eventType.value() + ":" + alerts.size());
    }

    public List<String> deliveries() {
        return List.copyOf(deliveries);
    }
}
