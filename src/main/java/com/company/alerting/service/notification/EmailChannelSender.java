package com.company.alerting.service.notification;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.exception.NotificationDeliveryException;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Plain-text email. Config: {@code recipients} (list or comma separated).
 * Needs {@code spring.mail.host}; without it every delivery fails.
 */
@Component
@RequiredArgsConstructor
public class EmailChannelSender implements ChannelSender {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final NotificationMessageFormatter formatter;
    private final AlertingProperties properties;

    @Override
    public ChannelType type() {
        return ChannelType.EMAIL;
    }

    @Override
    public void send(Incident incident, List<Alert> alerts, Map<String, Object> config, NotificationEventType eventType) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new NotificationDeliveryException("Mail is not configured (spring.mail.host)");
        }

        String[] recipients = recipients(config);
        if (recipients.length == 0) {
            throw new NotificationDeliveryException("Channel config is missing 'recipients'");
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(properties.getDelivery().getMailFrom());
        message.setTo(recipients);
        message.setSubject(formatter.title(incident, eventType));
        message.setText(formatter.text(incident, alerts, eventType));

        try {
            sender.send(message);
        } catch (MailException e) {
            throw new NotificationDeliveryException("Mail delivery failed: " + e.getMessage(), e);
        }
    }

    static String[] recipients(Map<String, Object> config) {
        Object raw = config != null ? config.get("recipients") : null;
        if (raw instanceof Collection) {
            return ((Collection<?>) raw).stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toArray(String[]::new);
        }
        if (raw != null) {
            return Arrays.stream(raw.toString().split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toArray(String[]::new);
        }
        return new String[0];
    }
}
