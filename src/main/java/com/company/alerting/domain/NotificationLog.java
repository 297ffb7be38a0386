package com.company.alerting.domain;

import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.domain.enums.NotificationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationLog {
    private Long id;
    private Long channelId;
    private Long incidentId;
    private NotificationEventType eventType;
    private NotificationStatus status;
    private String errorMessage;
    private Instant sentAt;
    private Instant createdAt;
}
