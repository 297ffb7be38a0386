package com.company.alerting.dto.response;

import com.company.alerting.domain.Alert;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {
    private Long id;
    private String fingerprint;
    private String name;
    private String source;
    private String service;
    private String host;
    private String status;
    private String severity;
    private Map<String, String> labels;
    private Integer duplicateCount;
    private Long incidentId;
    private Instant startsAt;
    private Instant lastReceivedAt;
    private Instant acknowledgedAt;
    private Instant resolvedAt;

    public static AlertResponse from(Alert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .fingerprint(alert.getFingerprint())
                .name(alert.getName())
                .source(alert.getSource())
                .service(alert.getService())
                .host(alert.getHost())
                .status(alert.getStatus().value())
                .severity(alert.getSeverity().value())
                .labels(alert.getLabels())
                .duplicateCount(alert.getDuplicateCount())
                .incidentId(alert.getIncidentId())
                .startsAt(alert.getStartsAt())
                .lastReceivedAt(alert.getLastReceivedAt())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .resolvedAt(alert.getResolvedAt())
                .build();
    }
}
