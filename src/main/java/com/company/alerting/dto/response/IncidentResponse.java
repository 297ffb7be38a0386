package com.company.alerting.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentResponse {
    private Long id;
    private String title;
    private String summary;
    private String service;
    private String status;
    private String severity;
    private Instant startedAt;
    private Instant lastAlertAt;
    private Instant acknowledgedAt;
    private Instant resolvedAt;
    private String duration;
    private List<AlertResponse> alerts;
    private List<TimelineEntry> timeline;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimelineEntry {
        private String eventType;
        private String description;
        private String actor;
        private Instant createdAt;
    }
}
