package com.company.alerting.domain;

import com.company.alerting.domain.enums.IncidentStatus;
import com.company.alerting.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Unit of response. Membership is held by {@code alerts.incident_id};
 * {@link #alerts} is only populated when explicitly loaded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String title;
    private String summary;
    private String service;
    private IncidentStatus status;
    private Severity severity;

    private Instant startedAt;
    private Instant lastAlertAt;
    private Instant acknowledgedAt;
    private Instant resolvedAt;
    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private List<Alert> alerts = new ArrayList<>();

    public boolean isOpen() {
        return status == IncidentStatus.OPEN;
    }

    /**
     * Services of the loaded member alerts, sorted.
     */
    public Set<String> memberServices() {
        Set<String> services = new TreeSet<>();
        if (alerts != null) {
            alerts.stream()
                    .map(Alert::getService)
                    .filter(Objects::nonNull)
                    .forEach(services::add);
        }
        return services;
    }
}
