package com.company.alerting.domain;

import com.company.alerting.domain.enums.IncidentEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable audit entry appended on every incident-affecting transition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentEvent {
    public static final String SYSTEM_ACTOR = "system";

    private Long id;
    private Long incidentId;
    private IncidentEventType eventType;
    private String description;
    private String actor;
    private Instant createdAt;
}
