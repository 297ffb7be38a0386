package com.company.alerting.event;

import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class IncidentSeverityChangedEvent {
    private final Incident incident;
    private final Severity previousSeverity;
}
