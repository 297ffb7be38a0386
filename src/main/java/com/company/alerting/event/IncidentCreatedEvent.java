package com.company.alerting.event;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class IncidentCreatedEvent {
    private final Incident incident;
    private final Alert triggeringAlert;
}
