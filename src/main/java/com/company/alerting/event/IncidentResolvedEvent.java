package com.company.alerting.event;

import com.company.alerting.domain.Incident;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class IncidentResolvedEvent {
    private final Incident incident;
    /** True when the last member alert resolving closed the incident. */
    private final boolean automatic;
}
