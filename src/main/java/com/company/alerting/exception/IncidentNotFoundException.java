package com.company.alerting.exception;

public class IncidentNotFoundException extends RuntimeException {
    public IncidentNotFoundException(Long incidentId) {
        super("Incident not found: " + incidentId);
    }
}
