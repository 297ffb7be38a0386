package com.company.alerting.service;

import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.event.IncidentCreatedEvent;
import com.company.alerting.event.IncidentResolvedEvent;
import com.company.alerting.event.IncidentSeverityChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Reacts to committed incident changes off the ingestion thread.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IncidentNotificationHandler {

    private final EscalationService escalationService;
    private final NotificationDispatcher dispatcher;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onIncidentCreated(IncidentCreatedEvent event) {
        Long incidentId = event.getIncident().getId();
        try {
            escalationService.start(incidentId);
        } catch (RuntimeException e) {
            log.error("Failed to start escalation for incident {}", incidentId, e);
        }
        notify(event.getIncident(), NotificationEventType.INCIDENT_CREATED);
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onSeverityChanged(IncidentSeverityChangedEvent event) {
        notify(event.getIncident(), NotificationEventType.SEVERITY_CHANGED);
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onIncidentResolved(IncidentResolvedEvent event) {
        log.debug("Incident {} resolved ({})", event.getIncident().getId(),
                event.isAutomatic() ? "automatic" : "manual");
        notify(event.getIncident(), NotificationEventType.INCIDENT_RESOLVED);
    }

    private void notify(Incident incident, NotificationEventType eventType) {
        try {
            dispatcher.dispatch(incident, eventType);
        } catch (RuntimeException e) {
            log.error("Failed to dispatch {} notifications for incident {}", eventType.value(), incident.getId(), e);
        }
    }
}
