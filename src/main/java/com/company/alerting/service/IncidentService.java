package com.company.alerting.service;

import com.company.alerting.domain.Incident;
import com.company.alerting.domain.IncidentEvent;
import com.company.alerting.domain.enums.IncidentEventType;
import com.company.alerting.domain.enums.IncidentStatus;
import com.company.alerting.event.IncidentResolvedEvent;
import com.company.alerting.exception.IncidentNotFoundException;
import com.company.alerting.repository.AlertRepository;
import com.company.alerting.repository.IncidentEventRepository;
import com.company.alerting.repository.IncidentRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Responder actions on incidents. Both actions are idempotent.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IncidentService {

    private final IncidentRepository incidentRepository;
    private final AlertRepository alertRepository;
    private final IncidentEventRepository eventRepository;
    private final EscalationService escalationService;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Incident getIncident(Long incidentId) {
        Incident incident = incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
        incident.setAlerts(alertRepository.findByIncidentId(incidentId));
        return incident;
    }

    @Transactional(readOnly = true)
    public List<IncidentEvent> getTimeline(Long incidentId) {
        return eventRepository.findByIncidentId(incidentId);
    }

    /**
     * Open incident becomes acknowledged, its firing alerts follow, escalation stops.
     */
    @Transactional
    public Incident acknowledge(Long incidentId, String actor) {
        Incident incident = incidentRepository.findByIdForUpdate(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));

        if (incident.getStatus() != IncidentStatus.OPEN) {
            log.debug("Incident {} is {}, acknowledge ignored", incidentId, incident.getStatus().value());
            return incident;
        }

        Instant now = clock.instant();
        incidentRepository.markAcknowledged(incidentId, now);
        int alerts = alertRepository.acknowledgeFiringByIncident(incidentId, now);
        appendEvent(incidentId, IncidentEventType.ACKNOWLEDGED, "Incident acknowledged", actor, now);
        escalationService.acknowledge(incidentId);

        incident.setStatus(IncidentStatus.ACKNOWLEDGED);
        incident.setAcknowledgedAt(now);

        meterRegistry.counter("incidents.acknowledged").increment();
        log.info("Incident {} acknowledged by {} ({} alerts)", incidentId, actorOrSystem(actor), alerts);
        return incident;
    }

    /**
     * Resolves the incident and its active alerts, cancels escalation and notifies.
     */
    @Transactional
    public Incident resolve(Long incidentId, String actor) {
        Incident incident = incidentRepository.findByIdForUpdate(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));

        if (incident.getStatus() == IncidentStatus.RESOLVED) {
            log.debug("Incident {} already resolved", incidentId);
            return incident;
        }

        Instant now = clock.instant();
        incidentRepository.markResolved(incidentId, now);
        int alerts = alertRepository.resolveActiveByIncident(incidentId, now);
        appendEvent(incidentId, IncidentEventType.RESOLVED, "Incident resolved", actor, now);
        escalationService.cancel(incidentId);

        incident.setStatus(IncidentStatus.RESOLVED);
        incident.setResolvedAt(now);
        eventPublisher.publishEvent(new IncidentResolvedEvent(incident, false));

        meterRegistry.counter("incidents.resolved").increment();
        log.info("Incident {} resolved by {} ({} alerts)", incidentId, actorOrSystem(actor), alerts);
        return incident;
    }

    private void appendEvent(Long incidentId, IncidentEventType type, String description, String actor, Instant now) {
        eventRepository.append(IncidentEvent.builder()
                .incidentId(incidentId)
                .eventType(type)
                .description(description)
                .actor(actorOrSystem(actor))
                .createdAt(now)
                .build());
    }

    private static String actorOrSystem(String actor) {
        return actor == null || actor.isBlank() ? IncidentEvent.SYSTEM_ACTOR : actor;
    }
}
