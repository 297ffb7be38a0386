package com.company.alerting.service;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.IncidentEvent;
import com.company.alerting.domain.enums.IncidentEventType;
import com.company.alerting.domain.enums.IncidentStatus;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.event.IncidentCreatedEvent;
import com.company.alerting.event.IncidentResolvedEvent;
import com.company.alerting.event.IncidentSeverityChangedEvent;
import com.company.alerting.repository.AlertRepository;
import com.company.alerting.repository.IncidentEventRepository;
import com.company.alerting.repository.IncidentRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Groups related alerts of one service into a single incident.
 *
 * <p>Runs inside the ingest transaction while the caller holds the service lock, so
 * two concurrent first alerts of a service cannot both create an incident. Events
 * are published in the transaction and delivered to listeners after commit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CorrelationService {

    static final String TITLE_SEPARATOR = " — ";

    private final IncidentRepository incidentRepository;
    private final AlertRepository alertRepository;
    private final IncidentEventRepository eventRepository;
    private final EscalationService escalationService;
    private final ApplicationEventPublisher eventPublisher;
    private final AlertingProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Attaches the alert to the service's live incident or opens a new one.
     */
    public Incident correlate(Alert alert) {
        Instant now = clock.instant();

        if (alert.getService() != null) {
            Instant windowStart = now.minus(properties.getCorrelationWindow());
            Optional<Incident> candidate = incidentRepository.findCorrelationCandidate(alert.getService(), windowStart)
                    .flatMap(found -> incidentRepository.findByIdForUpdate(found.getId()))
                    .filter(locked -> locked.getStatus().isActive()
                            && !locked.getLastAlertAt().isBefore(windowStart));

            if (candidate.isPresent()) {
                return attach(candidate.get(), alert, now);
            }
        }

        return create(alert, now);
    }

    private Incident attach(Incident incident, Alert alert, Instant now) {
        alertRepository.assignIncident(alert.getId(), incident.getId(), now);
        alert.setIncidentId(incident.getId());
        incidentRepository.touchLastAlert(incident.getId(), now);
        if (now.isAfter(incident.getLastAlertAt())) {
            incident.setLastAlertAt(now);
        }
        if (alert.getStartsAt() != null && alert.getStartsAt().isBefore(incident.getStartedAt())
                && incidentRepository.extendStartedAt(incident.getId(), alert.getStartsAt(), now) == 1) {
            incident.setStartedAt(alert.getStartsAt());
        }

        appendEvent(incident.getId(), IncidentEventType.ALERT_ADDED,
                "Alert added: " + alert.getName(), now);

        Severity previous = incident.getSeverity();
        if (alert.getSeverity().isHigherThan(previous)) {
            incidentRepository.updateSeverity(incident.getId(), alert.getSeverity(), now);
            incident.setSeverity(alert.getSeverity());
            appendEvent(incident.getId(), IncidentEventType.SEVERITY_CHANGED,
                    "Severity changed from " + previous.value() + " to " + alert.getSeverity().value(), now);
            eventPublisher.publishEvent(new IncidentSeverityChangedEvent(incident, previous));
            log.warn("Incident {} severity raised {} -> {}", incident.getId(), previous.value(), alert.getSeverity().value());
        }

        log.info("Alert {} attached to incident {}", alert.getId(), incident.getId());
        return incident;
    }

    private Incident create(Alert alert, Instant now) {
        Incident incident = Incident.builder()
                .title(title(alert))
                .summary(alert.getDescription())
                .service(alert.getService())
                .status(IncidentStatus.OPEN)
                .severity(alert.getSeverity())
                .startedAt(alert.getStartsAt() != null ? alert.getStartsAt() : now)
                .lastAlertAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();

        incidentRepository.insert(incident);
        alertRepository.assignIncident(alert.getId(), incident.getId(), now);
        alert.setIncidentId(incident.getId());

        appendEvent(incident.getId(), IncidentEventType.CREATED,
                "Incident created from alert: " + alert.getName(), now);
        escalationService.arm(incident, now);
        eventPublisher.publishEvent(new IncidentCreatedEvent(incident, alert));

        meterRegistry.counter("incidents.created", "severity", incident.getSeverity().value()).increment();
        log.warn("Incident {} opened: {} [{}]", incident.getId(), incident.getTitle(), incident.getSeverity().value());
        return incident;
    }

    /**
     * A duplicate landed on a member alert; keeps the incident inside its correlation window.
     */
    public void onMemberActivity(Alert alert) {
        if (alert.getIncidentId() != null) {
            incidentRepository.touchLastAlert(alert.getIncidentId(), clock.instant());
        }
    }

    /**
     * Resolves the alert's incident once every member alert is resolved.
     * A resolved incident stays resolved.
     *
     * @return true if the incident was auto-resolved by this call
     */
    public boolean onAlertResolved(Alert alert) {
        if (alert.getIncidentId() == null) {
            return false;
        }

        Optional<Incident> locked = incidentRepository.findByIdForUpdate(alert.getIncidentId());
        if (locked.isEmpty() || locked.get().getStatus() == IncidentStatus.RESOLVED) {
            return false;
        }

        int unresolved = alertRepository.countUnresolvedByIncident(alert.getIncidentId());
        if (unresolved > 0) {
            log.debug("Incident {} still has {} unresolved alerts", alert.getIncidentId(), unresolved);
            return false;
        }

        Instant now = clock.instant();
        Incident incident = locked.get();
        incidentRepository.markResolved(incident.getId(), now);
        incident.setStatus(IncidentStatus.RESOLVED);
        incident.setResolvedAt(now);

        appendEvent(incident.getId(), IncidentEventType.AUTO_RESOLVED,
                "All alerts resolved", now);
        escalationService.cancel(incident.getId());
        eventPublisher.publishEvent(new IncidentResolvedEvent(incident, true));

        meterRegistry.counter("incidents.auto_resolved").increment();
        log.info("Incident {} auto-resolved", incident.getId());
        return true;
    }

    static String title(Alert alert) {
        String title = alert.getService() != null
                ? alert.getService() + TITLE_SEPARATOR + alert.getName()
                : alert.getName();
        return DeduplicationService.clip(title, DeduplicationService.NAME_MAX);
    }

    private void appendEvent(Long incidentId, IncidentEventType type, String description, Instant now) {
        eventRepository.append(IncidentEvent.builder()
                .incidentId(incidentId)
                .eventType(type)
                .description(description)
                .actor(IncidentEvent.SYSTEM_ACTOR)
                .createdAt(now)
                .build());
    }
}
