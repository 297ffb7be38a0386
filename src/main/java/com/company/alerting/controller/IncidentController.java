package com.company.alerting.controller;

import com.company.alerting.domain.Incident;
import com.company.alerting.domain.IncidentEvent;
import com.company.alerting.dto.request.IncidentActionRequest;
import com.company.alerting.dto.response.AlertResponse;
import com.company.alerting.dto.response.IncidentResponse;
import com.company.alerting.service.IncidentService;
import com.company.alerting.util.TimeUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Incident details and responder actions")
@RequiredArgsConstructor
@Slf4j
public class IncidentController {

    private final IncidentService incidentService;

    @GetMapping("/{incidentId}")
    @Operation(summary = "Get incident with member alerts and timeline")
    public ResponseEntity<IncidentResponse> getIncident(@PathVariable Long incidentId) {
        Incident incident = incidentService.getIncident(incidentId);
        return ResponseEntity.ok(toIncidentResponse(incident, incidentService.getTimeline(incidentId)));
    }

    @PostMapping("/{incidentId}/acknowledge")
    @Operation(summary = "Acknowledge an incident", description = "Stops escalation")
    public ResponseEntity<IncidentResponse> acknowledge(
            @PathVariable Long incidentId,
            @Valid @RequestBody(required = false) IncidentActionRequest request) {

        incidentService.acknowledge(incidentId, actor(request));
        return getIncident(incidentId);
    }

    @PostMapping("/{incidentId}/resolve")
    @Operation(summary = "Resolve an incident", description = "Resolves active member alerts and cancels escalation")
    public ResponseEntity<IncidentResponse> resolve(
            @PathVariable Long incidentId,
            @Valid @RequestBody(required = false) IncidentActionRequest request) {

        incidentService.resolve(incidentId, actor(request));
        return getIncident(incidentId);
    }

    private static String actor(IncidentActionRequest request) {
        return request != null ? request.getActor() : null;
    }

    private IncidentResponse toIncidentResponse(Incident incident, List<IncidentEvent> events) {
        Instant end = incident.getResolvedAt() != null ? incident.getResolvedAt() : Instant.now();
        return IncidentResponse.builder()
                .id(incident.getId())
                .title(incident.getTitle())
                .summary(incident.getSummary())
                .service(incident.getService())
                .status(incident.getStatus().value())
                .severity(incident.getSeverity().value())
                .startedAt(incident.getStartedAt())
                .lastAlertAt(incident.getLastAlertAt())
                .acknowledgedAt(incident.getAcknowledgedAt())
                .resolvedAt(incident.getResolvedAt())
                .duration(TimeUtils.formatDuration(Duration.between(incident.getStartedAt(), end)))
                .alerts(incident.getAlerts().stream().map(AlertResponse::from).toList())
                .timeline(events.stream()
                        .map(e -> IncidentResponse.TimelineEntry.builder()
                                .eventType(e.getEventType().value())
                                .description(e.getDescription())
                                .actor(e.getActor())
                                .createdAt(e.getCreatedAt())
                                .build())
                        .toList())
                .build();
    }
}
