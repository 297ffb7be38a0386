package com.company.alerting.service;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.IncidentEvent;
import com.company.alerting.domain.enums.AlertStatus;
import com.company.alerting.domain.enums.IncidentEventType;
import com.company.alerting.domain.enums.IncidentStatus;
import com.company.alerting.event.IncidentResolvedEvent;
import com.company.alerting.exception.IncidentNotFoundException;
import com.company.alerting.support.AlertRequests;
import com.company.alerting.support.AlertingTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IncidentServiceTest {

    private AlertingTestContext ctx;
    private IncidentService incidents;
    private Long incidentId;

    @BeforeEach
    void setUp() {
        ctx = new AlertingTestContext();
        incidents = ctx.incidentService;
        incidentId = ctx.ingestionService.ingest(AlertRequests.firing("payment-api", "HighCPU", "high")).getIncidentId();
        ctx.ingestionService.ingest(AlertRequests.firing("payment-api", "HighLatency", "warning"));
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void get_incident_loads_member_alerts() {
        Incident incident = incidents.getIncident(incidentId);

        assertThat(incident.getAlerts()).extracting(Alert::getName).containsExactlyInAnyOrder("HighCPU", "HighLatency");
        assertThat(incident.memberServices()).containsExactly("payment-api");
    }

    @Test
    void acknowledge_moves_open_incident_and_firing_alerts() {
        ctx.clock.advance(Duration.ofMinutes(2));

        Incident acked = incidents.acknowledge(incidentId, "alice");

        assertThat(acked.getStatus()).isEqualTo(IncidentStatus.ACKNOWLEDGED);
        assertThat(acked.getAcknowledgedAt()).isEqualTo(AlertingTestContext.T0.plus(Duration.ofMinutes(2)));
        assertThat(ctx.alertRepository.findByIncidentId(incidentId))
                .extracting(Alert::getStatus)
                .containsOnly(AlertStatus.ACKNOWLEDGED);
        assertThat(incidents.getTimeline(incidentId))
                .filteredOn(e -> e.getEventType() == IncidentEventType.ACKNOWLEDGED)
                .singleElement()
                .extracting(IncidentEvent::getActor)
                .isEqualTo("alice");
    }

    @Test
    void acknowledge_twice_records_one_event() {
        incidents.acknowledge(incidentId, "alice");
        incidents.acknowledge(incidentId, "bob");

        assertThat(incidents.getTimeline(incidentId))
                .filteredOn(e -> e.getEventType() == IncidentEventType.ACKNOWLEDGED)
                .hasSize(1);
    }

    @Test
    void resolve_closes_incident_and_alerts_and_publishes_manual_resolution() {
        Incident resolved = incidents.resolve(incidentId, null);

        assertThat(resolved.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(ctx.alertRepository.findByIncidentId(incidentId))
                .extracting(Alert::getStatus)
                .containsOnly(AlertStatus.RESOLVED);
        assertThat(incidents.getTimeline(incidentId))
                .filteredOn(e -> e.getEventType() == IncidentEventType.RESOLVED)
                .singleElement()
                .extracting(IncidentEvent::getActor)
                .isEqualTo(IncidentEvent.SYSTEM_ACTOR);
        assertThat(ctx.published(IncidentResolvedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.isAutomatic()).isFalse());
    }

    @Test
    void resolve_is_idempotent() {
        incidents.resolve(incidentId, "alice");
        incidents.resolve(incidentId, "alice");

        assertThat(ctx.published(IncidentResolvedEvent.class)).hasSize(1);
    }

    @Test
    void unknown_incident_is_rejected() {
        assertThatThrownBy(() -> incidents.getIncident(404L)).isInstanceOf(IncidentNotFoundException.class);
        assertThatThrownBy(() -> incidents.acknowledge(404L, "alice")).isInstanceOf(IncidentNotFoundException.class);
        assertThatThrownBy(() -> incidents.resolve(404L, "alice")).isInstanceOf(IncidentNotFoundException.class);
    }
}
