package com.company.alerting.service;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.event.IncidentCreatedEvent;
import com.company.alerting.event.IncidentResolvedEvent;
import com.company.alerting.event.IncidentSeverityChangedEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IncidentNotificationHandlerTest {

    @Mock
    private EscalationService escalationService;

    @Mock
    private NotificationDispatcher dispatcher;

    @InjectMocks
    private IncidentNotificationHandler handler;

    private final Incident incident = Incident.builder().id(3L).severity(Severity.HIGH).build();

    @Test
    void creation_starts_escalation_and_notifies() {
        handler.onIncidentCreated(new IncidentCreatedEvent(incident, new Alert()));

        verify(escalationService).start(3L);
        verify(dispatcher).dispatch(incident, NotificationEventType.INCIDENT_CREATED);
    }

    @Test
    void escalation_failure_still_notifies() {
        when(escalationService.start(3L)).thenThrow(new IllegalStateException("no db"));

        handler.onIncidentCreated(new IncidentCreatedEvent(incident, new Alert()));

        verify(dispatcher).dispatch(incident, NotificationEventType.INCIDENT_CREATED);
    }

    @Test
    void severity_change_and_resolution_notify() {
        handler.onSeverityChanged(new IncidentSeverityChangedEvent(incident, Severity.WARNING));
        handler.onIncidentResolved(new IncidentResolvedEvent(incident, true));

        verify(dispatcher).dispatch(incident, NotificationEventType.SEVERITY_CHANGED);
        verify(dispatcher).dispatch(incident, NotificationEventType.INCIDENT_RESOLVED);
    }

    @Test
    void dispatch_failure_is_contained() {
        when(dispatcher.dispatch(incident, NotificationEventType.INCIDENT_RESOLVED))
                .thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> handler.onIncidentResolved(new IncidentResolvedEvent(incident, false)))
                .doesNotThrowAnyException();
    }
}
