package com.company.alerting.service;

import com.company.alerting.domain.Incident;
import com.company.alerting.domain.NotificationChannel;
import com.company.alerting.domain.NotificationLog;
import com.company.alerting.domain.enums.ChannelType;
import com.company.alerting.domain.enums.NotificationEventType;
import com.company.alerting.domain.enums.NotificationStatus;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.support.AlertRequests;
import com.company.alerting.support.AlertingTestContext;
import com.company.alerting.support.RecordingSender;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class NotificationDispatcherTest {

    private AlertingTestContext ctx;
    private RecordingSender slack;
    private RecordingSender webhook;

    @BeforeEach
    void setUp() {
        ctx = new AlertingTestContext();
        slack = new RecordingSender(ChannelType.SLACK);
        webhook = new RecordingSender(ChannelType.WEBHOOK);
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void delivers_to_every_matching_channel_and_logs_success() {
        NotificationChannel slackChannel = channel("ops-slack", ChannelType.SLACK, null);
        NotificationChannel hookChannel = channel("ops-hook", ChannelType.WEBHOOK, null);
        Incident incident = incident("payment-api", "high");

        int attempted = ctx.dispatcher(List.of(slack, webhook)).dispatch(incident, NotificationEventType.INCIDENT_CREATED);

        assertThat(attempted).isEqualTo(2);
        assertThat(slack.deliveries()).containsExactly(incident.getId() + ":incident_created:1");
        assertThat(webhook.deliveries()).hasSize(1);
        assertThat(ctx.logRepository.findByIncidentId(incident.getId()))
                .extracting(NotificationLog::getChannelId, NotificationLog::getStatus)
                .containsExactlyInAnyOrder(
                        tuple(slackChannel.getId(), NotificationStatus.SENT),
                        tuple(hookChannel.getId(), NotificationStatus.SENT));
    }

    @Test
    void cooldown_falls_back_to_log_table_when_cache_is_down() {
        channel("ops-slack", ChannelType.SLACK, null);
        Incident incident = incident("payment-api", "high");
        NotificationDispatcher dispatcher = ctx.dispatcher(List.of(slack));

        dispatcher.dispatch(incident, NotificationEventType.INCIDENT_CREATED);
        ctx.clock.advance(ctx.properties.getNotificationCooldown().minusSeconds(1));
        int second = dispatcher.dispatch(incident, NotificationEventType.SEVERITY_CHANGED);

        assertThat(second).isZero();
        assertThat(ctx.logRepository.findByIncidentId(incident.getId())).hasSize(1);
        assertThat(ctx.counter("notifications.cooldown_skipped")).isEqualTo(1.0);

        ctx.clock.advance(ctx.properties.getNotificationCooldown());
        assertThat(dispatcher.dispatch(incident, NotificationEventType.SEVERITY_CHANGED)).isEqualTo(1);
        assertThat(slack.deliveries()).hasSize(2);
    }

    @Test
    void failing_channel_does_not_block_others() {
        NotificationChannel broken = channel("ops-slack", ChannelType.SLACK, null);
        NotificationChannel hook = channel("ops-hook", ChannelType.WEBHOOK, null);
        Incident incident = incident("payment-api", "high");
        RecordingSender failingSlack = new RecordingSender(ChannelType.SLACK, "HTTP 500 from hooks.slack.com: oops");

        int attempted = ctx.dispatcher(List.of(failingSlack, webhook)).dispatch(incident, NotificationEventType.INCIDENT_CREATED);

        assertThat(attempted).isEqualTo(2);
        assertThat(webhook.deliveries()).hasSize(1);
        List<NotificationLog> logs = ctx.logRepository.findByIncidentId(incident.getId());
        assertThat(logs).filteredOn(l -> l.getChannelId().equals(broken.getId()))
                .singleElement()
                .satisfies(l -> {
                    assertThat(l.getStatus()).isEqualTo(NotificationStatus.FAILED);
                    assertThat(l.getErrorMessage()).isEqualTo("HTTP 500 from hooks.slack.com: oops");
                });
        assertThat(logs).filteredOn(l -> l.getChannelId().equals(hook.getId()))
                .singleElement()
                .extracting(NotificationLog::getStatus)
                .isEqualTo(NotificationStatus.SENT);
    }

    @Test
    void channel_without_sender_is_logged_as_failed() {
        NotificationChannel teams = channel("ops-teams", ChannelType.TEAMS, null);
        Incident incident = incident("payment-api", "high");

        ctx.dispatcher(List.of(slack)).dispatch(incident, NotificationEventType.INCIDENT_CREATED);

        assertThat(ctx.logRepository.findByIncidentId(incident.getId()))
                .singleElement()
                .satisfies(l -> {
                    assertThat(l.getChannelId()).isEqualTo(teams.getId());
                    assertThat(l.getStatus()).isEqualTo(NotificationStatus.FAILED);
                    assertThat(l.getErrorMessage()).isEqualTo("No sender for channel type TEAMS");
                });
    }

    @Test
    void filters_restrict_channels_by_severity_and_service() {
        channel("critical-only", ChannelType.SLACK, NotificationChannel.Filters.builder()
                .severity(List.of("critical")).build());
        channel("auth-team", ChannelType.WEBHOOK, NotificationChannel.Filters.builder()
                .service(List.of("auth-service")).build());
        Incident incident = incident("payment-api", "high");

        int attempted = ctx.dispatcher(List.of(slack, webhook)).dispatch(incident, NotificationEventType.INCIDENT_CREATED);

        assertThat(attempted).isZero();
        assertThat(ctx.logRepository.findByIncidentId(incident.getId())).isEmpty();
    }

    @Test
    void filter_matching_rules() {
        Incident incident = Incident.builder().id(1L).severity(Severity.CRITICAL).build();
        NotificationChannel bySeverity = NotificationChannel.builder()
                .filters(NotificationChannel.Filters.builder().severity(List.of("critical", "high")).build())
                .build();
        NotificationChannel byService = NotificationChannel.builder()
                .filters(NotificationChannel.Filters.builder().service(List.of("auth-service")).build())
                .build();

        assertThat(NotificationDispatcher.matchesFilters(bySeverity, incident, Set.of())).isTrue();
        assertThat(NotificationDispatcher.matchesFilters(byService, incident, Set.of("payment-api"))).isFalse();
        assertThat(NotificationDispatcher.matchesFilters(byService, incident, Set.of("payment-api", "auth-service"))).isTrue();
        assertThat(NotificationDispatcher.matchesFilters(NotificationChannel.builder().build(), incident, Set.of())).isTrue();
    }

    @Test
    void open_circuit_fails_fast() {
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .build());
        NotificationChannel broken = channel("ops-slack", ChannelType.SLACK, null);
        RecordingSender failing = new RecordingSender(ChannelType.SLACK, "connection refused");
        NotificationDispatcher dispatcher = ctx.dispatcher(List.of(failing), breakers);

        dispatcher.dispatch(incident("svc-a", "high"), NotificationEventType.INCIDENT_CREATED);
        dispatcher.dispatch(incident("svc-b", "high"), NotificationEventType.INCIDENT_CREATED);
        Incident third = incident("svc-c", "high");
        dispatcher.dispatch(third, NotificationEventType.INCIDENT_CREATED);

        assertThat(ctx.logRepository.findByIncidentId(third.getId()))
                .singleElement()
                .extracting(NotificationLog::getErrorMessage)
                .isEqualTo("Circuit open for channel " + broken.getId());
    }

    @Test
    void long_errors_are_truncated() {
        ctx.properties.getDelivery().setMaxErrorLength(20);
        channel("ops-slack", ChannelType.SLACK, null);
        Incident incident = incident("payment-api", "high");

        ctx.dispatcher(List.of(new RecordingSender(ChannelType.SLACK, "x".repeat(100))))
                .dispatch(incident, NotificationEventType.INCIDENT_CREATED);

        assertThat(ctx.logRepository.findByIncidentId(incident.getId()))
                .singleElement()
                .extracting(NotificationLog::getErrorMessage)
                .isEqualTo("x".repeat(20));
    }

    private NotificationChannel channel(String name, ChannelType type, NotificationChannel.Filters filters) {
        return ctx.channelRepository.insert(NotificationChannel.builder()
                .name(name)
                .channelType(type)
                .config(Map.of("url", "https://example.invalid/hook"))
                .filters(filters)
                .active(true)
                .build());
    }

    private Incident incident(String service, String severity) {
        Long id = ctx.ingestionService.ingest(AlertRequests.firing(service, "HighCPU", severity)).getIncidentId();
        return ctx.incidentRepository.findById(id).orElseThrow();
    }
}
