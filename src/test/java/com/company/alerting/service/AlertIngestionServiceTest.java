package com.company.alerting.service;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.SilenceWindow;
import com.company.alerting.domain.enums.AlertStatus;
import com.company.alerting.domain.enums.IncidentEventType;
import com.company.alerting.domain.enums.IncidentStatus;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.dto.request.NormalizedAlertRequest;
import com.company.alerting.event.IncidentCreatedEvent;
import com.company.alerting.event.IncidentResolvedEvent;
import com.company.alerting.exception.AlertNotFoundException;
import com.company.alerting.support.AlertRequests;
import com.company.alerting.support.AlertingTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertIngestionServiceTest {

    private AlertingTestContext ctx;
    private AlertIngestionService ingestion;

    @BeforeEach
    void setUp() {
        ctx = new AlertingTestContext();
        ingestion = ctx.ingestionService;
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void new_firing_alert_opens_incident() {
        AlertIngestionService.IngestResult result = ingestion.ingest(AlertRequests.firing("payment-api", "HighCPU", "high"));

        assertThat(result.isNew()).isTrue();
        assertThat(result.getIncidentId()).isNotNull();

        Incident incident = ctx.incidentRepository.findById(result.getIncidentId()).orElseThrow();
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.OPEN);
        assertThat(incident.getService()).isEqualTo("payment-api");
        assertThat(ctx.published(IncidentCreatedEvent.class)).hasSize(1);
        assertThat(ctx.counter("alerts.ingested")).isEqualTo(1.0);
    }

    @Test
    void duplicate_reports_existing_incident() {
        AlertIngestionService.IngestResult first = ingestion.ingest(AlertRequests.firing("payment-api", "HighCPU", "high"));
        ctx.clock.advance(Duration.ofSeconds(10));

        AlertIngestionService.IngestResult second = ingestion.ingest(AlertRequests.firing("payment-api", "HighCPU", "high"));

        assertThat(second.isNew()).isFalse();
        assertThat(second.getAlert().getId()).isEqualTo(first.getAlert().getId());
        assertThat(second.getIncidentId()).isEqualTo(first.getIncidentId());
        assertThat(ctx.counter("alerts.duplicates")).isEqualTo(1.0);
    }

    @Test
    void concurrent_identical_alerts_produce_one_alert_and_one_incident() throws Exception {
        int threads = 10;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<AlertIngestionService.IngestResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return ingestion.ingest(AlertRequests.firing("payment-api", "HighCPU", "high"));
                }));
            }
            start.countDown();

            List<AlertIngestionService.IngestResult> results = new ArrayList<>();
            for (Future<AlertIngestionService.IngestResult> f : futures) {
                results.add(f.get(30, TimeUnit.SECONDS));
            }

            assertThat(results).filteredOn(AlertIngestionService.IngestResult::isNew).hasSize(1);
            Alert alert = results.get(0).getAlert();
            assertThat(ctx.alertRepository.countByFingerprint(alert.getFingerprint())).isEqualTo(1);
            assertThat(ctx.alertRepository.findById(alert.getId()).orElseThrow().getDuplicateCount()).isEqualTo(threads);
            assertThat(ctx.occurrenceRepository.countByAlertId(alert.getId())).isEqualTo(threads);
            assertThat(ctx.incidentRepository.countByService("payment-api")).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void silenced_alert_is_stored_as_suppressed_without_incident() {
        ctx.silenceRepository.insert(SilenceWindow.builder()
                .name("payment maintenance")
                .matchers(SilenceWindow.Matchers.builder().service(List.of("payment-api")).build())
                .startsAt(AlertingTestContext.T0.minus(Duration.ofHours(1)))
                .endsAt(AlertingTestContext.T0.plus(Duration.ofHours(1)))
                .active(true)
                .createdAt(AlertingTestContext.T0)
                .build());

        AlertIngestionService.IngestResult silenced = ingestion.ingest(AlertRequests.firing("payment-api", "HighCPU", "high"));
        AlertIngestionService.IngestResult other = ingestion.ingest(AlertRequests.firing("auth-service", "HighCPU", "high"));

        assertThat(silenced.getIncidentId()).isNull();
        assertThat(ctx.alertRepository.findById(silenced.getAlert().getId()).orElseThrow().getStatus())
                .isEqualTo(AlertStatus.SUPPRESSED);
        assertThat(ctx.incidentRepository.countByService("payment-api")).isZero();
        assertThat(other.getIncidentId()).isNotNull();
        assertThat(ctx.counter("alerts.suppressed")).isEqualTo(1.0);
    }

    @Test
    void silence_label_matcher_requires_exact_value() {
        ctx.silenceRepository.insert(SilenceWindow.builder()
                .name("staging noise")
                .matchers(SilenceWindow.Matchers.builder().labels(Map.of("env", "staging")).build())
                .startsAt(AlertingTestContext.T0.minus(Duration.ofHours(1)))
                .endsAt(AlertingTestContext.T0.plus(Duration.ofHours(1)))
                .active(true)
                .createdAt(AlertingTestContext.T0)
                .build());

        AlertIngestionService.IngestResult prod = ingestion.ingest(AlertRequests.firing("payment-api", "HighCPU", "high"));

        assertThat(prod.getIncidentId()).isNotNull();
    }

    @Test
    void silence_label_without_value_matches_only_alerts_missing_that_label() {
        Map<String, String> labels = new HashMap<>();
        labels.put("env", null);
        ctx.silenceRepository.insert(SilenceWindow.builder()
                .name("unlabelled noise")
                .matchers(SilenceWindow.Matchers.builder().labels(labels).build())
                .startsAt(AlertingTestContext.T0.minus(Duration.ofHours(1)))
                .endsAt(AlertingTestContext.T0.plus(Duration.ofHours(1)))
                .active(true)
                .createdAt(AlertingTestContext.T0)
                .build());
        NormalizedAlertRequest unlabelled = AlertRequests.firing("auth-service", "LoginErrors", "high");
        unlabelled.setLabels(Map.of("team", "identity"));

        AlertIngestionService.IngestResult prod = ingestion.ingest(AlertRequests.firing("payment-api", "HighCPU", "high"));
        AlertIngestionService.IngestResult silenced = ingestion.ingest(unlabelled);

        assertThat(prod.getIncidentId()).isNotNull();
        assertThat(silenced.getIncidentId()).isNull();
        assertThat(silenced.getAlert().getStatus()).isEqualTo(AlertStatus.SUPPRESSED);
    }

    @Test
    void incomplete_alert_is_stored_with_defaults() {
        NormalizedAlertRequest request = NormalizedAlertRequest.builder()
                .service("  ")
                .host("h".repeat(300))
                .build();

        AlertIngestionService.IngestResult result = ingestion.ingest(request);

        Alert stored = ctx.alertRepository.findById(result.getAlert().getId()).orElseThrow();
        assertThat(stored.getName()).isEqualTo("unknown");
        assertThat(stored.getService()).isNull();
        assertThat(stored.getHost()).hasSize(255);
        assertThat(stored.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(result.getIncidentId()).isNotNull();
    }

    @Test
    void oversized_name_is_truncated_rather_than_rejected() {
        AlertIngestionService.IngestResult result = ingestion.ingest(
                AlertRequests.firing("payment-api", "x".repeat(600), "critical"));

        assertThat(ctx.alertRepository.findById(result.getAlert().getId()).orElseThrow().getName()).hasSize(500);
        assertThat(ctx.incidentRepository.findById(result.getIncidentId()).orElseThrow().getTitle()).hasSize(500);
    }

    @Test
    void alert_arriving_resolved_is_not_correlated() {
        AlertIngestionService.IngestResult result = ingestion.ingest(AlertRequests.resolved("payment-api", "HighCPU", "high"));

        assertThat(result.isNew()).isTrue();
        assertThat(result.getIncidentId()).isNull();
        assertThat(result.getAlert().getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(ctx.incidentRepository.countByService("payment-api")).isZero();
    }

    @Test
    void resolving_last_member_auto_resolves_incident() {
        AlertIngestionService.IngestResult cpu = ingestion.ingest(AlertRequests.firing("payment-api", "HighCPU", "high"));
        AlertIngestionService.IngestResult mem = ingestion.ingest(AlertRequests.firing("payment-api", "HighMemory", "warning"));
        assertThat(mem.getIncidentId()).isEqualTo(cpu.getIncidentId());
        Long incidentId = cpu.getIncidentId();

        ctx.clock.advance(Duration.ofMinutes(1));
        ingestion.ingest(AlertRequests.resolved("payment-api", "HighCPU", "high"));
        assertThat(ctx.incidentRepository.findById(incidentId).orElseThrow().getStatus()).isEqualTo(IncidentStatus.OPEN);

        ingestion.ingest(AlertRequests.resolved("payment-api", "HighMemory", "warning"));

        Incident incident = ctx.incidentRepository.findById(incidentId).orElseThrow();
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(incident.getResolvedAt()).isEqualTo(AlertingTestContext.T0.plus(Duration.ofMinutes(1)));
        assertThat(ctx.eventRepository.findByIncidentId(incidentId))
                .extracting(e -> e.getEventType())
                .contains(IncidentEventType.AUTO_RESOLVED);
        assertThat(ctx.published(IncidentResolvedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.isAutomatic()).isTrue());
    }

    @Test
    void manual_resolve_of_only_alert_resolves_incident() {
        AlertIngestionService.IngestResult result = ingestion.ingest(AlertRequests.firing("payment-api", "HighCPU", "high"));

        Alert resolved = ingestion.resolveAlert(result.getAlert().getId());

        assertThat(resolved.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(ctx.incidentRepository.findById(result.getIncidentId()).orElseThrow().getStatus())
                .isEqualTo(IncidentStatus.RESOLVED);
    }

    @Test
    void acknowledge_alert_leaves_incident_open() {
        AlertIngestionService.IngestResult result = ingestion.ingest(AlertRequests.firing("payment-api", "HighCPU", "high"));

        Alert acked = ingestion.acknowledgeAlert(result.getAlert().getId());

        assertThat(acked.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(ctx.incidentRepository.findById(result.getIncidentId()).orElseThrow().getStatus())
                .isEqualTo(IncidentStatus.OPEN);
    }

    @Test
    void unknown_alert_id_is_rejected() {
        assertThatThrownBy(() -> ingestion.resolveAlert(999L)).isInstanceOf(AlertNotFoundException.class);
        assertThatThrownBy(() -> ingestion.acknowledgeAlert(999L)).isInstanceOf(AlertNotFoundException.class);
    }
}
