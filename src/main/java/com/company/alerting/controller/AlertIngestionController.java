package com.company.alerting.controller;

import com.company.alerting.domain.Alert;
import com.company.alerting.dto.request.NormalizedAlertRequest;
import com.company.alerting.dto.response.AlertResponse;
import com.company.alerting.dto.response.IngestResponse;
import com.company.alerting.service.AlertIngestionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alert Ingestion", description = "Receive normalized alerts from monitoring sources")
@RequiredArgsConstructor
@Slf4j
public class AlertIngestionController {

    private final AlertIngestionService ingestionService;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Ingest an alert",
            description = "Deduplicates, applies silences and correlates into an incident. "
                    + "Returns 503 when the store is unavailable; the sender should retry.")
    public ResponseEntity<IngestResponse> ingest(@RequestBody NormalizedAlertRequest request) {
        log.debug("Ingest request for alert '{}' from {}", request.getName(), request.getSource());

        meterRegistry.counter("api.alerts.ingest.requests").increment();

        AlertIngestionService.IngestResult result = ingestionService.ingest(request);
        Alert alert = result.getAlert();

        IngestResponse response = IngestResponse.builder()
                .alertId(alert.getId())
                .fingerprint(alert.getFingerprint())
                .isNew(result.isNew())
                .duplicateCount(alert.getDuplicateCount())
                .status(alert.getStatus().value())
                .incidentId(result.getIncidentId())
                .build();

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @PostMapping("/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge a firing alert")
    public ResponseEntity<AlertResponse> acknowledge(@PathVariable Long alertId) {
        return ResponseEntity.ok(AlertResponse.from(ingestionService.acknowledgeAlert(alertId)));
    }

    @PostMapping("/{alertId}/resolve")
    @Operation(summary = "Resolve an alert", description = "Resolves its incident when it was the last unresolved member")
    public ResponseEntity<AlertResponse> resolve(@PathVariable Long alertId) {
        return ResponseEntity.ok(AlertResponse.from(ingestionService.resolveAlert(alertId)));
    }
}
