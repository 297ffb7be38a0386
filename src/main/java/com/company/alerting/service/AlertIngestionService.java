package com.company.alerting.service;

import com.company.alerting.domain.Alert;
import com.company.alerting.domain.Incident;
import com.company.alerting.domain.enums.AlertStatus;
import com.company.alerting.dto.request.NormalizedAlertRequest;
import com.company.alerting.exception.AlertNotFoundException;
import com.company.alerting.repository.AlertRepository;
import com.company.alerting.util.KeyedLock;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Ingestion pipeline: fingerprint, deduplicate, silence, correlate.
 *
 * <p>Lock order is fingerprint, then service, then incident row. Both in-process locks
 * are taken before the transaction opens and released after it commits, so the next
 * holder always sees the committed rows.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertIngestionService {

    private final DeduplicationService deduplicationService;
    private final SilenceMatcher silenceMatcher;
    private final CorrelationService correlationService;
    private final AlertRepository alertRepository;
    private final KeyedLock correlationLocks;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public IngestResult ingest(NormalizedAlertRequest request) {
        String fingerprint = deduplicationService.fingerprint(request);

        IngestResult result = correlationLocks.withLock(fingerprintKey(fingerprint), () ->
                withServiceLock(DeduplicationService.normalizedService(request.getService()), () ->
                        transactionTemplate.execute(status -> process(request))));

        meterRegistry.counter("alerts.ingested",
                "source", request.getSource() != null ? request.getSource() : "unknown",
                "new", String.valueOf(result.isNew())
        ).increment();
        return result;
    }

    private IngestResult process(NormalizedAlertRequest request) {
        DeduplicationService.DedupResult dedup = deduplicationService.ingest(request);
        Alert alert = dedup.getAlert();

        if (!dedup.isNew()) {
            meterRegistry.counter("alerts.duplicates").increment();
            if (dedup.isResolvedNow()) {
                correlationService.onAlertResolved(alert);
            } else if (alert.getStatus() == AlertStatus.FIRING) {
                correlationService.onMemberActivity(alert);
            }
            return new IngestResult(alert, false, alert.getIncidentId());
        }

        if (alert.getStatus() != AlertStatus.FIRING) {
            log.info("Alert {} arrived already resolved, not correlated", alert.getId());
            return new IngestResult(alert, true, null);
        }

        Instant now = clock.instant();
        if (silenceMatcher.isSuppressed(alert, now)) {
            alertRepository.markSuppressed(alert.getId(), now);
            alert.setStatus(AlertStatus.SUPPRESSED);
            meterRegistry.counter("alerts.suppressed").increment();
            return new IngestResult(alert, true, null);
        }

        Incident incident = correlationService.correlate(alert);
        return new IngestResult(alert, true, incident.getId());
    }

    /**
     * Marks a firing alert acknowledged; the incident itself is unaffected.
     */
    public Alert acknowledgeAlert(Long alertId) {
        Instant now = clock.instant();
        if (alertRepository.markAcknowledged(alertId, now) == 1) {
            log.info("Alert {} acknowledged", alertId);
        }
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    /**
     * Marks an alert resolved by hand and lets correlation close its incident.
     */
    public Alert resolveAlert(Long alertId) {
        Alert current = alertRepository.findById(alertId)
                .orElseThrow(() -> new AlertNotFoundException(alertId));

        return correlationLocks.withLock(fingerprintKey(current.getFingerprint()), () ->
                withServiceLock(current.getService(), () ->
                        transactionTemplate.execute(status -> {
                            Instant now = clock.instant();
                            if (alertRepository.markResolved(alertId, now, now) == 1) {
                                Alert resolved = alertRepository.findById(alertId).orElseThrow();
                                correlationService.onAlertResolved(resolved);
                                log.info("Alert {} resolved manually", alertId);
                                return resolved;
                            }
                            return alertRepository.findById(alertId).orElseThrow();
                        })));
    }

    private <T> T withServiceLock(String service, Supplier<T> action) {
        if (service == null) {
            return action.get();
        }
        return correlationLocks.withLock("service:" + service, action);
    }

    private static String fingerprintKey(String fingerprint) {
        return "fingerprint:" + fingerprint;
    }

    @Getter
    @AllArgsConstructor
    public static class IngestResult {
        private final Alert alert;
        private final boolean isNew;
        private final Long incidentId;
    }
}
