package com.company.alerting.service;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.domain.Alert;
import com.company.alerting.domain.enums.AlertStatus;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.dto.request.NormalizedAlertRequest;
import com.company.alerting.repository.AlertOccurrenceRepository;
import com.company.alerting.repository.AlertRepository;
import com.company.alerting.util.FingerprintUtils;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Folds repeated arrivals of the same alert into one record.
 *
 * <p>Callers must hold the fingerprint lock across the surrounding transaction;
 * the lookup-then-insert below is only race free under that lock.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeduplicationService {

    static final String UNNAMED_ALERT = "unknown";

    // Column widths in schema.sql
    static final int NAME_MAX = 500;
    static final int FIELD_MAX = 255;
    static final int URL_MAX = 2000;

    private final AlertRepository alertRepository;
    private final AlertOccurrenceRepository occurrenceRepository;
    private final AlertingProperties properties;
    private final Clock clock;

    public String fingerprint(NormalizedAlertRequest request) {
        return FingerprintUtils.fingerprint(request.getSource(), request.getName(),
                request.getService(), request.getHost(), request.getLabels());
    }

    public DedupResult ingest(NormalizedAlertRequest request) {
        Instant now = clock.instant();
        String fingerprint = fingerprint(request);
        boolean resolvedPayload = isResolvedPayload(request, now);

        Optional<Alert> existing = alertRepository.findDedupCandidate(
                fingerprint, now.minus(properties.getDedupWindow()));

        if (existing.isPresent()) {
            Alert alert = existing.get();
            alertRepository.recordDuplicate(alert.getId(), now);
            occurrenceRepository.append(alert.getId(), now);

            boolean resolvedNow = false;
            if (resolvedPayload && alertRepository.markResolved(alert.getId(), endsAt(request, now), now) == 1) {
                resolvedNow = true;
                alert.setStatus(AlertStatus.RESOLVED);
                alert.setEndsAt(endsAt(request, now));
                alert.setResolvedAt(now);
            }

            alert.setDuplicateCount(alert.getDuplicateCount() + 1);
            alert.setLastReceivedAt(now);
            alert.setUpdatedAt(now);

            log.debug("Duplicate alert {} (fingerprint {}), count now {}",
                    alert.getId(), fingerprint, alert.getDuplicateCount());
            return new DedupResult(alert, false, resolvedNow);
        }

        Alert alert = Alert.builder()
                .fingerprint(fingerprint)
                .name(alertName(request.getName()))
                .source(clip(request.getSource(), FIELD_MAX))
                .service(normalizedService(request.getService()))
                .host(clip(request.getHost(), FIELD_MAX))
                .environment(clip(request.getEnvironment(), FIELD_MAX))
                .status(resolvedPayload ? AlertStatus.RESOLVED : AlertStatus.FIRING)
                .severity(Severity.fromString(request.getSeverity()))
                .description(request.getDescription())
                .labels(request.getLabels())
                .annotations(request.getAnnotations())
                .tags(request.getTags())
                .generatorUrl(clip(request.getGeneratorUrl(), URL_MAX))
                .startsAt(request.getStartsAt() != null ? request.getStartsAt() : now)
                .endsAt(resolvedPayload ? endsAt(request, now) : request.getEndsAt())
                .resolvedAt(resolvedPayload ? now : null)
                .lastReceivedAt(now)
                .duplicateCount(1)
                .createdAt(now)
                .updatedAt(now)
                .build();

        alertRepository.insert(alert);
        occurrenceRepository.append(alert.getId(), now);

        log.info("New alert {} '{}' service={} severity={} fingerprint={}",
                alert.getId(), alert.getName(), alert.getService(), alert.getSeverity().value(), fingerprint);
        return new DedupResult(alert, true, false);
    }

    /**
     * Explicit resolved status, or an end time that already passed.
     */
    static boolean isResolvedPayload(NormalizedAlertRequest request, Instant now) {
        if (AlertStatus.fromString(request.getStatus()) == AlertStatus.RESOLVED) {
            return true;
        }
        return request.getEndsAt() != null && request.getEndsAt().isBefore(now);
    }

    /**
     * A missing name is stored as "unknown"; the fingerprint still sees it as empty.
     */
    static String alertName(String name) {
        return name == null || name.isBlank() ? UNNAMED_ALERT : clip(name, NAME_MAX);
    }

    static String clip(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }

    /**
     * Service as stored and correlated on; blank means none.
     */
    static String normalizedService(String service) {
        return service == null || service.isBlank() ? null : clip(service, FIELD_MAX);
    }

    private static Instant endsAt(NormalizedAlertRequest request, Instant now) {
        return request.getEndsAt() != null ? request.getEndsAt() : now;
    }

    @Getter
    @AllArgsConstructor
    public static class DedupResult {
        private final Alert alert;
        private final boolean isNew;
        /** A duplicate carrying resolution flipped a previously unresolved alert. */
        private final boolean resolvedNow;
    }
}
