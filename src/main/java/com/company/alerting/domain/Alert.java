package com.company.alerting.domain;

import com.company.alerting.domain.enums.AlertStatus;
import com.company.alerting.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One observed problem and every duplicate arrival folded into it.
 * {@code duplicateCount} always equals the number of rows in alert_occurrences.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String fingerprint;

    // Identity fields
    private String name;
    private String source;
    private String service;
    private String host;
    private String environment;

    private AlertStatus status;
    private Severity severity;
    private String description;
    private Map<String, String> labels;
    private Map<String, String> annotations;
    private List<String> tags;
    private String generatorUrl;

    // Timing
    private Instant startsAt;
    private Instant endsAt;
    private Instant lastReceivedAt;
    private Instant acknowledgedAt;
    private Instant resolvedAt;

    private Integer duplicateCount;
    private Long incidentId;

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isResolved() {
        return status == AlertStatus.RESOLVED;
    }

    public boolean isSuppressed() {
        return status == AlertStatus.SUPPRESSED;
    }
}
