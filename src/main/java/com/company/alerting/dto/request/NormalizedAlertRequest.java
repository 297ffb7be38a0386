package com.company.alerting.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Source-agnostic alert payload. Vendor formats are mapped to this shape upstream.
 * Nothing is rejected: unknown severities and statuses degrade to warning / firing,
 * a missing name to "unknown", and over-long fields are cut to their column width.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedAlertRequest {
    private String name;

    private String source;
    private String service;
    private String host;
    private String environment;

    // critical | high | warning | low | info
    private String severity;

    // firing | resolved
    private String status;

    private String description;
    private Map<String, String> labels;
    private Map<String, String> annotations;
    private List<String> tags;
    private String generatorUrl;

    private Instant startsAt;
    private Instant endsAt;
}
