package com.company.alerting.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Routes incidents of matching services to an escalation policy.
 * Lower priority values are evaluated first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceMapping implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String servicePattern;
    private List<String> severityFilter;
    private Long escalationPolicyId;
    private int priority;
    private Instant createdAt;
}
