package com.company.alerting.service;

import com.company.alerting.domain.EscalationPolicy;
import com.company.alerting.domain.ServiceMapping;
import com.company.alerting.domain.enums.Severity;
import com.company.alerting.repository.EscalationPolicyRepository;
import com.company.alerting.repository.ServiceMappingRepository;
import com.company.alerting.util.GlobPattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the escalation policy for an incident from the service mappings.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EscalationPolicyResolver {

    private final ServiceMappingRepository mappingRepository;
    private final EscalationPolicyRepository policyRepository;

    /**
     * First mapping in priority order whose pattern matches the service, whose
     * severity filter (if any) admits the severity and whose policy still exists.
     * A missing service is matched as "*".
     */
    public Optional<EscalationPolicy> resolve(String service, Severity severity) {
        for (ServiceMapping mapping : matchingMappings(mappingRepository.findAllOrdered(), service, severity)) {
            EscalationPolicy policy = policyRepository.findById(mapping.getEscalationPolicyId());
            if (policy != null) {
                return Optional.of(policy);
            }
            log.warn("Mapping {} points at missing escalation policy {}, trying next match",
                    mapping.getId(), mapping.getEscalationPolicyId());
        }
        log.debug("No escalation mapping for service={} severity={}", service, severity);
        return Optional.empty();
    }

    static Optional<ServiceMapping> findMapping(List<ServiceMapping> ordered, String service, Severity severity) {
        return matchingMappings(ordered, service, severity).stream().findFirst();
    }

    static List<ServiceMapping> matchingMappings(List<ServiceMapping> ordered, String service, Severity severity) {
        String subject = service != null ? service : "*";
        List<ServiceMapping> matches = new ArrayList<>();
        for (ServiceMapping mapping : ordered) {
            if (!GlobPattern.matches(mapping.getServicePattern(), subject)) {
                continue;
            }
            List<String> filter = mapping.getSeverityFilter();
            if (filter != null && !filter.isEmpty()
                    && (severity == null || !filter.contains(severity.value()))) {
                continue;
            }
            matches.add(mapping);
        }
        return matches;
    }
}
