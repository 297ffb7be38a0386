package com.company.alerting.service;

import com.company.alerting.domain.Incident;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Default pager: records the page in the log and in metrics. A provider-backed pager
 * can be registered as {@code @Primary} in its place.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LoggingResponderPager implements ResponderPager {

    private final MeterRegistry meterRegistry;

    @Override
    public void page(Incident incident, int level, Collection<String> userIds) {
        if (userIds.isEmpty()) {
            log.warn("Escalation level {} of incident {} has nobody to page", level, incident.getId());
            return;
        }
        for (String userId : userIds) {
            log.warn("PAGE {} for incident {} [{}] '{}' (level {})",
                    userId, incident.getId(),
                    incident.getSeverity() != null ? incident.getSeverity().value() : "unknown",
                    incident.getTitle(), level);
            meterRegistry.counter("escalation.pages", "level", String.valueOf(level)).increment();
        }
    }
}
