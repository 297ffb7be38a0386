package com.company.alerting.scheduled;

import com.company.alerting.config.AlertingProperties;
import com.company.alerting.domain.IncidentEscalation;
import com.company.alerting.repository.IncidentEscalationRepository;
import com.company.alerting.service.EscalationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Fires due escalation timers. Timers live in the database, so after a restart the
 * first scan picks up everything that came due while the service was down.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "alerting.escalation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class EscalationTimerJob {

    private final IncidentEscalationRepository escalationRepository;
    private final EscalationService escalationService;
    private final AlertingProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${alerting.escalation.scan-interval-ms:15000}", initialDelay = 5000)
    public void fireDueEscalations() {
        List<IncidentEscalation> due = escalationRepository.findDue(
                clock.instant(), properties.getEscalation().getBatchSize());

        if (due.isEmpty()) {
            log.debug("No escalation timers due");
            return;
        }

        log.info("Processing {} due escalation timers", due.size());

        int handled = 0;
        int failed = 0;
        for (IncidentEscalation escalation : due) {
            try {
                EscalationService.TimeoutOutcome outcome = escalationService.onTimeout(escalation);
                log.debug("Escalation timer for incident {}: {}", escalation.getIncidentId(), outcome);
                handled++;
            } catch (Exception e) {
                log.error("Escalation timer for incident {} failed", escalation.getIncidentId(), e);
                failed++;
            }
        }

        log.info("Escalation scan completed: {} handled, {} failed", handled, failed);
    }
}
