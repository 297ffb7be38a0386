package com.company.alerting.config;

import com.company.alerting.domain.enums.IncidentStatus;
import com.company.alerting.repository.IncidentEscalationRepository;
import com.company.alerting.repository.IncidentRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final IncidentEscalationRepository escalationRepository;
    private final IncidentRepository incidentRepository;

    @Bean
    public MeterBinder alertingMetrics(MeterRegistry registry) {
        return (reg) -> {
            Gauge.builder("escalations.active", escalationRepository, repo -> {
                        try {
                            return repo.countActive();
                        } catch (Exception e) {
                            log.warn("Failed to count active escalations", e);
                            return 0;
                        }
                    })
                    .description("Incidents with a running escalation timer")
                    .register(reg);

            Gauge.builder("incidents.open", incidentRepository, repo -> {
                        try {
                            return repo.countByStatus(IncidentStatus.OPEN);
                        } catch (Exception e) {
                            log.warn("Failed to count open incidents", e);
                            return 0;
                        }
                    })
                    .description("Incidents not yet acknowledged or resolved")
                    .register(reg);

            log.info("Alerting metrics registered");
        };
    }
}
