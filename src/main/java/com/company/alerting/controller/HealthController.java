package com.company.alerting.controller;

import com.company.alerting.domain.enums.IncidentStatus;
import com.company.alerting.repository.IncidentEscalationRepository;
import com.company.alerting.repository.IncidentRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight status for load balancers and the on-call dashboard.
 * DOWN (503) when the alert store cannot be queried.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service and alert store status")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final IncidentRepository incidentRepository;
    private final IncidentEscalationRepository escalationRepository;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "Health check with open incident and active escalation counts")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", "alert-correlation-service");
        response.put("timestamp", clock.instant());

        try {
            response.put("open_incidents", incidentRepository.countByStatus(IncidentStatus.OPEN));
            response.put("active_escalations", escalationRepository.countActive());
            response.put("status", "UP");
            return ResponseEntity.ok(response);
        } catch (DataAccessException e) {
            log.warn("Health check could not reach the alert store: {}", e.getMessage());
            response.put("status", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
    }
}
