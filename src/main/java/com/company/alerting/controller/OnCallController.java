package com.company.alerting.controller;

import com.company.alerting.domain.OnCallSchedule;
import com.company.alerting.dto.response.OnCallResponse;
import com.company.alerting.service.OnCallService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/v1/oncall")
@Tag(name = "On-Call", description = "On-call rotation lookups")
@RequiredArgsConstructor
public class OnCallController {

    private final OnCallService onCallService;
    private final Clock clock;

    @GetMapping("/schedules/{scheduleId}/current")
    @Operation(summary = "Who is on call", description = "Defaults to now; overrides take precedence over the rotation")
    public ResponseEntity<OnCallResponse> currentOnCall(
            @PathVariable Long scheduleId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant at) {

        Instant when = at != null ? at : clock.instant();
        OnCallSchedule schedule = onCallService.getSchedule(scheduleId, when);

        return ResponseEntity.ok(OnCallResponse.builder()
                .scheduleId(schedule.getId())
                .scheduleName(schedule.getName())
                .at(when)
                .userId(onCallService.currentOnCall(schedule, when).orElse(null))
                .build());
    }
}
