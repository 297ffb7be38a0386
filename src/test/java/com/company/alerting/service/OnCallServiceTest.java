package com.company.alerting.service;

import com.company.alerting.domain.OnCallSchedule;
import com.company.alerting.domain.enums.RotationType;
import com.company.alerting.exception.ScheduleNotFoundException;
import com.company.alerting.support.AlertingTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OnCallServiceTest {

    private AlertingTestContext ctx;
    private OnCallSchedule schedule;

    @BeforeEach
    void setUp() {
        ctx = new AlertingTestContext();
        schedule = ctx.scheduleRepository.insert(OnCallSchedule.builder()
                .name("payments primary")
                .rotationType(RotationType.WEEKLY)
                .members(List.of(new OnCallSchedule.Member("alice", 0), new OnCallSchedule.Member("bob", 1)))
                .handoffTime(LocalTime.of(9, 0))
                .timezone("UTC")
                .effectiveFrom(Instant.parse("2024-01-01T09:00:00Z"))
                .active(true)
                .build());
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void stored_schedule_round_trips_rotation_settings() {
        OnCallSchedule loaded = ctx.onCallService.getSchedule(schedule.getId(), Instant.parse("2024-01-10T12:00:00Z"));

        assertThat(loaded.getHandoffTime()).isEqualTo(LocalTime.of(9, 0));
        assertThat(loaded.getMembers()).extracting(OnCallSchedule.Member::getUserId).containsExactly("alice", "bob");
        assertThat(ctx.onCallService.currentOnCall(schedule.getId(), Instant.parse("2024-01-10T12:00:00Z")))
                .contains("bob");
    }

    @Test
    void stored_override_replaces_rotation_only_while_active() {
        ctx.scheduleRepository.insertOverride(OnCallSchedule.ScheduleOverride.builder()
                .scheduleId(schedule.getId())
                .userId("dave")
                .startsAt(Instant.parse("2024-01-10T00:00:00Z"))
                .endsAt(Instant.parse("2024-01-11T00:00:00Z"))
                .createdAt(Instant.parse("2024-01-09T00:00:00Z"))
                .build());

        assertThat(ctx.onCallService.currentOnCall(schedule.getId(), Instant.parse("2024-01-10T12:00:00Z")))
                .contains("dave");
        assertThat(ctx.onCallService.currentOnCall(schedule.getId(), Instant.parse("2024-01-11T00:00:00Z")))
                .contains("bob");
    }

    @Test
    void inactive_schedule_has_nobody_on_call() {
        OnCallSchedule inactive = ctx.scheduleRepository.insert(OnCallSchedule.builder()
                .name("retired")
                .rotationType(RotationType.DAILY)
                .members(List.of(new OnCallSchedule.Member("alice", 0)))
                .effectiveFrom(Instant.parse("2024-01-01T09:00:00Z"))
                .active(false)
                .build());

        assertThat(ctx.onCallService.currentOnCall(inactive.getId(), Instant.parse("2024-01-10T12:00:00Z"))).isEmpty();
    }

    @Test
    void unknown_schedule() {
        assertThat(ctx.onCallService.currentOnCall(999L, Instant.parse("2024-01-10T12:00:00Z"))).isEmpty();
        assertThatThrownBy(() -> ctx.onCallService.getSchedule(999L, Instant.parse("2024-01-10T12:00:00Z")))
                .isInstanceOf(ScheduleNotFoundException.class);
    }
}
