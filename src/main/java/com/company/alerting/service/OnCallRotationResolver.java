package com.company.alerting.service;

import com.company.alerting.domain.OnCallSchedule;
import com.company.alerting.domain.enums.RotationType;
import com.company.alerting.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Computes who is on call for a loaded schedule at a given instant. Holds no state.
 */
@Component
public class OnCallRotationResolver {

    public Optional<String> currentOnCall(OnCallSchedule schedule, Instant at) {
        Optional<String> override = activeOverride(schedule, at);
        if (override.isPresent()) {
            return override;
        }

        List<OnCallSchedule.Member> members = schedule.getMembers();
        if (members == null || members.isEmpty()) {
            return Optional.empty();
        }

        List<OnCallSchedule.Member> ordered = members.stream()
                .sorted(Comparator.comparingInt(OnCallSchedule.Member::getOrder))
                .toList();

        long intervals = elapsedIntervals(schedule, at);
        int index = (int) Math.floorMod(intervals, (long) ordered.size());
        return Optional.ofNullable(ordered.get(index).getUserId());
    }

    /**
     * Most recently created override covering {@code at}.
     */
    private Optional<String> activeOverride(OnCallSchedule schedule, Instant at) {
        if (schedule.getOverrides() == null) {
            return Optional.empty();
        }
        return schedule.getOverrides().stream()
                .filter(o -> o.getStartsAt() != null && o.getEndsAt() != null && o.covers(at))
                .max(Comparator
                        .comparing(OnCallSchedule.ScheduleOverride::getCreatedAt,
                                Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(OnCallSchedule.ScheduleOverride::getId,
                                Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(OnCallSchedule.ScheduleOverride::getUserId);
    }

    /**
     * Whole rotation intervals between the first handoff and {@code at}, counted in the
     * schedule's local time. Zero before the first handoff.
     */
    long elapsedIntervals(OnCallSchedule schedule, Instant at) {
        ZoneId zone = TimeUtils.zoneOrUtc(schedule.getTimezone());
        LocalTime handoff = schedule.getHandoffTime() != null
                ? schedule.getHandoffTime()
                : TimeUtils.parseHandoff(null);
        Instant effectiveFrom = schedule.getEffectiveFrom() != null ? schedule.getEffectiveFrom() : at;

        ZonedDateTime from = effectiveFrom.atZone(zone);
        ZonedDateTime firstHandoff = from.toLocalDate().atTime(handoff).atZone(zone);
        if (firstHandoff.isBefore(from)) {
            firstHandoff = firstHandoff.plusDays(1);
        }

        ZonedDateTime now = at.atZone(zone);
        if (now.isBefore(firstHandoff)) {
            return 0;
        }

        RotationType type = schedule.getRotationType() != null ? schedule.getRotationType() : RotationType.WEEKLY;
        switch (type) {
            case HOURLY: {
                long hours = ChronoUnit.HOURS.between(firstHandoff, now);
                return hours / positiveOr(schedule.getRotationIntervalHours(), 1);
            }
            case DAILY: {
                long days = ChronoUnit.DAYS.between(firstHandoff, now);
                return days / positiveOr(schedule.getRotationIntervalDays(), 1);
            }
            case CUSTOM: {
                long days = ChronoUnit.DAYS.between(firstHandoff, now);
                return days / positiveOr(schedule.getRotationIntervalDays(), 7);
            }
            case WEEKLY:
            default: {
                long days = ChronoUnit.DAYS.between(firstHandoff, now);
                return days / 7;
            }
        }
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }
}
