package com.company.alerting.service;

import com.company.alerting.domain.OnCallSchedule;
import com.company.alerting.exception.ScheduleNotFoundException;
import com.company.alerting.repository.OnCallScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class OnCallService {

    private final OnCallScheduleRepository scheduleRepository;
    private final OnCallRotationResolver rotationResolver;

    /**
     * @throws ScheduleNotFoundException if the schedule does not exist
     */
    public OnCallSchedule getSchedule(Long scheduleId, Instant at) {
        return scheduleRepository.findWithOverrides(scheduleId, at)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    /**
     * Empty for unknown or inactive schedules and for schedules without members.
     */
    public Optional<String> currentOnCall(Long scheduleId, Instant at) {
        Optional<OnCallSchedule> schedule = scheduleRepository.findWithOverrides(scheduleId, at);
        if (schedule.isEmpty()) {
            log.warn("On-call schedule {} not found", scheduleId);
            return Optional.empty();
        }
        return currentOnCall(schedule.get(), at);
    }

    public Optional<String> currentOnCall(OnCallSchedule schedule, Instant at) {
        if (Boolean.FALSE.equals(schedule.getActive())) {
            log.debug("On-call schedule {} is inactive", schedule.getId());
            return Optional.empty();
        }
        return rotationResolver.currentOnCall(schedule, at);
    }
}
