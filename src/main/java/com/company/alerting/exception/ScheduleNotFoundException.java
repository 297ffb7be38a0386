package com.company.alerting.exception;

public class ScheduleNotFoundException extends RuntimeException {
    public ScheduleNotFoundException(Long scheduleId) {
        super("On-call schedule not found: " + scheduleId);
    }
}
