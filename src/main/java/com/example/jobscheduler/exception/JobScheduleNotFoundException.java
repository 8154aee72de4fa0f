package com.example.jobscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for job schedule not found
 */
@Getter
public class JobScheduleNotFoundException extends RuntimeException {

    private final String scheduleId;

    public JobScheduleNotFoundException(String scheduleId) {
        super("Job schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public JobScheduleNotFoundException(UUID scheduleId) {
        this(scheduleId.toString());
    }
}
