package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a scheduled job that could not complete.
 * The message is what operators see as the schedule's last run message.
 */
@Getter
public class JobExecutionException extends RuntimeException {

    private final String jobType;

    public JobExecutionException(String jobType, String message) {
        super(message);
        this.jobType = jobType;
    }

    public JobExecutionException(String jobType, String message, Throwable cause) {
        super(message, cause);
        this.jobType = jobType;
    }
}
