package com.example.jobscheduler.service.job;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Represents the result of a scheduled job run.
 * The message becomes the schedule's last run message.
 */
@Data
@Builder
public class JobExecutionResult {

    private boolean success;

    private String message;

    /**
     * Counters worth logging (items processed, shops skipped, ...)
     */
    @Builder.Default
    private Map<String, Object> details = new HashMap<>();

    public static JobExecutionResult completed(String message) {
        return JobExecutionResult.builder()
                .success(true)
                .message(message)
                .build();
    }

    public static JobExecutionResult completed(String message, Map<String, Object> details) {
        return JobExecutionResult.builder()
                .success(true)
                .message(message)
                .details(details != null ? details : new HashMap<>())
                .build();
    }

    public static JobExecutionResult failed(String message) {
        return JobExecutionResult.builder()
                .success(false)
                .message(message)
                .build();
    }
}
