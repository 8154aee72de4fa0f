package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Coarse cadence shown to operators.
 * The cron expression stored on the schedule is authoritative for due-ness;
 * this is only the preset it was derived from.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleFrequency {

    EVERY_MINUTE("every_minute", "Every minute", "* * * * *"),

    EVERY_FIVE_MINUTES("every_five_minutes", "Every 5 minutes", "*/5 * * * *"),

    EVERY_FIFTEEN_MINUTES("every_fifteen_minutes", "Every 15 minutes", "*/15 * * * *"),

    HOURLY("hourly", "Hourly", "0 * * * *"),

    DAILY("daily", "Daily", "0 0 * * *"),

    WEEKLY("weekly", "Weekly", "0 0 * * 1"),

    /**
     * Operator supplies the cron expression
     */
    CUSTOM("custom", "Custom", null);

    private final String code;
    private final String displayName;

    /**
     * Five-field cron for this preset, null for {@link #CUSTOM}
     */
    private final String defaultCronExpression;

    /**
     * Find ScheduleFrequency by its code value
     */
    public static ScheduleFrequency fromCode(String code) {
        for (var frequency : values()) {
            if (frequency.getCode().equals(code)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown schedule frequency code: " + code);
    }
}
