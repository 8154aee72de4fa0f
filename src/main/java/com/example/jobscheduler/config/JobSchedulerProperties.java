package com.example.jobscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the schedule sweep and job workers.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler")
public class JobSchedulerProperties {

    /**
     * Spring cron for the sweep tick (six fields, seconds first)
     */
    @NotBlank
    private String sweepCron = "0 * * * * *";

    /**
     * Minimum time between two dispatches of one schedule.
     * Must stay aligned with the sweep tick; one minute for a per-minute tick.
     */
    @NotNull
    private Duration rearmInterval = Duration.ofMinutes(1);

    /**
     * Jitter allowed on the sweep tick; a dispatch younger than the re-arm interval
     * minus this tolerance still blocks the next one
     */
    @NotNull
    private Duration rearmTickTolerance = Duration.ofSeconds(5);

    /**
     * Timezone applied to schedules that do not declare one
     */
    @NotBlank
    private String defaultTimezone = "UTC";

    /**
     * TTL of the per-kind overlap lock; recovers from crashed holders
     */
    @NotNull
    private Duration lockTtl = Duration.ofHours(1);

    /**
     * Table holding both scheduler locks and per-kind overlap locks
     */
    @NotBlank
    private String lockTable = "shedlock";

    /**
     * Number of concurrent job worker threads
     */
    @Min(1)
    private int workerPoolSize = 8;

    /**
     * Pending work items accepted before enqueue is rejected
     */
    @Min(1)
    private int workerQueueCapacity = 500;
}
