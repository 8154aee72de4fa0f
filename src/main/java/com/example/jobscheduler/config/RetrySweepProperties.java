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
 * Configuration properties for the failed snapshot retry sweep.
 * <p>
 * Lookback and minimum age depend on how long a snapshot import normally
 * takes downstream, so they are tuned per environment.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler.retry-sweep")
public class RetrySweepProperties {

    private boolean enabled = true;

    /**
     * Spring cron for the retry sweep (hourly by default)
     */
    @NotBlank
    private String cron = "0 15 * * * *";

    /**
     * Failures older than this are no longer retried automatically
     */
    @NotNull
    private Duration lookback = Duration.ofDays(3);

    /**
     * Failures younger than this may still have an attempt in flight
     */
    @NotNull
    private Duration minimumAge = Duration.ofMinutes(15);

    /**
     * Maximum items re-enqueued per sweep pass
     */
    @Min(1)
    private int batchSize = 200;

    @NotNull
    private Duration lockTtl = Duration.ofMinutes(10);
}
