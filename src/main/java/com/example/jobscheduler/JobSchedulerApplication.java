package com.example.jobscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Job Schedule Engine Application
 * <p>
 * Turns operator-configured job schedules (cron expression + job type + options)
 * into background work for the commerce back-office.
 * <p>
 * Features:
 * - Minute-level sweep of enabled schedules with timezone-aware cron matching
 * - At most one dispatch per schedule per re-arm interval
 * - Distributed overlap guard so one job kind never runs twice at once
 * - Run outcome tracking on every schedule row
 * - Retry sweep for failed snapshot imports
 * - Idempotent notification delivery ledger
 */
@EnableScheduling
@SpringBootApplication
public class JobSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobSchedulerApplication.class, args);
    }
}
