package com.example.jobscheduler.config;

import com.example.jobscheduler.domain.enums.FailedSnapshotStatus;
import com.example.jobscheduler.domain.enums.RunStatus;
import com.example.jobscheduler.domain.repository.FailedSnapshotRepository;
import com.example.jobscheduler.domain.repository.JobScheduleRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring the schedule engine.
 * <p>
 * Exposes Prometheus metrics for:
 * - Schedules by last run status
 * - Dispatches, skips and lock contention per job type
 * - Job execution times and outcomes
 * - Failed snapshots awaiting retry
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobScheduleRepository scheduleRepository;
    private final FailedSnapshotRepository failedSnapshotRepository;

    private final ConcurrentHashMap<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : RunStatus.values()) {
            var key = "run_status_" + status.getCode();
            gaugeValues.put(key, new AtomicLong(0));

            Gauge.builder("job_scheduler_schedules", gaugeValues.get(key), AtomicLong::get)
                    .tag("last_run_status", status.getCode())
                    .description("Number of schedules by last run status")
                    .register(meterRegistry);
        }

        for (var status : FailedSnapshotStatus.values()) {
            var key = "snapshot_" + status.name().toLowerCase();
            gaugeValues.put(key, new AtomicLong(0));

            Gauge.builder("job_scheduler_failed_snapshots", gaugeValues.get(key), AtomicLong::get)
                    .tag("status", status.name().toLowerCase())
                    .description("Number of failed snapshots by status")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${job-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        for (var status : RunStatus.values()) {
            gaugeValues.get("run_status_" + status.getCode()).set(scheduleRepository.countByLastRunStatus(status));
        }
        for (var status : FailedSnapshotStatus.values()) {
            gaugeValues.get("snapshot_" + status.name().toLowerCase()).set(failedSnapshotRepository.countByStatus(status));
        }
    }

    public Timer.Sample startJobExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record job execution time tagged with its final status
     */
    public void recordJobExecution(Timer.Sample sample, String jobType, RunStatus outcome) {
        sample.stop(Timer.builder("job_scheduler_execution_time")
                .tag("job_type", jobType)
                .tag("outcome", outcome.getCode())
                .description("Scheduled job execution time")
                .register(meterRegistry));
    }

    public void recordDispatch(String jobType) {
        meterRegistry.counter("job_scheduler_dispatched", "job_type", jobType).increment();
    }

    /**
     * Record a run that was skipped, e.g. "no_handler", "lock_held", "enqueue_rejected"
     */
    public void recordSkipped(String jobType, String reason) {
        meterRegistry.counter("job_scheduler_skipped",
                "job_type", jobType,
                "reason", reason
        ).increment();
    }

    public void recordLockContention(String lockName) {
        meterRegistry.counter("job_scheduler_lock_contention", "lock", lockName).increment();
    }

    public void recordSnapshotRetries(int count) {
        meterRegistry.counter("job_scheduler_snapshot_retries").increment(count);
    }

    public void recordNotificationsDelivered(String channel, int count) {
        meterRegistry.counter("job_scheduler_notifications_delivered", "channel", channel).increment(count);
    }
}
