package com.example.jobscheduler.service.state;

import com.example.jobscheduler.config.JobSchedulerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Minimum spacing between two dispatches of the same schedule.
 * <p>
 * Works on minute buckets: with the default one-minute interval a schedule queued
 * anywhere in 12:00 may be queued again from 12:01:00 on, however many times the
 * sweep runs in between. A dispatch must also be at least the interval minus the
 * tick tolerance old, so a late tick at 12:00:59 does not allow another at 12:01:00.
 */
@Component
@RequiredArgsConstructor
public class RearmWindow {

    private final JobSchedulerProperties properties;

    /**
     * Earliest lastRunAt that still blocks a new dispatch at {@code now}
     */
    public Instant threshold(Instant now) {
        var interval = properties.getRearmInterval();
        if (interval.compareTo(Duration.ofMinutes(1)) < 0) {
            interval = Duration.ofMinutes(1);
        }
        var bucketThreshold = now.truncatedTo(ChronoUnit.MINUTES).minus(interval).plus(Duration.ofMinutes(1));
        var elapsedThreshold = now.minus(interval).plus(tolerance(interval));
        return bucketThreshold.isBefore(elapsedThreshold) ? bucketThreshold : elapsedThreshold;
    }

    private Duration tolerance(Duration interval) {
        var tolerance = properties.getRearmTickTolerance();
        if (tolerance == null || tolerance.isNegative()) {
            return Duration.ZERO;
        }
        return tolerance.compareTo(interval) < 0 ? tolerance : interval.minusSeconds(1);
    }

    public boolean blocks(Instant lastRunAt, Instant now) {
        return lastRunAt != null && !lastRunAt.isBefore(threshold(now));
    }
}
