package com.example.jobscheduler.service.sweep;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.service.state.RearmWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a schedule is due in the current minute.
 * <p>
 * Cron fields are matched against the schedule's local time, so "0 2 * * *" in
 * Europe/Prague fires at 02:00 Prague time on both sides of a DST change.
 * Accepts five-field crontab expressions, six-field Spring expressions (seconds first)
 * and Spring macros such as {@code @daily}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DueEvaluator {

    private final JobSchedulerProperties properties;
    private final RearmWindow rearmWindow;

    private final Map<String, CronExpression> parsedExpressions = new ConcurrentHashMap<>();

    /**
     * Check if the schedule should be dispatched at {@code now}.
     * Never throws: malformed cron or timezone makes the schedule not due.
     */
    public boolean isDue(JobSchedule schedule, Instant now) {
        if (!schedule.isEnabled()) {
            return false;
        }

        var cron = schedule.getCronExpression();
        if (cron == null || cron.isBlank()) {
            return false;
        }

        if (rearmWindow.blocks(schedule.getLastRunAt(), now)) {
            log.debug("Schedule {} was queued at {}, not re-armed yet", schedule.getId(), schedule.getLastRunAt());
            return false;
        }

        var expression = parse(cron);
        if (expression.isEmpty()) {
            log.warn("Schedule {} ({}) has invalid cron expression '{}', skipping",
                    schedule.getId(), schedule.getJobType(), cron);
            return false;
        }

        var zone = resolveZone(schedule.getTimezone());
        if (zone.isEmpty()) {
            log.warn("Schedule {} ({}) has unknown timezone '{}', skipping",
                    schedule.getId(), schedule.getJobType(), schedule.getTimezone());
            return false;
        }

        return matchesMinute(expression.get(), zone.get(), now);
    }

    /**
     * Check if the expression fires at least once within the minute containing {@code now}
     */
    public boolean matchesMinute(CronExpression expression, ZoneId zone, Instant now) {
        var minute = now.truncatedTo(ChronoUnit.MINUTES);
        var next = expression.next(minute.atZone(zone).minusSeconds(1));
        return next != null && next.toInstant().truncatedTo(ChronoUnit.MINUTES).equals(minute);
    }

    public boolean isValidCron(String cron) {
        return cron != null && !cron.isBlank() && parse(cron).isPresent();
    }

    public boolean isValidTimezone(String timezone) {
        return resolveZone(timezone).isPresent();
    }

    Optional<CronExpression> parse(String cron) {
        try {
            return Optional.of(parsedExpressions.computeIfAbsent(normalize(cron), CronExpression::parse));
        } catch (IllegalArgumentException e) {
            log.debug("Cannot parse cron expression '{}': {}", cron, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ZoneId> resolveZone(String timezone) {
        var id = timezone == null || timezone.isBlank() ? properties.getDefaultTimezone() : timezone.trim();
        try {
            return Optional.of(ZoneId.of(id));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Crontab expressions have no seconds field; they fire at second 0
     */
    static String normalize(String cron) {
        var trimmed = cron.trim().replaceAll("\\s+", " ");
        if (trimmed.startsWith("@")) {
            return trimmed;
        }
        return trimmed.split(" ").length == 5 ? "0 " + trimmed : trimmed;
    }
}
