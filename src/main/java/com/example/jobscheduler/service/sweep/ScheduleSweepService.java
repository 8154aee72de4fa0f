package com.example.jobscheduler.service.sweep;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.domain.enums.RunStateWriter;
import com.example.jobscheduler.domain.repository.JobScheduleRepository;
import com.example.jobscheduler.service.dispatch.JobDispatchRouter;
import com.example.jobscheduler.service.state.RunStateTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic entry point of the engine.
 * <p>
 * Every tick loads enabled schedules, keeps the due ones, queues each one on its row
 * and hands it to the dispatch router. Dispatch never waits for the job itself.
 * <p>
 * ShedLock keeps the tick on one replica at a time; the local flag keeps a manual
 * run from overlapping the scheduled one in this process.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleSweepService {

    static final String NO_HANDLER_MESSAGE = "no handler registered";

    private final JobScheduleRepository scheduleRepository;
    private final DueEvaluator dueEvaluator;
    private final RunStateTracker runStateTracker;
    private final JobDispatchRouter dispatchRouter;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    @Scheduled(cron = "${job-scheduler.sweep-cron:0 * * * * *}")
    @SchedulerLock(name = "jobScheduleSweep", lockAtLeastFor = "5s", lockAtMostFor = "55s")
    public void scheduledTick() {
        runTick(null);
    }

    /**
     * Run one sweep.
     *
     * @param jobTypeFilter only consider schedules of this job type; null or blank for all
     * @return number of schedules dispatched; 0 is a normal outcome
     */
    public int runTick(String jobTypeFilter) {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous sweep still running, skipping");
            return 0;
        }

        try {
            var now = clock.instant();
            var schedules = loadEnabled(jobTypeFilter);

            if (schedules.isEmpty()) {
                log.debug("No enabled schedules{}", jobTypeFilter != null ? " for job type " + jobTypeFilter : "");
                return 0;
            }

            var dispatched = 0;
            for (var schedule : schedules) {
                try {
                    if (sweepSchedule(schedule, now)) {
                        dispatched++;
                    }
                } catch (Exception e) {
                    // queued marker may stay until the re-arm interval passes
                    log.error("Error sweeping schedule {} ({}): {}",
                            schedule.getId(), schedule.getJobType(), e.getMessage(), e);
                }
            }

            if (dispatched > 0) {
                log.info("Sweep at {} dispatched {} of {} enabled schedules", now, dispatched, schedules.size());
            } else {
                log.debug("Sweep at {} dispatched nothing ({} enabled schedules)", now, schedules.size());
            }
            return dispatched;
        } finally {
            isRunning.set(false);
        }
    }

    private List<JobSchedule> loadEnabled(String jobTypeFilter) {
        if (jobTypeFilter == null || jobTypeFilter.isBlank()) {
            return scheduleRepository.findByEnabledTrue();
        }
        return scheduleRepository.findByEnabledTrueAndJobType(jobTypeFilter.trim());
    }

    /**
     * @return true if the schedule was handed to a worker
     */
    private boolean sweepSchedule(JobSchedule schedule, Instant now) {
        if (!dueEvaluator.isDue(schedule, now)) {
            return false;
        }

        var scheduleId = schedule.getId();
        var jobType = schedule.getJobType();

        if (!runStateTracker.markQueued(scheduleId, now)) {
            return false;
        }

        boolean routed;
        try {
            routed = dispatchRouter.dispatch(jobType, scheduleId);
        } catch (TaskRejectedException e) {
            log.error("Work queue rejected job {} for schedule {}: {}", jobType, scheduleId, e.getMessage());
            runStateTracker.markSkipped(RunStateWriter.SWEEP, scheduleId, "Enqueue rejected: " + e.getMessage());
            metricsConfig.recordSkipped(jobType, "enqueue_rejected");
            return false;
        }

        if (!routed) {
            runStateTracker.markSkipped(RunStateWriter.SWEEP, scheduleId, NO_HANDLER_MESSAGE);
            metricsConfig.recordSkipped(jobType, "no_handler");
            return false;
        }

        log.debug("Dispatched job {} for schedule {}", jobType, scheduleId);
        metricsConfig.recordDispatch(jobType);
        return true;
    }
}
