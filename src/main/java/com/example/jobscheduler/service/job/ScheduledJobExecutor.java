package com.example.jobscheduler.service.job;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.enums.RunStateWriter;
import com.example.jobscheduler.domain.enums.RunStatus;
import com.example.jobscheduler.domain.repository.JobScheduleRepository;
import com.example.jobscheduler.service.lock.OverlapGuard;
import com.example.jobscheduler.service.state.RunStateTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Worker side of a dispatched job.
 * <p>
 * Flow:
 * 1. Resolve the handler and take the overlap lock of its job kind (never waits)
 * 2. Reload the schedule so the handler sees current options
 * 3. Mark RUNNING, run the handler, mark COMPLETED or FAILED
 * <p>
 * A handler exception always ends in a FAILED write carrying the error text.
 * A handler {@link Error} is recorded as FAILED the same way and then rethrown.
 * A held lock ends in SKIPPED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledJobExecutor {

    static final String NO_HANDLER_MESSAGE = "no handler registered";

    private final JobHandlerRegistry handlerRegistry;
    private final JobScheduleRepository scheduleRepository;
    private final RunStateTracker runStateTracker;
    private final OverlapGuard overlapGuard;
    private final JobSchedulerProperties properties;
    private final MetricsConfig metricsConfig;

    /**
     * Execute one queued run of a schedule
     */
    public void execute(String jobType, UUID scheduleId) {
        var handler = handlerRegistry.getHandler(jobType).orElse(null);
        if (handler == null) {
            log.warn("No handler for job type {} (schedule {})", jobType, scheduleId);
            runStateTracker.markSkipped(RunStateWriter.WORKER, scheduleId, NO_HANDLER_MESSAGE);
            metricsConfig.recordSkipped(jobType, "no_handler");
            return;
        }

        var lockName = OverlapGuard.lockNameFor(handler.getJobKind());
        var outcome = new AtomicReference<>(RunStatus.SKIPPED);
        var timerSample = metricsConfig.startJobExecutionTimer();

        try {
            var ran = overlapGuard.withLock(lockName, properties.getLockTtl(),
                    () -> outcome.set(runHandler(handler, jobType, scheduleId)));

            if (!ran) {
                log.info("Job {} for schedule {} skipped: another {} run is in progress",
                        jobType, scheduleId, handler.getJobKind());
                runStateTracker.markSkipped(RunStateWriter.WORKER, scheduleId,
                        "Skipped: another " + handler.getJobKind() + " run is in progress");
                metricsConfig.recordSkipped(jobType, "lock_held");
            }
        } catch (RuntimeException e) {
            // lock or state store failure outside the handler
            log.error("Job {} for schedule {} could not be executed: {}", jobType, scheduleId, e.getMessage(), e);
            outcome.set(RunStatus.FAILED);
            recordFailure(scheduleId, describe(e));
        } catch (Error e) {
            outcome.set(RunStatus.FAILED);
            throw e;
        } finally {
            metricsConfig.recordJobExecution(timerSample, jobType, outcome.get());
        }
    }

    private RunStatus runHandler(ScheduledJobHandler handler, String jobType, UUID scheduleId) {
        var schedule = scheduleRepository.findById(scheduleId).orElse(null);
        if (schedule == null) {
            log.warn("Schedule {} ({}) no longer exists, dropping queued run", scheduleId, jobType);
            return RunStatus.SKIPPED;
        }

        if (!runStateTracker.markRunning(scheduleId)) {
            log.warn("Schedule {} ({}) was not in QUEUED state when its run started", scheduleId, jobType);
        }

        try {
            log.info("Executing job {} for schedule {}", jobType, scheduleId);
            var result = handler.execute(schedule);

            if (result != null && result.isSuccess()) {
                log.info("Job {} for schedule {} completed: {}", jobType, scheduleId, result.getMessage());
                runStateTracker.markCompleted(scheduleId, result.getMessage());
                return RunStatus.COMPLETED;
            }

            var message = result != null ? result.getMessage() : "Handler returned no result";
            log.warn("Job {} for schedule {} reported failure: {}", jobType, scheduleId, message);
            recordFailure(scheduleId, message);
            return RunStatus.FAILED;
        } catch (Exception e) {
            log.error("Job {} for schedule {} failed: {}", jobType, scheduleId, e.getMessage(), e);
            recordFailure(scheduleId, describe(e));
            return RunStatus.FAILED;
        } catch (Error e) {
            log.error("Job {} for schedule {} aborted: {}", jobType, scheduleId, describe(e), e);
            recordFailure(scheduleId, describe(e));
            throw e;
        }
    }

    private void recordFailure(UUID scheduleId, String message) {
        try {
            runStateTracker.markFailed(scheduleId, message);
        } catch (RuntimeException e) {
            log.error("Could not record failure of schedule {} ({}): {}", scheduleId, message, e.getMessage(), e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null && !e.getMessage().isBlank()
                ? e.getMessage()
                : e.getClass().getSimpleName();
    }
}
