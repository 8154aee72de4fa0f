package com.example.jobscheduler.service.state;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.enums.RunStateWriter;
import com.example.jobscheduler.domain.enums.RunStatus;
import com.example.jobscheduler.domain.repository.JobScheduleRepository;
import com.example.jobscheduler.exception.InvalidRunStateTransitionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Sole writer of the run-state fields of job schedules.
 * <p>
 * The sweep writes QUEUED and SKIPPED, the worker writes RUNNING, COMPLETED, FAILED and SKIPPED.
 * Every write is one conditional UPDATE guarded by {@link RunStatus#allowedPredecessors()};
 * a write the current row state does not allow is dropped and reported as {@code false}.
 * <p>
 * A schedule whose run is still queued or running is not queued again until the row has
 * been idle for the lock TTL, so the sweep never takes a row away from a live worker.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunStateTracker {

    static final int MAX_MESSAGE_LENGTH = 1000;
    static final String DEFAULT_FAILURE_MESSAGE = "Job failed without an error message";

    private final JobScheduleRepository scheduleRepository;
    private final RearmWindow rearmWindow;
    private final JobSchedulerProperties properties;
    private final Clock clock;

    /**
     * Queue the schedule unless it was already queued within the re-arm interval
     * or its previous run has not finished.
     *
     * @return true if this call queued it
     */
    @Transactional
    public boolean markQueued(UUID scheduleId, Instant now) {
        requireWritable(RunStateWriter.SWEEP, RunStatus.QUEUED);
        var rows = scheduleRepository.markQueued(scheduleId, RunStatus.QUEUED, now, rearmWindow.threshold(now),
                RunStatus.inFlight(), now.minus(properties.getLockTtl()));
        if (rows == 0) {
            log.debug("Schedule {} not queued: disabled, missing, within re-arm interval or still running", scheduleId);
        }
        return rows > 0;
    }

    @Transactional
    public boolean markSkipped(RunStateWriter writer, UUID scheduleId, String message) {
        return transition(writer, scheduleId, RunStatus.SKIPPED, truncate(message));
    }

    @Transactional
    public boolean markRunning(UUID scheduleId) {
        return transition(RunStateWriter.WORKER, scheduleId, RunStatus.RUNNING, null);
    }

    @Transactional
    public boolean markCompleted(UUID scheduleId, String summary) {
        return transition(RunStateWriter.WORKER, scheduleId, RunStatus.COMPLETED, truncate(summary));
    }

    /**
     * Record a failed run. The message is never empty so operators always see a reason.
     */
    @Transactional
    public boolean markFailed(UUID scheduleId, String errorMessage) {
        var message = errorMessage == null || errorMessage.isBlank() ? DEFAULT_FAILURE_MESSAGE : errorMessage;
        return transition(RunStateWriter.WORKER, scheduleId, RunStatus.FAILED, truncate(message));
    }

    private boolean transition(RunStateWriter writer, UUID scheduleId, RunStatus status, String message) {
        requireWritable(writer, status);

        var now = clock.instant();
        var endedAt = status.isTerminal() ? now : null;
        var rows = scheduleRepository.updateRunState(
                scheduleId, status, message, endedAt, status.allowedPredecessors(), now);

        if (rows == 0) {
            log.warn("Run state {} for schedule {} not written: schedule missing or in a state that does not allow it",
                    status, scheduleId);
            return false;
        }
        return true;
    }

    private void requireWritable(RunStateWriter writer, RunStatus status) {
        if (!writer.mayWrite(status)) {
            throw new InvalidRunStateTransitionException(writer, status);
        }
    }

    static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
    }
}
