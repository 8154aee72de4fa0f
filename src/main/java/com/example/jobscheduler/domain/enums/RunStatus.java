package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Outcome of the most recent run of a job schedule.
 * <p>
 * Transitions form a small state machine over one schedule row:
 * <pre>
 * (none) | any -> QUEUED                 (gated by the re-arm interval)
 * QUEUED       -> RUNNING | SKIPPED | FAILED
 * RUNNING      -> COMPLETED | FAILED
 * </pre>
 * A row that is in flight (QUEUED or RUNNING) is only queued again once it has been
 * untouched for longer than the overlap lock TTL, so a long run keeps its row until
 * it writes its own outcome.
 */
@Getter
@RequiredArgsConstructor
public enum RunStatus {

    /**
     * Handed to the work queue by the sweep, not yet picked up by a worker.
     */
    QUEUED("queued", "Queued", false),

    /**
     * A worker holds the job kind lock and is executing the handler.
     */
    RUNNING("running", "Running", false),

    /**
     * Handler finished without throwing.
     */
    COMPLETED("completed", "Completed", true),

    /**
     * Handler threw, or the worker could not run it.
     */
    FAILED("failed", "Failed", true),

    /**
     * Nothing was executed: no handler registered, or another run of the same kind was active.
     */
    SKIPPED("skipped", "Skipped", true);

    private final String code;
    private final String displayName;

    /**
     * Whether the run has ended in this status
     */
    private final boolean terminal;

    /**
     * Find RunStatus by its code value
     */
    public static RunStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }

    /**
     * Statuses a row may currently hold for a write of this status to be accepted.
     * {@link #QUEUED} additionally accepts a row that has never run.
     */
    public Set<RunStatus> allowedPredecessors() {
        return switch (this) {
            case QUEUED -> EnumSet.allOf(RunStatus.class);
            case RUNNING, SKIPPED -> EnumSet.of(QUEUED);
            case COMPLETED -> EnumSet.of(RUNNING);
            case FAILED -> EnumSet.of(QUEUED, RUNNING);
        };
    }

    /**
     * Statuses whose row is not re-queued until it goes stale
     */
    public static Set<RunStatus> inFlight() {
        return EnumSet.of(QUEUED, RUNNING);
    }

    /**
     * Check if a row in {@code current} status may move to this status
     */
    public boolean canTransitionFrom(RunStatus current) {
        if (current == null) {
            return this == QUEUED;
        }
        return allowedPredecessors().contains(current);
    }
}
