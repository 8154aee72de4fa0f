package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Components allowed to write run-state fields, and what each may write.
 */
@Getter
@RequiredArgsConstructor
public enum RunStateWriter {

    /**
     * The sweep queues due schedules and skips unroutable ones.
     */
    SWEEP(EnumSet.of(RunStatus.QUEUED, RunStatus.SKIPPED)),

    /**
     * The worker reports what happened to a queued run.
     */
    WORKER(EnumSet.of(RunStatus.RUNNING, RunStatus.COMPLETED, RunStatus.FAILED, RunStatus.SKIPPED));

    private final Set<RunStatus> writableStatuses;

    public boolean mayWrite(RunStatus status) {
        return writableStatuses.contains(status);
    }
}
