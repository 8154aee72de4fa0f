package com.example.jobscheduler.service.job;

import com.example.jobscheduler.domain.entity.JobSchedule;

import java.util.Set;

/**
 * Interface for scheduled job handlers.
 * <p>
 * Each routable job type has exactly one handler. Handlers should:
 * - Be stateless
 * - Read options from the schedule they are given, which is loaded fresh for every run
 * - Return a short operator-facing summary, or throw with a readable message on failure
 * - Not manage locking or run state (handled by the executor)
 */
public interface ScheduledJobHandler {

    /**
     * Primary job type this handler runs
     */
    String getJobType();

    /**
     * Further job types served by the same handler, e.g. a deep variant with other defaults
     */
    default Set<String> getAdditionalJobTypes() {
        return Set.of();
    }

    /**
     * Family of work used as the overlap lock key.
     * Job types sharing a kind never run concurrently.
     */
    default String getJobKind() {
        return getJobType();
    }

    /**
     * Execute one run for the schedule
     */
    JobExecutionResult execute(JobSchedule schedule);
}
