package com.example.jobscheduler.service.dispatch;

import java.util.UUID;

/**
 * Asynchronous hand-off of a schedule run to a worker.
 * Fire-and-forget: enqueue returns before the job starts.
 */
public interface JobWorkQueue {

    /**
     * @throws org.springframework.core.task.TaskRejectedException if the queue cannot accept more work
     */
    void enqueue(String jobType, UUID scheduleId);
}
