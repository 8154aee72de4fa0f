package com.example.jobscheduler.service.dispatch;

import com.example.jobscheduler.service.job.JobHandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Routes a schedule's job type to the work queue.
 * <p>
 * Only the schedule id travels with the work; the handler reloads the schedule when it runs.
 * Unknown job types are reported, never thrown, so one bad schedule cannot stop a sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobDispatchRouter {

    private final JobHandlerRegistry handlerRegistry;
    private final JobWorkQueue workQueue;

    /**
     * @return true if the run was enqueued, false if no handler exists for the job type
     */
    public boolean dispatch(String jobType, UUID scheduleId) {
        if (!handlerRegistry.hasHandler(jobType)) {
            log.warn("No handler registered for job type {} (schedule {})", jobType, scheduleId);
            return false;
        }

        workQueue.enqueue(jobType, scheduleId);
        return true;
    }
}
