package com.example.jobscheduler.service.dispatch;

import com.example.jobscheduler.service.job.ScheduledJobExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * In-process work queue backed by the bounded job worker pool
 */
@Slf4j
@Component
public class ExecutorJobWorkQueue implements JobWorkQueue {

    private final TaskExecutor jobWorkerExecutor;
    private final ScheduledJobExecutor jobExecutor;

    public ExecutorJobWorkQueue(@Qualifier("jobWorkerExecutor") TaskExecutor jobWorkerExecutor,
                                ScheduledJobExecutor jobExecutor) {
        this.jobWorkerExecutor = jobWorkerExecutor;
        this.jobExecutor = jobExecutor;
    }

    @Override
    public void enqueue(String jobType, UUID scheduleId) {
        jobWorkerExecutor.execute(() -> jobExecutor.execute(jobType, scheduleId));
        log.debug("Enqueued job {} for schedule {}", jobType, scheduleId);
    }
}
