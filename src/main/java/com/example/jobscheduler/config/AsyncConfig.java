package com.example.jobscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration of the worker pool that executes dispatched jobs.
 * <p>
 * The sweep only enqueues; jobs run here so that a long import never
 * delays evaluation of the remaining schedules.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    /**
     * Bounded worker pool for scheduled jobs.
     * A saturated pool rejects the work instead of running it on the sweep thread.
     */
    @Bean(name = "jobWorkerExecutor")
    public ThreadPoolTaskExecutor jobWorkerExecutor(JobSchedulerProperties properties) {
        log.info("Creating job worker executor with {} threads and queue capacity {}",
                properties.getWorkerPoolSize(), properties.getWorkerQueueCapacity());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());
        executor.setQueueCapacity(properties.getWorkerQueueCapacity());
        executor.setThreadNamePrefix("job-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        return executor;
    }
}
