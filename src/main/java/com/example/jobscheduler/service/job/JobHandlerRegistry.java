package com.example.jobscheduler.service.job;

import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry for scheduled job handlers.
 * <p>
 * Discovers all ScheduledJobHandler beans at startup; adding a job type means
 * adding a handler bean. Lookups by unknown job type return empty.
 */
@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<String, ScheduledJobHandler> handlers = new HashMap<>();
    private final List<ScheduledJobHandler> handlerBeans;
    private final JobTypeCatalog catalog;

    public JobHandlerRegistry(List<ScheduledJobHandler> handlerBeans, JobTypeCatalog catalog) {
        this.handlerBeans = handlerBeans;
        this.catalog = catalog;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            register(handler.getJobType(), handler);
            for (var jobType : handler.getAdditionalJobTypes()) {
                register(jobType, handler);
            }
        }

        for (var definition : catalog.all()) {
            if (!handlers.containsKey(definition.getJobType())) {
                log.warn("No handler registered for job type: {}", definition.getJobType());
            }
        }
    }

    private void register(String jobType, ScheduledJobHandler handler) {
        if (handlers.containsKey(jobType)) {
            log.warn("Duplicate handler for job type {}: {} will override {}",
                    jobType, handler.getClass().getSimpleName(),
                    handlers.get(jobType).getClass().getSimpleName());
        }
        handlers.put(jobType, handler);
        log.info("Registered handler for job type {} (kind {}): {}",
                jobType, handler.getJobKind(), handler.getClass().getSimpleName());
    }

    public Optional<ScheduledJobHandler> getHandler(String jobType) {
        return jobType == null ? Optional.empty() : Optional.ofNullable(handlers.get(jobType));
    }

    public boolean hasHandler(String jobType) {
        return jobType != null && handlers.containsKey(jobType);
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
