package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.exception.JobExecutionException;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Resolution of optional integration beans at execution time
 */
final class Collaborators {

    private Collaborators() {
    }

    /**
     * @throws JobExecutionException if no bean is configured, so the run is recorded as failed
     */
    static <T> T require(ObjectProvider<T> provider, Class<T> type, String jobType) {
        var collaborator = provider.getIfAvailable();
        if (collaborator == null) {
            throw new JobExecutionException(jobType, "No " + type.getSimpleName() + " is configured for " + jobType);
        }
        return collaborator;
    }
}
