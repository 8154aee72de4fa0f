package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.integration.CustomerGateway;
import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import com.example.jobscheduler.service.job.JobExecutionResult;
import com.example.jobscheduler.service.job.ScheduledJobHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Handler for customers.recalculate_metrics.
 * Splits all customers into chunks on the metrics queue.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecalculateCustomerMetricsHandler implements ScheduledJobHandler {

    private final ObjectProvider<CustomerGateway> customers;

    @Override
    public String getJobType() {
        return JobTypeCatalog.CUSTOMERS_RECALCULATE_METRICS;
    }

    @Override
    public JobExecutionResult execute(JobSchedule schedule) {
        var queue = textOption(schedule, "queue", "customers_metrics");
        var chunk = Math.min(5000, Math.max(1, schedule.getIntOption("chunk", 250)));

        var chunks = Collaborators.require(customers, CustomerGateway.class, getJobType())
                .dispatchMetricsRecalculation(queue, chunk);

        log.info("Dispatched {} customer metrics chunk(s) of {} to queue {}", chunks, chunk, queue);
        return JobExecutionResult.completed(String.format("Dispatched %d chunk(s) to queue %s", chunks, queue));
    }

    static String textOption(JobSchedule schedule, String key, String fallback) {
        var value = schedule.getOptionValue(key, String.class);
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
