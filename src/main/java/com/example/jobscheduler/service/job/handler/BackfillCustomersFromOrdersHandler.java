package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.integration.CustomerGateway;
import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import com.example.jobscheduler.service.job.JobExecutionResult;
import com.example.jobscheduler.service.job.ScheduledJobHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import static com.example.jobscheduler.service.job.handler.RecalculateCustomerMetricsHandler.textOption;

/**
 * Handler for customers.backfill_from_orders.
 * Limited to the schedule's shop when set, otherwise covers orders of every shop.
 */
@Component
@RequiredArgsConstructor
public class BackfillCustomersFromOrdersHandler implements ScheduledJobHandler {

    private final ObjectProvider<CustomerGateway> customers;

    @Override
    public String getJobType() {
        return JobTypeCatalog.CUSTOMERS_BACKFILL_FROM_ORDERS;
    }

    @Override
    public JobExecutionResult execute(JobSchedule schedule) {
        var queue = textOption(schedule, "queue", "customers");
        var chunk = Math.min(2000, Math.max(10, schedule.getIntOption("chunk", 200)));

        var chunks = Collaborators.require(customers, CustomerGateway.class, getJobType())
                .dispatchBackfillFromOrders(schedule.getShopId(), queue, chunk);

        if (chunks == 0) {
            return JobExecutionResult.completed("No orders without a customer profile");
        }
        return JobExecutionResult.completed(String.format("Dispatched %d backfill chunk(s) to queue %s", chunks, queue));
    }
}
