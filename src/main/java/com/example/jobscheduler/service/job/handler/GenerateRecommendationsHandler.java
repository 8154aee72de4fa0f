package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.integration.InventoryGateway;
import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import com.example.jobscheduler.service.job.JobExecutionResult;
import com.example.jobscheduler.service.job.ScheduledJobHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Handler for inventory.generate_recommendations.
 * <p>
 * Options:
 * - product_limit: products per recommendation set source (default 10)
 * - limit: recommendations kept per product (default 6)
 * - chunk: products per batch (default 50)
 */
@Component
@RequiredArgsConstructor
public class GenerateRecommendationsHandler implements ScheduledJobHandler {

    private final ObjectProvider<InventoryGateway> inventory;

    @Override
    public String getJobType() {
        return JobTypeCatalog.INVENTORY_GENERATE_RECOMMENDATIONS;
    }

    @Override
    public JobExecutionResult execute(JobSchedule schedule) {
        var productLimit = Math.max(1, schedule.getIntOption("product_limit", 10));
        var limit = Math.max(1, schedule.getIntOption("limit", 6));
        var chunk = Math.max(1, schedule.getIntOption("chunk", 50));

        var products = Collaborators.require(inventory, InventoryGateway.class, getJobType())
                .generateRecommendations(productLimit, limit, chunk);
        return JobExecutionResult.completed(String.format("Recommendations generated for %d product(s)", products));
    }
}
