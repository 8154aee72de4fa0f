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
 * Handler for inventory.stock_guard_sync
 */
@Component
@RequiredArgsConstructor
public class StockGuardSyncHandler implements ScheduledJobHandler {

    private final ObjectProvider<InventoryGateway> inventory;

    @Override
    public String getJobType() {
        return JobTypeCatalog.INVENTORY_STOCK_GUARD_SYNC;
    }

    @Override
    public JobExecutionResult execute(JobSchedule schedule) {
        var chunk = Math.max(1, schedule.getIntOption("chunk", 200));
        var variants = Collaborators.require(inventory, InventoryGateway.class, getJobType()).syncStockGuard(chunk);
        return JobExecutionResult.completed(String.format("Stock levels refreshed for %d variant(s)", variants));
    }
}
