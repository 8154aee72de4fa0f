package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.integration.ShopDirectory;
import com.example.jobscheduler.integration.StorefrontGateway;
import com.example.jobscheduler.integration.SyncOutcome;
import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Handler for orders.fetch_new.
 * <p>
 * Options:
 * - fallback_lookback_hours: window used when a shop has no sync cursor yet (default 24)
 */
@Component
public class FetchNewOrdersHandler extends ShopScopedJobHandler {

    private final ObjectProvider<StorefrontGateway> storefront;

    public FetchNewOrdersHandler(ObjectProvider<ShopDirectory> shopDirectory, ObjectProvider<StorefrontGateway> storefront) {
        super(shopDirectory);
        this.storefront = storefront;
    }

    @Override
    public String getJobType() {
        return JobTypeCatalog.ORDERS_FETCH_NEW;
    }

    @Override
    protected String getProvider() {
        return "shoptet";
    }

    @Override
    protected String getItemName() {
        return "orders";
    }

    @Override
    protected SyncOutcome syncShop(JobSchedule schedule, long shopId) {
        var hours = intOption(schedule, "fallback_lookback_hours", 24, 1);
        return Collaborators.require(storefront, StorefrontGateway.class, getJobType()).fetchNewOrders(shopId, hours);
    }
}
