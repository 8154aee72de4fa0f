package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.integration.ShopDirectory;
import com.example.jobscheduler.integration.SyncOutcome;
import com.example.jobscheduler.integration.WooCommerceGateway;
import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Handler for woocommerce.fetch_orders.
 * <p>
 * Options:
 * - lookback_hours (default 24)
 * - per_page: orders per API page, capped at 100 (default 50)
 * - max_pages: pages per shop and run (default 50)
 */
@Component
public class FetchWooCommerceOrdersHandler extends ShopScopedJobHandler {

    private final ObjectProvider<WooCommerceGateway> wooCommerce;

    public FetchWooCommerceOrdersHandler(ObjectProvider<ShopDirectory> shopDirectory, ObjectProvider<WooCommerceGateway> wooCommerce) {
        super(shopDirectory);
        this.wooCommerce = wooCommerce;
    }

    @Override
    public String getJobType() {
        return JobTypeCatalog.WOOCOMMERCE_FETCH_ORDERS;
    }

    @Override
    protected String getProvider() {
        return "woocommerce";
    }

    @Override
    protected String getItemName() {
        return "orders";
    }

    @Override
    protected SyncOutcome syncShop(JobSchedule schedule, long shopId) {
        var lookbackHours = intOption(schedule, "lookback_hours", 24, 1);
        var perPage = Math.min(100, intOption(schedule, "per_page", 50, 1));
        var maxPages = intOption(schedule, "max_pages", 50, 1);
        return Collaborators.require(wooCommerce, WooCommerceGateway.class, getJobType())
                .fetchOrders(shopId, lookbackHours, perPage, maxPages);
    }
}
