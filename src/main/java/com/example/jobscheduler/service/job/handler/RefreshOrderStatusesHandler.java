package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.integration.ShopDirectory;
import com.example.jobscheduler.integration.StorefrontGateway;
import com.example.jobscheduler.integration.SyncOutcome;
import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Handler for orders.refresh_statuses and its daily deep variant.
 * Both share one job kind, so a deep refresh never overlaps a regular one.
 * <p>
 * Options:
 * - lookback_hours: age of the oldest order re-checked (default 48, deep variant 720)
 */
@Component
public class RefreshOrderStatusesHandler extends ShopScopedJobHandler {

    private static final int DEFAULT_LOOKBACK_HOURS = 48;
    private static final int DEEP_LOOKBACK_HOURS = 720;

    private final ObjectProvider<StorefrontGateway> storefront;

    public RefreshOrderStatusesHandler(ObjectProvider<ShopDirectory> shopDirectory, ObjectProvider<StorefrontGateway> storefront) {
        super(shopDirectory);
        this.storefront = storefront;
    }

    @Override
    public String getJobType() {
        return JobTypeCatalog.ORDERS_REFRESH_STATUSES;
    }

    @Override
    public Set<String> getAdditionalJobTypes() {
        return Set.of(JobTypeCatalog.ORDERS_REFRESH_STATUSES_DEEP);
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
        var fallback = JobTypeCatalog.ORDERS_REFRESH_STATUSES_DEEP.equals(schedule.getJobType())
                ? DEEP_LOOKBACK_HOURS
                : DEFAULT_LOOKBACK_HOURS;
        var hours = Math.min(DEEP_LOOKBACK_HOURS, intOption(schedule, "lookback_hours", fallback, 1));
        return Collaborators.require(storefront, StorefrontGateway.class, getJobType()).refreshOrderStatuses(shopId, hours);
    }
}
