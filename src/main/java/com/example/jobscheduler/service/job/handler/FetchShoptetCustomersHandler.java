package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.integration.ShopDirectory;
import com.example.jobscheduler.integration.StorefrontGateway;
import com.example.jobscheduler.integration.SyncOutcome;
import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import com.example.jobscheduler.service.retry.FailedSnapshotRetrySweep;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Handler for customers.fetch_shoptet.
 * Only requests the snapshot; processing happens in the snapshot pipeline,
 * so it shares that pipeline's job kind with the retry sweep.
 */
@Component
public class FetchShoptetCustomersHandler extends ShopScopedJobHandler {

    private final ObjectProvider<StorefrontGateway> storefront;

    public FetchShoptetCustomersHandler(ObjectProvider<ShopDirectory> shopDirectory, ObjectProvider<StorefrontGateway> storefront) {
        super(shopDirectory);
        this.storefront = storefront;
    }

    @Override
    public String getJobType() {
        return JobTypeCatalog.CUSTOMERS_FETCH_SHOPTET;
    }

    @Override
    public String getJobKind() {
        return FailedSnapshotRetrySweep.SNAPSHOT_JOB_KIND;
    }

    @Override
    protected String getProvider() {
        return "shoptet";
    }

    @Override
    protected String getItemName() {
        return "snapshots";
    }

    @Override
    protected SyncOutcome syncShop(JobSchedule schedule, long shopId) {
        return Collaborators.require(storefront, StorefrontGateway.class, getJobType()).requestCustomersSnapshot(shopId);
    }
}
