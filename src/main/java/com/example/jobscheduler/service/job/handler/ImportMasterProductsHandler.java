package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.integration.ShopDirectory;
import com.example.jobscheduler.integration.StorefrontGateway;
import com.example.jobscheduler.integration.SyncOutcome;
import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Handler for products.import_master
 */
@Component
public class ImportMasterProductsHandler extends ShopScopedJobHandler {

    private final ObjectProvider<StorefrontGateway> storefront;

    public ImportMasterProductsHandler(ObjectProvider<ShopDirectory> shopDirectory, ObjectProvider<StorefrontGateway> storefront) {
        super(shopDirectory);
        this.storefront = storefront;
    }

    @Override
    public String getJobType() {
        return JobTypeCatalog.PRODUCTS_IMPORT_MASTER;
    }

    @Override
    protected String getProvider() {
        return "shoptet";
    }

    @Override
    protected String getItemName() {
        return "products";
    }

    @Override
    protected SyncOutcome syncShop(JobSchedule schedule, long shopId) {
        var hours = intOption(schedule, "fallback_lookback_hours", 168, 1);
        return Collaborators.require(storefront, StorefrontGateway.class, getJobType()).importMasterProducts(shopId, hours);
    }
}
