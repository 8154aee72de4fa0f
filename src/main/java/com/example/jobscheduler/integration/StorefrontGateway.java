package com.example.jobscheduler.integration;

/**
 * Synchronisation with the Shoptet storefront API.
 * <p>
 * Implementations own their per-shop sync cursors and pipeline locks;
 * a shop that is already being synchronised is reported as skipped, not as an error.
 */
public interface StorefrontGateway {

    /**
     * Pull orders changed since the shop's cursor, or within the fallback window when there is none
     */
    SyncOutcome fetchNewOrders(long shopId, int fallbackLookbackHours);

    /**
     * Re-read statuses of orders created within the lookback window
     */
    SyncOutcome refreshOrderStatuses(long shopId, int lookbackHours);

    /**
     * Import the master product catalogue changed since the shop's cursor
     */
    SyncOutcome importMasterProducts(long shopId, int fallbackLookbackHours);

    /**
     * Request a customers snapshot; the snapshot arrives later through a webhook
     */
    SyncOutcome requestCustomersSnapshot(long shopId);
}
