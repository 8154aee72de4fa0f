package com.example.jobscheduler.integration;

/**
 * Order synchronisation with WooCommerce stores
 */
public interface WooCommerceGateway {

    SyncOutcome fetchOrders(long shopId, int lookbackHours, int perPage, int maxPages);
}
