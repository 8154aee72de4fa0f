package com.example.jobscheduler.integration;

/**
 * Customer aggregate maintenance.
 * Both operations split the work into chunks on the given queue and return the number of chunks dispatched.
 */
public interface CustomerGateway {

    int dispatchMetricsRecalculation(String queue, int chunkSize);

    /**
     * @param shopId shop to backfill, or null for orders of every shop
     */
    int dispatchBackfillFromOrders(Long shopId, String queue, int chunkSize);
}
