package com.example.jobscheduler.integration;

/**
 * Inventory aggregates computed from synchronised products and orders
 */
public interface InventoryGateway {

    /**
     * Refresh stock guard data for all tracked variants
     *
     * @return number of variants processed
     */
    int syncStockGuard(int chunkSize);

    /**
     * Regenerate related-product recommendations
     *
     * @return number of products processed
     */
    int generateRecommendations(int productLimit, int recommendationLimit, int chunkSize);
}
