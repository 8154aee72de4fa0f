package com.example.jobscheduler.integration;

import java.util.List;

/**
 * Lookup of connected shops.
 * Used when a schedule has no shop of its own and applies to every eligible shop.
 */
public interface ShopDirectory {

    /**
     * Ids of shops connected through the given storefront provider (e.g. "shoptet", "woocommerce")
     */
    List<Long> findShopIdsByProvider(String provider);
}
