package com.example.jobscheduler.integration;

import java.util.List;

/**
 * Source of operator notifications to deliver to outbound channels
 */
public interface NotificationFeed {

    /**
     * Recent notifications that are subscribed to the channel.
     * May include notifications already delivered; the delivery ledger filters those.
     */
    List<PendingNotification> findRecent(String channel, int limit);
}
