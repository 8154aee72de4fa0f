package com.example.jobscheduler.service.notification;

import com.example.jobscheduler.integration.PendingNotification;

import java.util.Map;

/**
 * Outbound notification channel
 */
public interface NotificationChannel {

    /**
     * Ledger key of the channel, e.g. "slack"
     */
    String getName();

    /**
     * False when the channel is switched off or not configured
     */
    boolean isAvailable();

    Map<String, Object> buildPayload(PendingNotification notification);

    /**
     * Send one notification.
     *
     * @return true if the channel accepted it
     * @throws Exception on transport errors; treated like a rejected send
     */
    boolean send(String notificationId, Map<String, Object> payload) throws Exception;
}
