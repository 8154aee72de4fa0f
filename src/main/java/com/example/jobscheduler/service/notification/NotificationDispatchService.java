package com.example.jobscheduler.service.notification;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.DeliveryRecord;
import com.example.jobscheduler.integration.PendingNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Sends notifications through a channel, at most once per (notification, channel).
 * <p>
 * A failed send is logged and left unrecorded, so the next run tries it again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatchService {

    private final NotificationDeliveryLedger deliveryLedger;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * @return number of notifications delivered by this call
     */
    public int dispatch(NotificationChannel channel, List<PendingNotification> notifications) {
        if (!channel.isAvailable()) {
            log.debug("Notification channel {} is disabled or not configured", channel.getName());
            return 0;
        }

        var sent = 0;
        for (var notification : notifications) {
            if (notification.getNotificationId() == null) {
                log.warn("Skipping notification without id (event {})", notification.getEventId());
                continue;
            }
            if (deliver(channel, notification)) {
                sent++;
            }
        }

        if (sent > 0) {
            log.info("Delivered {} notification(s) to {}", sent, channel.getName());
            metricsConfig.recordNotificationsDelivered(channel.getName(), sent);
        }
        return sent;
    }

    private boolean deliver(NotificationChannel channel, PendingNotification notification) {
        var notificationId = notification.getNotificationId();
        if (deliveryLedger.hasDelivered(channel.getName(), notificationId)) {
            return false;
        }

        var payload = channel.buildPayload(notification);
        boolean accepted;
        try {
            accepted = channel.send(notificationId, payload);
        } catch (Exception e) {
            log.warn("Sending notification {} (event {}) to {} failed: {}",
                    notificationId, notification.getEventId(), channel.getName(), e.getMessage());
            return false;
        }

        if (!accepted) {
            return false;
        }

        return deliveryLedger.recordDelivery(DeliveryRecord.builder()
                .notificationId(notificationId)
                .eventId(notification.getEventId())
                .channel(channel.getName())
                .payload(payload)
                .deliveredAt(clock.instant())
                .build());
    }
}
