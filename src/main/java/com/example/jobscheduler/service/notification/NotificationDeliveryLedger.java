package com.example.jobscheduler.service.notification;

import com.example.jobscheduler.domain.entity.DeliveryRecord;
import com.example.jobscheduler.domain.repository.NotificationDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Idempotency ledger of outbound notifications.
 * <p>
 * {@link #hasDelivered(String, String)} is a fast path; the insert in
 * {@link #recordDelivery(DeliveryRecord)} is the authority, and losing a race there
 * simply means another dispatcher delivered first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDeliveryLedger {

    private final NotificationDeliveryRepository deliveryRepository;

    public boolean hasDelivered(String channel, String notificationId) {
        return deliveryRepository.exists(channel, notificationId);
    }

    /**
     * @return true if this call recorded the delivery, false if it was already recorded
     */
    public boolean recordDelivery(DeliveryRecord record) {
        var inserted = deliveryRepository.insertIfAbsent(record);
        if (!inserted) {
            log.debug("Notification {} already recorded as delivered on {}",
                    record.getNotificationId(), record.getChannel());
        }
        return inserted;
    }
}
