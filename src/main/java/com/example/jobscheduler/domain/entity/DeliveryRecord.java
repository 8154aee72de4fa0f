package com.example.jobscheduler.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Row of the notification delivery ledger.
 * (notificationId, channel) is unique: a notification is delivered at most once per channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryRecord {

    private String notificationId;
    private String eventId;
    private String channel;

    /**
     * What was sent, kept for audit
     */
    private Map<String, Object> payload;

    private Instant deliveredAt;
}
