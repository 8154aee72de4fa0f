package com.example.jobscheduler.integration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Notification as produced by the feed, before channel-specific formatting
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingNotification {

    private String notificationId;
    private String eventId;
    private String title;
    private String message;

    /**
     * info, success, warning or error
     */
    private String severity;

    private String module;
    private Map<String, Object> metadata;
}
