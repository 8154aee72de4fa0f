package com.example.jobscheduler.service.notification;

import com.example.jobscheduler.config.SlackProperties;
import com.example.jobscheduler.integration.PendingNotification;
import com.slack.api.Slack;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers notifications to a Slack incoming webhook.
 */
@Slf4j
@Component
public class SlackNotificationChannel implements NotificationChannel {

    public static final String CHANNEL_NAME = "slack";

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:job-schedule-engine}")
    private String applicationName;

    public SlackNotificationChannel(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackNotificationChannel(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    @Override
    public String getName() {
        return CHANNEL_NAME;
    }

    @Override
    public boolean isAvailable() {
        return slackProperties.isEnabled()
                && slackProperties.getWebhookUrl() != null
                && !slackProperties.getWebhookUrl().isBlank();
    }

    @Override
    public Map<String, Object> buildPayload(PendingNotification notification) {
        var payload = new LinkedHashMap<String, Object>();
        if (slackProperties.getChannel() != null && !slackProperties.getChannel().isBlank()) {
            payload.put("channel", slackProperties.getChannel());
        }
        var username = slackProperties.getUsername();
        payload.put("username", username == null || username.isBlank() ? applicationName : username);
        payload.put("icon_emoji", slackProperties.getIconEmoji());
        payload.put("text", formatMessage(notification));
        return payload;
    }

    @Override
    public boolean send(String notificationId, Map<String, Object> payload) throws IOException {
        var message = Payload.builder()
                .channel((String) payload.get("channel"))
                .username((String) payload.get("username"))
                .iconEmoji((String) payload.get("icon_emoji"))
                .text((String) payload.get("text"))
                .build();

        var response = slack.send(slackProperties.getWebhookUrl(), message);
        if (response.getCode() != 200) {
            log.warn("Slack rejected notification {}. Response code: {}, body: {}",
                    notificationId, response.getCode(), response.getBody());
            return false;
        }
        return true;
    }

    static String formatMessage(PendingNotification notification) {
        var emoji = switch (notification.getSeverity() == null ? "info" : notification.getSeverity()) {
            case "success" -> ":white_check_mark:";
            case "warning" -> ":warning:";
            case "error" -> ":x:";
            default -> ":information_source:";
        };

        var title = notification.getTitle() == null || notification.getTitle().isBlank()
                ? "Notification"
                : notification.getTitle().trim();

        var lines = new ArrayList<String>();
        lines.add(String.format("%s *%s*", emoji, title));
        if (notification.getMessage() != null && !notification.getMessage().isBlank()) {
            lines.add(notification.getMessage().trim());
        }
        if (notification.getModule() != null && !notification.getModule().isBlank()) {
            lines.add("_" + notification.getModule() + "_");
        }
        var shopName = notification.getMetadata() != null ? notification.getMetadata().get("shop_name") : null;
        if (shopName != null && !shopName.toString().isBlank()) {
            lines.add("Shop: " + shopName);
        }
        return String.join("\n", lines);
    }
}
