package com.example.jobscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack incoming-webhook settings for the notification dispatch job.
 * Delivery is off until both {@code enabled} and {@code webhookUrl} are set.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {

    private String webhookUrl;

    /**
     * Channel override sent with each message; the webhook's own channel applies when blank
     */
    private String channel = "#backoffice-notifications";

    /**
     * Display name of the posting bot; falls back to the application name
     */
    private String username;

    private String iconEmoji = ":bell:";

    private boolean enabled = false;
}
