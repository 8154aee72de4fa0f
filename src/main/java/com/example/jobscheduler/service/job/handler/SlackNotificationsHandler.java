package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.integration.NotificationFeed;
import com.example.jobscheduler.service.catalog.JobTypeCatalog;
import com.example.jobscheduler.service.job.JobExecutionResult;
import com.example.jobscheduler.service.job.ScheduledJobHandler;
import com.example.jobscheduler.service.notification.NotificationDispatchService;
import com.example.jobscheduler.service.notification.SlackNotificationChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Handler for notifications.dispatch_slack.
 * Delivery is idempotent per notification, so overlapping feeds are harmless.
 */
@Component
@RequiredArgsConstructor
public class SlackNotificationsHandler implements ScheduledJobHandler {

    private final ObjectProvider<NotificationFeed> notificationFeed;
    private final NotificationDispatchService dispatchService;
    private final SlackNotificationChannel slackChannel;

    @Override
    public String getJobType() {
        return JobTypeCatalog.NOTIFICATIONS_DISPATCH_SLACK;
    }

    @Override
    public JobExecutionResult execute(JobSchedule schedule) {
        if (!slackChannel.isAvailable()) {
            return JobExecutionResult.completed("Slack delivery is disabled or has no webhook configured");
        }

        var limit = Math.min(500, Math.max(1, schedule.getIntOption("limit", 50)));
        var notifications = Collaborators.require(notificationFeed, NotificationFeed.class, getJobType())
                .findRecent(slackChannel.getName(), limit);

        var sent = dispatchService.dispatch(slackChannel, notifications);
        return JobExecutionResult.completed(String.format("Delivered %d of %d notification(s)", sent, notifications.size()));
    }
}
