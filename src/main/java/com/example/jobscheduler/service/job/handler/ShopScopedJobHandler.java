package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.exception.JobExecutionException;
import com.example.jobscheduler.integration.ShopDirectory;
import com.example.jobscheduler.integration.SyncOutcome;
import com.example.jobscheduler.service.job.JobExecutionResult;
import com.example.jobscheduler.service.job.ScheduledJobHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for jobs that synchronise one shop at a time.
 * <p>
 * A schedule bound to a shop syncs that shop; otherwise every shop of the provider is synced.
 * A failing shop does not stop the others, but fails the run once all shops were tried.
 */
@Slf4j
public abstract class ShopScopedJobHandler implements ScheduledJobHandler {

    private final ObjectProvider<ShopDirectory> shopDirectory;

    protected ShopScopedJobHandler(ObjectProvider<ShopDirectory> shopDirectory) {
        this.shopDirectory = shopDirectory;
    }

    /**
     * Storefront provider whose shops are eligible when the schedule has no shop
     */
    protected abstract String getProvider();

    /**
     * Plural noun for the summary, e.g. "orders"
     */
    protected abstract String getItemName();

    protected abstract SyncOutcome syncShop(JobSchedule schedule, long shopId);

    @Override
    public JobExecutionResult execute(JobSchedule schedule) {
        var shopIds = resolveShopIds(schedule);
        var processedShops = 0;
        var skippedShops = 0;
        var items = 0;
        var failures = new LinkedHashMap<Long, String>();

        for (var shopId : shopIds) {
            try {
                var outcome = syncShop(schedule, shopId);
                if (outcome.isProcessed()) {
                    processedShops++;
                    items += outcome.getItemCount();
                } else {
                    skippedShops++;
                    log.info("{} skipped shop {}: sync already in progress", schedule.getJobType(), shopId);
                }
            } catch (RuntimeException e) {
                log.error("{} failed for shop {}: {}", schedule.getJobType(), shopId, e.getMessage(), e);
                failures.put(shopId, e.getMessage());
            }
        }

        if (!failures.isEmpty()) {
            throw new JobExecutionException(schedule.getJobType(), String.format(
                    "Failed for %d of %d shop(s): %s", failures.size(), shopIds.size(), describe(failures)));
        }

        Map<String, Object> details = Map.of(
                "shops", shopIds.size(),
                "processedShops", processedShops,
                "skippedShops", skippedShops,
                getItemName(), items);

        if (processedShops == 0) {
            return JobExecutionResult.completed("No shop synchronised (sync in progress or no eligible shop)", details);
        }
        return JobExecutionResult.completed(
                String.format("%d %s synchronised for %d shop(s)", items, getItemName(), processedShops), details);
    }

    private List<Long> resolveShopIds(JobSchedule schedule) {
        if (schedule.getShopId() != null) {
            return List.of(schedule.getShopId());
        }
        return Collaborators.require(shopDirectory, ShopDirectory.class, schedule.getJobType())
                .findShopIdsByProvider(getProvider());
    }

    private static String describe(Map<Long, String> failures) {
        var parts = failures.entrySet().stream()
                .map(entry -> "shop " + entry.getKey() + ": " + entry.getValue())
                .toList();
        return String.join("; ", parts);
    }

    /**
     * Read an integer option no lower than {@code min}
     */
    protected static int intOption(JobSchedule schedule, String key, int fallback, int min) {
        return Math.max(min, schedule.getIntOption(key, fallback));
    }
}
