package com.example.jobscheduler.service.catalog;

import com.example.jobscheduler.domain.enums.ScheduleFrequency;
import com.example.jobscheduler.exception.UnknownJobTypeException;
import com.example.jobscheduler.service.catalog.JobTypeDefinition.IntRange;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Catalog of job types operators can schedule.
 * <p>
 * A job type listed here but without a registered handler can still be scheduled;
 * the sweep records such schedules as skipped.
 */
@Component
public class JobTypeCatalog {

    public static final String DEFAULT_TIMEZONE = "Europe/Prague";

    public static final String ORDERS_FETCH_NEW = "orders.fetch_new";
    public static final String ORDERS_REFRESH_STATUSES = "orders.refresh_statuses";
    public static final String ORDERS_REFRESH_STATUSES_DEEP = "orders.refresh_statuses_deep";
    public static final String PRODUCTS_IMPORT_MASTER = "products.import_master";
    public static final String PRODUCTS_SYNC_ALL_SHOPS = "products.sync_all_shops";
    public static final String CUSTOMERS_RECALCULATE_METRICS = "customers.recalculate_metrics";
    public static final String CUSTOMERS_BACKFILL_FROM_ORDERS = "customers.backfill_from_orders";
    public static final String CUSTOMERS_FETCH_SHOPTET = "customers.fetch_shoptet";
    public static final String WOOCOMMERCE_FETCH_ORDERS = "woocommerce.fetch_orders";
    public static final String INVENTORY_STOCK_GUARD_SYNC = "inventory.stock_guard_sync";
    public static final String INVENTORY_GENERATE_RECOMMENDATIONS = "inventory.generate_recommendations";
    public static final String NOTIFICATIONS_DISPATCH_SLACK = "notifications.dispatch_slack";

    private static final IntRange LOOKBACK_HOURS = IntRange.between(1, 720);

    private final Map<String, JobTypeDefinition> definitions = new LinkedHashMap<>();

    public JobTypeCatalog() {
        register(JobTypeDefinition.builder()
                .jobType(ORDERS_FETCH_NEW)
                .label("Fetch new orders")
                .description("Pulls new orders from connected storefronts into the back-office.")
                .defaultFrequency(ScheduleFrequency.EVERY_FIVE_MINUTES)
                .defaultCron("*/5 * * * *")
                .supportsShop(true)
                .defaultOption("fallback_lookback_hours", 24)
                .intOption("fallback_lookback_hours", LOOKBACK_HOURS));
        register(JobTypeDefinition.builder()
                .jobType(ORDERS_REFRESH_STATUSES)
                .label("Refresh order statuses")
                .description("Tracks status changes of already imported orders.")
                .defaultFrequency(ScheduleFrequency.EVERY_FIFTEEN_MINUTES)
                .defaultCron("*/15 * * * *")
                .supportsShop(true)
                .defaultOption("lookback_hours", 48)
                .intOption("lookback_hours", LOOKBACK_HOURS));
        register(JobTypeDefinition.builder()
                .jobType(ORDERS_REFRESH_STATUSES_DEEP)
                .label("Refresh order statuses (deep)")
                .description("Once a day re-checks statuses of orders far in the past.")
                .defaultFrequency(ScheduleFrequency.DAILY)
                .defaultCron("0 3 * * *")
                .supportsShop(true)
                .defaultOption("lookback_hours", 720)
                .intOption("lookback_hours", LOOKBACK_HOURS));
        register(JobTypeDefinition.builder()
                .jobType(PRODUCTS_IMPORT_MASTER)
                .label("Import products from master shop")
                .description("Imports new products from the master shop and keeps the catalogue current.")
                .defaultFrequency(ScheduleFrequency.HOURLY)
                .defaultCron("0 * * * *")
                .supportsShop(true)
                .defaultOption("fallback_lookback_hours", 168)
                .intOption("fallback_lookback_hours", IntRange.between(1, 2160)));
        register(JobTypeDefinition.builder()
                .jobType(CUSTOMERS_RECALCULATE_METRICS)
                .label("Recalculate customer metrics")
                .description("Schedules batches that recalculate aggregated customer metrics.")
                .defaultFrequency(ScheduleFrequency.DAILY)
                .defaultCron("30 2 * * *")
                .supportsShop(false)
                .defaultOption("queue", "customers_metrics")
                .defaultOption("chunk", 250)
                .intOption("chunk", IntRange.between(1, 5000))
                .textOption("queue"));
        register(JobTypeDefinition.builder()
                .jobType(CUSTOMERS_BACKFILL_FROM_ORDERS)
                .label("Create customer profiles from orders")
                .description("Creates and assigns customer profiles for orders without a customer.")
                .defaultFrequency(ScheduleFrequency.EVERY_FIFTEEN_MINUTES)
                .defaultCron("*/15 * * * *")
                .supportsShop(true)
                .defaultOption("queue", "customers")
                .defaultOption("chunk", 200)
                .intOption("chunk", IntRange.between(10, 2000))
                .textOption("queue"));
        register(JobTypeDefinition.builder()
                .jobType(CUSTOMERS_FETCH_SHOPTET)
                .label("Nightly customer import from Shoptet")
                .description("Requests a customers snapshot from Shoptet and hands it to the snapshot pipeline.")
                .defaultFrequency(ScheduleFrequency.DAILY)
                .defaultCron("30 3 * * *")
                .supportsShop(true));
        register(JobTypeDefinition.builder()
                .jobType(WOOCOMMERCE_FETCH_ORDERS)
                .label("WooCommerce order import")
                .description("Pulls new orders from connected WooCommerce stores.")
                .defaultFrequency(ScheduleFrequency.EVERY_FIFTEEN_MINUTES)
                .defaultCron("*/15 * * * *")
                .supportsShop(true)
                .defaultOption("lookback_hours", 24)
                .defaultOption("per_page", 50)
                .defaultOption("max_pages", 50)
                .intOption("lookback_hours", LOOKBACK_HOURS)
                .intOption("per_page", IntRange.between(1, 100))
                .intOption("max_pages", IntRange.atLeast(1)));
        register(JobTypeDefinition.builder()
                .jobType(INVENTORY_STOCK_GUARD_SYNC)
                .label("Stock guard sync")
                .description("Loads warehouse stock levels for quick comparison with the storefront.")
                .defaultFrequency(ScheduleFrequency.CUSTOM)
                .defaultCron("*/30 * * * *")
                .supportsShop(false)
                .defaultOption("chunk", 200)
                .intOption("chunk", IntRange.between(1, 5000)));
        register(JobTypeDefinition.builder()
                .jobType(INVENTORY_GENERATE_RECOMMENDATIONS)
                .label("Precompute product recommendations")
                .description("Computes related products daily so the back-office can show them instantly.")
                .defaultFrequency(ScheduleFrequency.DAILY)
                .defaultCron("0 2 * * *")
                .supportsShop(false)
                .defaultOption("product_limit", 10)
                .defaultOption("limit", 6)
                .defaultOption("chunk", 50)
                .intOption("product_limit", IntRange.between(1, 100))
                .intOption("limit", IntRange.between(1, 50))
                .intOption("chunk", IntRange.between(1, 1000)));
        register(JobTypeDefinition.builder()
                .jobType(PRODUCTS_SYNC_ALL_SHOPS)
                .label("Sync products from all shops")
                .description("Pulls products from every shop to collect prices, links and names per locale.")
                .defaultFrequency(ScheduleFrequency.DAILY)
                .defaultCron("0 4 * * *")
                .supportsShop(false));
        register(JobTypeDefinition.builder()
                .jobType(NOTIFICATIONS_DISPATCH_SLACK)
                .label("Slack notifications")
                .description("Delivers new operator notifications to the Slack channel, once per notification.")
                .defaultFrequency(ScheduleFrequency.EVERY_MINUTE)
                .defaultCron("* * * * *")
                .supportsShop(false)
                .defaultOption("limit", 50)
                .intOption("limit", IntRange.between(1, 500)));
    }

    private void register(JobTypeDefinition.JobTypeDefinitionBuilder builder) {
        var definition = builder.defaultTimezone(DEFAULT_TIMEZONE).build();
        definitions.put(definition.getJobType(), definition);
    }

    public boolean contains(String jobType) {
        return jobType != null && definitions.containsKey(jobType);
    }

    public Optional<JobTypeDefinition> find(String jobType) {
        return Optional.ofNullable(jobType).map(definitions::get);
    }

    public JobTypeDefinition getOrThrow(String jobType) {
        return find(jobType).orElseThrow(() -> new UnknownJobTypeException(jobType));
    }

    /**
     * All definitions in catalog order
     */
    public List<JobTypeDefinition> all() {
        return List.copyOf(definitions.values());
    }

    /**
     * Validate options against the job type's rules.
     *
     * @return option key to error message; empty when valid
     */
    public Map<String, String> validateOptions(String jobType, Map<String, Object> options) {
        var definition = getOrThrow(jobType);
        var errors = new LinkedHashMap<String, String>();
        if (options == null) {
            return errors;
        }

        definition.getIntOptions().forEach((key, range) -> {
            var value = options.get(key);
            if (value == null || "".equals(value)) {
                return;
            }
            var number = toLong(value);
            if (number == null) {
                errors.put(key, "must be a whole number");
            } else if (!range.contains(number)) {
                errors.put(key, "allowed range is " + range.describe());
            }
        });

        for (var key : definition.getTextOptions()) {
            if (!options.containsKey(key)) {
                continue;
            }
            var value = options.get(key);
            if (!(value instanceof String text) || text.isBlank()) {
                errors.put(key, "must be a non-blank string");
            }
        }

        return errors;
    }

    private static Long toLong(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
