package com.example.jobscheduler.service.catalog;

import com.example.jobscheduler.domain.enums.ScheduleFrequency;
import com.example.jobscheduler.exception.UnknownJobTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobTypeCatalog Tests")
class JobTypeCatalogTest {

    private final JobTypeCatalog catalog = new JobTypeCatalog();

    @Nested
    @DisplayName("Definitions")
    class DefinitionTests {

        @Test
        @DisplayName("Should list every known job type")
        void shouldListKnownTypes() {
            assertThat(catalog.all())
                    .extracting(JobTypeDefinition::getJobType)
                    .containsExactlyInAnyOrder(
                            "orders.fetch_new",
                            "orders.refresh_statuses",
                            "orders.refresh_statuses_deep",
                            "products.import_master",
                            "products.sync_all_shops",
                            "customers.recalculate_metrics",
                            "customers.backfill_from_orders",
                            "customers.fetch_shoptet",
                            "woocommerce.fetch_orders",
                            "inventory.stock_guard_sync",
                            "inventory.generate_recommendations",
                            "notifications.dispatch_slack");
        }

        @Test
        @DisplayName("Definitions carry schedule defaults")
        void definitionsCarryDefaults() {
            var definition = catalog.getOrThrow(JobTypeCatalog.ORDERS_FETCH_NEW);

            assertThat(definition.getDefaultCron()).isEqualTo("*/5 * * * *");
            assertThat(definition.getDefaultFrequency()).isEqualTo(ScheduleFrequency.EVERY_FIVE_MINUTES);
            assertThat(definition.getDefaultTimezone()).isEqualTo("Europe/Prague");
            assertThat(definition.isSupportsShop()).isTrue();
            assertThat(definition.getDefaultOptions()).containsEntry("fallback_lookback_hours", 24);
        }

        @Test
        @DisplayName("Unknown job type is rejected")
        void unknownTypeRejected() {
            assertThat(catalog.contains("unknown.type")).isFalse();
            assertThat(catalog.find(null)).isEmpty();
            assertThatThrownBy(() -> catalog.getOrThrow("unknown.type"))
                    .isInstanceOf(UnknownJobTypeException.class)
                    .hasMessageContaining("unknown.type");
        }
    }

    @Nested
    @DisplayName("Option validation")
    class OptionValidationTests {

        @Test
        @DisplayName("Defaults are valid")
        void defaultsAreValid() {
            for (var definition : catalog.all()) {
                assertThat(catalog.validateOptions(definition.getJobType(), definition.getDefaultOptions()))
                        .as(definition.getJobType())
                        .isEmpty();
            }
        }

        @Test
        @DisplayName("Out-of-range integer is reported")
        void outOfRangeReported() {
            var errors = catalog.validateOptions(JobTypeCatalog.NOTIFICATIONS_DISPATCH_SLACK, Map.of("limit", 1000));

            assertThat(errors).containsEntry("limit", "allowed range is 1 to 500");
        }

        @Test
        @DisplayName("Numeric strings are accepted, other text is not")
        void numericStrings() {
            assertThat(catalog.validateOptions(JobTypeCatalog.NOTIFICATIONS_DISPATCH_SLACK, Map.of("limit", "25")))
                    .isEmpty();
            assertThat(catalog.validateOptions(JobTypeCatalog.NOTIFICATIONS_DISPATCH_SLACK, Map.of("limit", "many")))
                    .containsEntry("limit", "must be a whole number");
        }

        @Test
        @DisplayName("Unbounded maximum accepts large values")
        void unboundedMaximum() {
            var errors = catalog.validateOptions(JobTypeCatalog.WOOCOMMERCE_FETCH_ORDERS,
                    Map.of("max_pages", 100000, "per_page", 0));

            assertThat(errors).containsOnlyKeys("per_page");
        }

        @Test
        @DisplayName("Blank text option is reported")
        void blankTextOption() {
            var options = new HashMap<String, Object>();
            options.put("queue", " ");

            var errors = catalog.validateOptions(JobTypeCatalog.CUSTOMERS_RECALCULATE_METRICS, options);

            assertThat(errors).containsEntry("queue", "must be a non-blank string");
        }
    }
}
