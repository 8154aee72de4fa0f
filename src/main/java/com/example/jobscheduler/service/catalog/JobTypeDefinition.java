package com.example.jobscheduler.service.catalog;

import com.example.jobscheduler.domain.enums.ScheduleFrequency;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Map;
import java.util.Set;

/**
 * Static description of a job type: operator-facing texts, schedule defaults and option rules.
 */
@Data
@Builder
public class JobTypeDefinition {

    private final String jobType;
    private final String label;
    private final String description;
    private final ScheduleFrequency defaultFrequency;
    private final String defaultCron;
    private final String defaultTimezone;
    private final boolean supportsShop;

    @Singular
    private final Map<String, Object> defaultOptions;

    /**
     * Integer options and their inclusive range
     */
    @Singular
    private final Map<String, IntRange> intOptions;

    /**
     * Options that must be non-blank strings when present
     */
    @Singular
    private final Set<String> textOptions;

    @Data
    public static class IntRange {
        private final int min;

        /**
         * Null means unbounded
         */
        private final Integer max;

        public static IntRange between(int min, int max) {
            return new IntRange(min, max);
        }

        public static IntRange atLeast(int min) {
            return new IntRange(min, null);
        }

        public boolean contains(long value) {
            return value >= min && (max == null || value <= max);
        }

        public String describe() {
            return max == null ? "at least " + min : min + " to " + max;
        }
    }
}
