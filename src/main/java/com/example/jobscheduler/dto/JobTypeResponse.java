package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.ScheduleFrequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Catalog entry as shown to operators when creating a schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobTypeResponse {

    private String jobType;
    private String label;
    private String description;
    private ScheduleFrequency defaultFrequency;
    private String defaultCron;
    private String defaultTimezone;
    private boolean supportsShop;
    private Map<String, Object> defaultOptions;

    /**
     * Whether a handler is registered, i.e. the sweep can actually run it
     */
    private boolean routable;
}
