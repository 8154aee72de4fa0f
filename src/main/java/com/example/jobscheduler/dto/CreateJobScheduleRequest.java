package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.ScheduleFrequency;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for creating a job schedule.
 * Everything except the job type falls back to the catalog defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobScheduleRequest {

    @NotBlank(message = "Job type is required")
    private String jobType;

    @Size(max = 150)
    private String name;

    private Long shopId;

    private ScheduleFrequency frequency;

    /**
     * Required when frequency is CUSTOM and the job type has no default cron
     */
    @Size(max = 100)
    private String cronExpression;

    @Size(max = 64)
    private String timezone;

    private Map<String, Object> options;

    private Boolean enabled;
}
