package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.ScheduleFrequency;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for editing a job schedule.
 * Null fields are left unchanged; the job type cannot be edited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateJobScheduleRequest {

    @Size(max = 150)
    private String name;

    private Long shopId;

    private ScheduleFrequency frequency;

    @Size(max = 100)
    private String cronExpression;

    @Size(max = 64)
    private String timezone;

    private Map<String, Object> options;

    private Boolean enabled;
}
