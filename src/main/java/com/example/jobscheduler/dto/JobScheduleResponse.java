package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.RunStatus;
import com.example.jobscheduler.domain.enums.ScheduleFrequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for job schedule data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobScheduleResponse {

    private UUID id;
    private String name;
    private String jobType;
    private Long shopId;
    private Map<String, Object> options;
    private ScheduleFrequency frequency;
    private String cronExpression;
    private String timezone;
    private boolean enabled;
    private Instant lastRunAt;
    private Instant lastRunEndedAt;
    private RunStatus lastRunStatus;
    private String lastRunMessage;
    private Instant createdAt;
    private Instant updatedAt;
}
