package com.example.jobscheduler.controller;

import com.example.jobscheduler.dto.*;
import com.example.jobscheduler.service.JobScheduleService;
import com.example.jobscheduler.service.sweep.ScheduleSweepService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * REST API controller for job schedules.
 * <p>
 * Provides endpoints for:
 * - Listing schedules and the job type catalog
 * - Creating, editing, pausing and deleting schedules
 * - Triggering a sweep tick manually
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/job-schedules")
@Tag(name = "Job Schedules", description = "APIs for managing recurring job schedules")
public class JobScheduleController {

    private final JobScheduleService scheduleService;
    private final ScheduleSweepService sweepService;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "List schedules", description = "All schedules with their last run state")
    public ResponseEntity<ApiResponse<List<JobScheduleResponse>>> listSchedules() {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.list()));
    }

    @GetMapping("/catalog")
    @Operation(summary = "Job type catalog", description = "Job types that can be scheduled, with their defaults")
    public ResponseEntity<ApiResponse<List<JobTypeResponse>>> getCatalog() {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.catalog()));
    }

    @GetMapping("/{scheduleId}")
    @Operation(summary = "Get schedule by ID")
    public ResponseEntity<ApiResponse<JobScheduleResponse>> getSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.get(scheduleId)));
    }

    @PostMapping
    @Operation(summary = "Create a schedule", description = "Missing fields are filled from the job type catalog")
    public ResponseEntity<ApiResponse<JobScheduleResponse>> createSchedule(@Valid @RequestBody CreateJobScheduleRequest request) {
        log.info("API: Create schedule for job type {}", request.getJobType());

        var response = scheduleService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Schedule created successfully"));
    }

    @PutMapping("/{scheduleId}")
    @Operation(summary = "Update a schedule", description = "Null fields are left unchanged; the job type cannot change")
    public ResponseEntity<ApiResponse<JobScheduleResponse>> updateSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId,
            @Valid @RequestBody UpdateJobScheduleRequest request) {
        log.info("API: Update schedule {}", scheduleId);

        return ResponseEntity.ok(ApiResponse.success(scheduleService.update(scheduleId, request), "Schedule updated"));
    }

    @PostMapping("/{scheduleId}/enable")
    @Operation(summary = "Enable a schedule")
    public ResponseEntity<ApiResponse<JobScheduleResponse>> enableSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.setEnabled(scheduleId, true), "Schedule enabled"));
    }

    @PostMapping("/{scheduleId}/disable")
    @Operation(summary = "Disable a schedule", description = "Stops future dispatches; a queued run still executes")
    public ResponseEntity<ApiResponse<JobScheduleResponse>> disableSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.setEnabled(scheduleId, false), "Schedule disabled"));
    }

    @DeleteMapping("/{scheduleId}")
    @Operation(summary = "Delete a schedule", description = "Idempotent: deleting an absent schedule succeeds")
    public ResponseEntity<ApiResponse<Void>> deleteSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        log.info("API: Delete schedule {}", scheduleId);

        var deleted = scheduleService.delete(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(null, deleted ? "Schedule deleted" : "Schedule already absent"));
    }

    @PostMapping("/run")
    @Operation(summary = "Run a sweep tick", description = "Evaluate enabled schedules now and dispatch the due ones")
    public ResponseEntity<ApiResponse<SweepRunResponse>> runTick(
            @Parameter(description = "Only consider schedules of this job type")
            @RequestParam(required = false) String jobType) {
        log.info("API: Manual sweep{}", jobType != null ? " for job type " + jobType : "");

        var ranAt = clock.instant();
        var dispatched = sweepService.runTick(jobType);
        var response = SweepRunResponse.builder()
                .jobTypeFilter(jobType)
                .dispatched(dispatched)
                .ranAt(ranAt)
                .build();
        return ResponseEntity.ok(ApiResponse.success(response, String.format("Dispatched %d schedule(s)", dispatched)));
    }
}
