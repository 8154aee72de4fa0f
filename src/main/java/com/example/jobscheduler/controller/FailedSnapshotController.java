package com.example.jobscheduler.controller;

import com.example.jobscheduler.domain.enums.FailedSnapshotStatus;
import com.example.jobscheduler.dto.ApiResponse;
import com.example.jobscheduler.dto.FailedSnapshotResponse;
import com.example.jobscheduler.dto.RecordFailedSnapshotRequest;
import com.example.jobscheduler.mapper.FailedSnapshotMapper;
import com.example.jobscheduler.service.retry.FailedSnapshotRetrySweep;
import com.example.jobscheduler.service.retry.FailedSnapshotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for failed snapshot imports awaiting retry.
 * The snapshot pipeline reports failures and resolutions here.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/failed-snapshots")
@Tag(name = "Failed Snapshots", description = "Failed snapshot imports and their retry sweep")
public class FailedSnapshotController {

    private final FailedSnapshotService snapshotService;
    private final FailedSnapshotRetrySweep retrySweep;
    private final FailedSnapshotMapper mapper;

    @GetMapping
    @Operation(summary = "List failed snapshots", description = "Most recent failures first")
    public ResponseEntity<ApiResponse<List<FailedSnapshotResponse>>> listSnapshots(
            @Parameter(description = "Status filter") @RequestParam(defaultValue = "PENDING") FailedSnapshotStatus status,
            @Parameter(description = "Maximum items") @RequestParam(defaultValue = "100") int limit) {
        var snapshots = snapshotService.findByStatus(status, Math.min(limit, 500));
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponseList(snapshots)));
    }

    @PostMapping
    @Operation(summary = "Record a failure", description = "Re-opens an unresolved record of the same webhook job and endpoint")
    public ResponseEntity<ApiResponse<FailedSnapshotResponse>> recordFailure(@Valid @RequestBody RecordFailedSnapshotRequest request) {
        log.info("API: Record failed snapshot for webhook job {} ({})", request.getWebhookJobId(), request.getEndpoint());

        var snapshot = snapshotService.recordFailure(request.getWebhookJobId(), request.getShopId(),
                request.getEndpoint(), request.getErrorMessage(), request.getContext());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(mapper.toResponse(snapshot), "Failure recorded"));
    }

    @PostMapping("/{snapshotId}/resolve")
    @Operation(summary = "Mark a failed snapshot resolved")
    public ResponseEntity<ApiResponse<Boolean>> resolve(
            @Parameter(description = "Failed snapshot UUID") @PathVariable UUID snapshotId) {
        log.info("API: Resolve failed snapshot {}", snapshotId);

        var resolved = snapshotService.markResolved(snapshotId);
        return ResponseEntity.ok(ApiResponse.success(resolved,
                resolved ? "Snapshot resolved" : "Snapshot unknown or already resolved"));
    }

    @PostMapping("/retry")
    @Operation(summary = "Run the retry sweep now")
    public ResponseEntity<ApiResponse<Integer>> runRetrySweep() {
        log.info("API: Manual failed snapshot retry sweep");

        var retried = retrySweep.sweep();
        return ResponseEntity.ok(ApiResponse.success(retried, String.format("Re-enqueued %d snapshot(s)", retried)));
    }
}
