package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.FailedSnapshotStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailedSnapshotResponse {

    private UUID id;
    private String webhookJobId;
    private Long shopId;
    private String endpoint;
    private FailedSnapshotStatus status;
    private int retryCount;
    private int maxRetries;
    private String errorMessage;
    private Map<String, Object> context;
    private Instant firstFailedAt;
    private Instant lastFailedAt;
    private Instant resolvedAt;
}
