package com.example.jobscheduler.integration;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.UUID;

/**
 * Failed snapshot handed back to the {@link SnapshotPipeline}
 */
@Getter
@Builder
@ToString
public class SnapshotRetryRequest {

    private final UUID snapshotId;
    private final String webhookJobId;
    private final Long shopId;
    private final String endpoint;

    /**
     * 1 for the first retry
     */
    private final int attempt;

    private final Map<String, Object> context;
}
