package com.example.jobscheduler.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO sent by the snapshot pipeline when an import fails
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordFailedSnapshotRequest {

    @NotBlank(message = "Webhook job id is required")
    @Size(max = 100)
    private String webhookJobId;

    private Long shopId;

    @NotBlank(message = "Endpoint is required")
    @Size(max = 255)
    private String endpoint;

    private String errorMessage;

    private Map<String, Object> context;
}
