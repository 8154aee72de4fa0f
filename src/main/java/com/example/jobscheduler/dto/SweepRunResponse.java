package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of a manually triggered sweep tick
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepRunResponse {

    private String jobTypeFilter;
    private int dispatched;
    private Instant ranAt;
}
