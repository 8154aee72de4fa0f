package com.example.jobscheduler.integration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of synchronising one shop
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncOutcome {

    /**
     * False when the shop was skipped, e.g. its pipeline lock was held
     */
    private boolean processed;

    private int itemCount;

    public static SyncOutcome processed(int itemCount) {
        return new SyncOutcome(true, itemCount);
    }

    public static SyncOutcome skipped() {
        return new SyncOutcome(false, 0);
    }
}
