package com.example.jobscheduler.integration;

/**
 * Snapshot import pipeline that failed snapshots are handed back to.
 * <p>
 * Implementations process or enqueue the request before returning;
 * an exception means the snapshot was not accepted and stays available for the next retry pass.
 */
public interface SnapshotPipeline {

    void requestRetry(SnapshotRetryRequest request);
}
