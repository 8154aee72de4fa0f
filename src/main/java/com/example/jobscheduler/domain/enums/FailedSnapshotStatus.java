package com.example.jobscheduler.domain.enums;

/**
 * Lifecycle of a failed snapshot import.
 * PENDING items are eligible for the retry sweep; RETRYING items were re-enqueued
 * and wait for the pipeline to report back.
 */
public enum FailedSnapshotStatus {
    PENDING,
    RETRYING,
    RESOLVED
}
