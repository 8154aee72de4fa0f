package com.example.jobscheduler.service.lock;

import java.time.Duration;

/**
 * Non-blocking mutual exclusion around a unit of work.
 * <p>
 * Locks are keyed by job kind, not by schedule, so two schedules of the same kind
 * never run at the same time. The guard is advisory: it only gates code that goes through it.
 */
public interface OverlapGuard {

    String LOCK_PREFIX = "job-lock:";

    /**
     * Run {@code work} while holding the named lock.
     * Returns immediately with {@code false} when the lock is held elsewhere.
     * The lock is released on every exit path; exceptions from {@code work} propagate.
     *
     * @param lockName lock key, see {@link #lockNameFor(String)}
     * @param ttl      expiry that frees the lock if the holder dies without releasing it
     * @return true if the work ran
     */
    boolean withLock(String lockName, Duration ttl, Runnable work);

    static String lockNameFor(String jobKind) {
        return LOCK_PREFIX + jobKind;
    }
}
