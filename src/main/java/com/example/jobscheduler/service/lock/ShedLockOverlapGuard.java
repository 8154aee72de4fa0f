package com.example.jobscheduler.service.lock;

import com.example.jobscheduler.config.MetricsConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Overlap guard on top of the ShedLock provider shared with the sweep triggers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShedLockOverlapGuard implements OverlapGuard {

    private final LockProvider lockProvider;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    @Override
    public boolean withLock(String lockName, Duration ttl, Runnable work) {
        var configuration = new LockConfiguration(clock.instant(), lockName, ttl, Duration.ZERO);
        var lock = lockProvider.lock(configuration);

        if (lock.isEmpty()) {
            log.debug("Lock {} is held by another run, skipping", lockName);
            metricsConfig.recordLockContention(lockName);
            return false;
        }

        try {
            work.run();
            return true;
        } finally {
            try {
                lock.get().unlock();
            } catch (RuntimeException e) {
                // TTL expiry frees the lock eventually
                log.error("Failed to release lock {}: {}", lockName, e.getMessage(), e);
            }
        }
    }
}
