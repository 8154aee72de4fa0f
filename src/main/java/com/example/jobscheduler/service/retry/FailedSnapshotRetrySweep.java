package com.example.jobscheduler.service.retry;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.config.RetrySweepProperties;
import com.example.jobscheduler.domain.entity.FailedSnapshot;
import com.example.jobscheduler.domain.enums.FailedSnapshotStatus;
import com.example.jobscheduler.domain.repository.FailedSnapshotRepository;
import com.example.jobscheduler.integration.SnapshotPipeline;
import com.example.jobscheduler.integration.SnapshotRetryRequest;
import com.example.jobscheduler.service.lock.OverlapGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Re-enqueues failed snapshot imports.
 * <p>
 * Candidates are PENDING items with retries left whose last failure lies between
 * {@code now - lookback} and {@code now - minimumAge}. Younger items may still have an
 * attempt in flight; older ones are left for manual handling. Each candidate is claimed
 * with a conditional update, so it is handed over at most once per pass.
 * <p>
 * Runs under the overlap lock of the snapshot processing kind, shared with any
 * scheduled job of that kind. Without a {@link SnapshotPipeline} bean nothing is claimed
 * and the pass fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailedSnapshotRetrySweep {

    public static final String SNAPSHOT_JOB_KIND = "snapshots.process";

    private final FailedSnapshotRepository snapshotRepository;
    private final FailedSnapshotService snapshotService;
    private final OverlapGuard overlapGuard;
    private final ObjectProvider<SnapshotPipeline> snapshotPipeline;
    private final RetrySweepProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    @Scheduled(cron = "${job-scheduler.retry-sweep.cron:0 15 * * * *}")
    @SchedulerLock(name = "failedSnapshotRetrySweep", lockAtLeastFor = "30s", lockAtMostFor = "10m")
    public void scheduledSweep() {
        if (!properties.isEnabled()) {
            log.debug("Failed snapshot retry sweep is disabled");
            return;
        }
        sweep();
    }

    /**
     * Run one pass.
     *
     * @return number of snapshots handed back to the pipeline
     * @throws IllegalStateException if no snapshot pipeline is configured
     */
    public int sweep() {
        var pipeline = snapshotPipeline.getIfAvailable();
        if (pipeline == null) {
            throw new IllegalStateException("No SnapshotPipeline is configured, failed snapshots cannot be retried");
        }

        var retried = new AtomicInteger();
        var lockName = OverlapGuard.lockNameFor(SNAPSHOT_JOB_KIND);

        var ran = overlapGuard.withLock(lockName, properties.getLockTtl(),
                () -> retried.set(retryCandidates(pipeline)));
        if (!ran) {
            log.info("Snapshot processing is already running, retry sweep skipped");
            return 0;
        }
        return retried.get();
    }

    private int retryCandidates(SnapshotPipeline pipeline) {
        var now = clock.instant();
        var oldest = now.minus(properties.getLookback());
        var youngest = now.minus(properties.getMinimumAge());

        var candidates = snapshotRepository.findRetryCandidates(
                FailedSnapshotStatus.PENDING, oldest, youngest, PageRequest.of(0, properties.getBatchSize()));

        if (candidates.isEmpty()) {
            log.debug("No failed snapshots to retry between {} and {}", oldest, youngest);
            return 0;
        }

        var retried = 0;
        for (var snapshot : candidates) {
            try {
                if (retry(pipeline, snapshot)) {
                    retried++;
                }
            } catch (RuntimeException e) {
                log.error("Error retrying failed snapshot {}: {}", snapshot.getId(), e.getMessage(), e);
            }
        }

        log.info("Retry sweep re-enqueued {} of {} failed snapshots", retried, candidates.size());
        metricsConfig.recordSnapshotRetries(retried);
        return retried;
    }

    private boolean retry(SnapshotPipeline pipeline, FailedSnapshot snapshot) {
        if (!snapshotService.claimForRetry(snapshot.getId())) {
            log.debug("Failed snapshot {} already claimed, skipping", snapshot.getId());
            return false;
        }

        var request = SnapshotRetryRequest.builder()
                .snapshotId(snapshot.getId())
                .webhookJobId(snapshot.getWebhookJobId())
                .shopId(snapshot.getShopId())
                .endpoint(snapshot.getEndpoint())
                .attempt(snapshot.getRetryCount() + 1)
                .context(snapshot.getContext() != null ? new HashMap<>(snapshot.getContext()) : new HashMap<>())
                .build();

        try {
            pipeline.requestRetry(request);
            log.info("Re-enqueued failed snapshot {} (webhook job {}, attempt {})",
                    snapshot.getId(), snapshot.getWebhookJobId(), request.getAttempt());
            return true;
        } catch (RuntimeException e) {
            log.error("Re-enqueue of failed snapshot {} failed, releasing claim: {}",
                    snapshot.getId(), e.getMessage(), e);
            snapshotService.releaseClaim(snapshot.getId());
            return false;
        }
    }
}
