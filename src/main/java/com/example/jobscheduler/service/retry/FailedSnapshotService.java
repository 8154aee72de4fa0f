package com.example.jobscheduler.service.retry;

import com.example.jobscheduler.domain.entity.FailedSnapshot;
import com.example.jobscheduler.domain.enums.FailedSnapshotStatus;
import com.example.jobscheduler.domain.repository.FailedSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Bookkeeping of failed snapshot imports.
 * <p>
 * The snapshot pipeline records failures and resolutions here;
 * the retry sweep claims PENDING items through {@link #claimForRetry(UUID)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailedSnapshotService {

    private final FailedSnapshotRepository snapshotRepository;
    private final Clock clock;

    /**
     * Record a failure. An open record for the same webhook job and endpoint is
     * re-opened as PENDING instead of creating a duplicate.
     */
    @Transactional
    public FailedSnapshot recordFailure(String webhookJobId, Long shopId, String endpoint,
                                        String errorMessage, Map<String, Object> context) {
        var now = clock.instant();
        var snapshot = snapshotRepository
                .findFirstByWebhookJobIdAndEndpointAndStatusNot(webhookJobId, endpoint, FailedSnapshotStatus.RESOLVED)
                .orElse(null);

        if (snapshot == null) {
            snapshot = FailedSnapshot.builder()
                    .webhookJobId(webhookJobId)
                    .shopId(shopId)
                    .endpoint(endpoint)
                    .status(FailedSnapshotStatus.PENDING)
                    .errorMessage(errorMessage)
                    .context(context != null ? new HashMap<>(context) : new HashMap<>())
                    .firstFailedAt(now)
                    .lastFailedAt(now)
                    .build();
            log.info("Recording failed snapshot for webhook job {} ({})", webhookJobId, endpoint);
        } else {
            snapshot.setStatus(FailedSnapshotStatus.PENDING);
            snapshot.setErrorMessage(errorMessage);
            snapshot.setLastFailedAt(now);
            if (context != null) {
                snapshot.getContext().putAll(context);
            }
            log.info("Snapshot for webhook job {} ({}) failed again after {} retries",
                    webhookJobId, endpoint, snapshot.getRetryCount());
        }

        return snapshotRepository.save(snapshot);
    }

    @Transactional(readOnly = true)
    public List<FailedSnapshot> findByStatus(FailedSnapshotStatus status, int limit) {
        return snapshotRepository.findByStatusOrderByLastFailedAtDesc(status, PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * @return true if the snapshot was found open and is now resolved
     */
    @Transactional
    public boolean markResolved(UUID snapshotId) {
        var snapshot = snapshotRepository.findById(snapshotId).orElse(null);
        if (snapshot == null || snapshot.getStatus() == FailedSnapshotStatus.RESOLVED) {
            return false;
        }
        snapshot.setStatus(FailedSnapshotStatus.RESOLVED);
        snapshot.setResolvedAt(clock.instant());
        snapshotRepository.save(snapshot);
        log.info("Failed snapshot {} resolved after {} retries", snapshotId, snapshot.getRetryCount());
        return true;
    }

    /**
     * Move a PENDING snapshot to RETRYING and count the attempt.
     *
     * @return false if another sweep already claimed it or it ran out of retries
     */
    @Transactional
    public boolean claimForRetry(UUID snapshotId) {
        return snapshotRepository.claim(snapshotId, FailedSnapshotStatus.PENDING,
                FailedSnapshotStatus.RETRYING, clock.instant()) > 0;
    }

    /**
     * Undo {@link #claimForRetry(UUID)} after the retry could not be handed over
     */
    @Transactional
    public void releaseClaim(UUID snapshotId) {
        var rows = snapshotRepository.releaseClaim(snapshotId, FailedSnapshotStatus.RETRYING,
                FailedSnapshotStatus.PENDING, clock.instant());
        if (rows == 0) {
            log.warn("Could not release retry claim of snapshot {}: no longer RETRYING", snapshotId);
        }
    }
}
