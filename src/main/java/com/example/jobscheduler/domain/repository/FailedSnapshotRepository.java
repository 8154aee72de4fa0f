package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.FailedSnapshot;
import com.example.jobscheduler.domain.enums.FailedSnapshotStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FailedSnapshotRepository extends JpaRepository<FailedSnapshot, UUID> {

    /**
     * Retryable items whose last failure falls inside [oldest, youngest], oldest first
     */
    @Query("""
            SELECT f FROM FailedSnapshot f
            WHERE f.status = :status
              AND f.retryCount < f.maxRetries
              AND f.lastFailedAt >= :oldest
              AND f.lastFailedAt <= :youngest
            ORDER BY f.lastFailedAt ASC
            """)
    List<FailedSnapshot> findRetryCandidates(
            @Param("status") FailedSnapshotStatus status,
            @Param("oldest") Instant oldest,
            @Param("youngest") Instant youngest,
            Pageable pageable);

    /**
     * Claim an item for retry.
     *
     * @return 1 if this caller moved the item from {@code from} to {@code to}, 0 otherwise
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE FailedSnapshot f
            SET f.status = :to,
                f.retryCount = f.retryCount + 1,
                f.updatedAt = :now
            WHERE f.id = :id
              AND f.status = :from
              AND f.retryCount < f.maxRetries
            """)
    int claim(
            @Param("id") UUID id,
            @Param("from") FailedSnapshotStatus from,
            @Param("to") FailedSnapshotStatus to,
            @Param("now") Instant now);

    /**
     * Undo a claim whose re-enqueue failed
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE FailedSnapshot f
            SET f.status = :to,
                f.retryCount = f.retryCount - 1,
                f.updatedAt = :now
            WHERE f.id = :id
              AND f.status = :from
            """)
    int releaseClaim(
            @Param("id") UUID id,
            @Param("from") FailedSnapshotStatus from,
            @Param("to") FailedSnapshotStatus to,
            @Param("now") Instant now);

    Optional<FailedSnapshot> findFirstByWebhookJobIdAndEndpointAndStatusNot(
            String webhookJobId, String endpoint, FailedSnapshotStatus status);

    List<FailedSnapshot> findByStatusOrderByLastFailedAtDesc(FailedSnapshotStatus status, Pageable pageable);

    long countByStatus(FailedSnapshotStatus status);
}
