package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.domain.enums.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for JobSchedule entity.
 * <p>
 * Run-state writes are conditional single-row UPDATEs: the WHERE clause carries
 * the guard (re-arm threshold or allowed predecessor statuses), so two writers
 * racing on one row cannot both succeed and no other row is touched.
 */
@Repository
public interface JobScheduleRepository extends JpaRepository<JobSchedule, UUID> {

    List<JobSchedule> findByEnabledTrue();

    List<JobSchedule> findByEnabledTrueAndJobType(String jobType);

    List<JobSchedule> findAllByOrderByJobTypeAscNameAsc();

    /**
     * Queue an enabled schedule unless it was already queued at or after the re-arm threshold,
     * or its previous run is still in flight and was touched at or after {@code staleBefore}.
     *
     * @return 1 if queued, 0 if the row is absent, disabled, within the re-arm interval or still running
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE JobSchedule s
            SET s.lastRunAt = :now,
                s.lastRunStatus = :queued,
                s.lastRunMessage = NULL,
                s.lastRunEndedAt = NULL,
                s.updatedAt = :now
            WHERE s.id = :id
              AND s.enabled = true
              AND (s.lastRunAt IS NULL OR s.lastRunAt < :rearmThreshold)
              AND (s.lastRunStatus IS NULL
                   OR s.lastRunStatus NOT IN :inFlight
                   OR s.updatedAt < :staleBefore)
            """)
    int markQueued(
            @Param("id") UUID id,
            @Param("queued") RunStatus queued,
            @Param("now") Instant now,
            @Param("rearmThreshold") Instant rearmThreshold,
            @Param("inFlight") Collection<RunStatus> inFlight,
            @Param("staleBefore") Instant staleBefore);

    /**
     * Write a run outcome if the row currently holds one of the allowed predecessor statuses.
     *
     * @return 1 if written, 0 if the row is absent or in a status the transition does not allow
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE JobSchedule s
            SET s.lastRunStatus = :status,
                s.lastRunMessage = :message,
                s.lastRunEndedAt = :endedAt,
                s.updatedAt = :now
            WHERE s.id = :id
              AND s.lastRunStatus IN :allowedFrom
            """)
    int updateRunState(
            @Param("id") UUID id,
            @Param("status") RunStatus status,
            @Param("message") String message,
            @Param("endedAt") Instant endedAt,
            @Param("allowedFrom") Collection<RunStatus> allowedFrom,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE JobSchedule s
            SET s.enabled = :enabled, s.updatedAt = :now
            WHERE s.id = :id
            """)
    int updateEnabled(@Param("id") UUID id, @Param("enabled") boolean enabled, @Param("now") Instant now);

    long countByLastRunStatus(RunStatus status);
}
