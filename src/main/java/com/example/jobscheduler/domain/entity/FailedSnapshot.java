package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.FailedSnapshotStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A snapshot import that failed and may be retried by the retry sweep.
 */
@Entity
@Table(name = "failed_snapshots", indexes = {
        @Index(name = "idx_failed_snapshot_status_last_failed", columnList = "status, last_failed_at"),
        @Index(name = "idx_failed_snapshot_webhook_job", columnList = "webhook_job_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FailedSnapshot {

    public static final int DEFAULT_MAX_RETRIES = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Webhook job whose snapshot download or processing failed
     */
    @Column(name = "webhook_job_id", nullable = false, length = 100)
    private String webhookJobId;

    @Column(name = "shop_id")
    private Long shopId;

    @Column(name = "endpoint", nullable = false, length = 255)
    private String endpoint;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private FailedSnapshotStatus status = FailedSnapshotStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    @Builder.Default
    private Integer maxRetries = DEFAULT_MAX_RETRIES;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "context", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    @Column(name = "first_failed_at", nullable = false)
    private Instant firstFailedAt;

    @Column(name = "last_failed_at", nullable = false)
    private Instant lastFailedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.status == null) {
            this.status = FailedSnapshotStatus.PENDING;
        }
        if (this.retryCount == null) {
            this.retryCount = 0;
        }
        if (this.maxRetries == null) {
            this.maxRetries = DEFAULT_MAX_RETRIES;
        }
        if (this.context == null) {
            this.context = new HashMap<>();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean canRetry() {
        return status == FailedSnapshotStatus.PENDING && retryCount < maxRetries;
    }
}
