package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.RunStatus;
import com.example.jobscheduler.domain.enums.ScheduleFrequency;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Operator-configured recurring job.
 * <p>
 * Definition fields (name, options, cron, timezone, enabled) are edited by operators.
 * Run-state fields (lastRun*) are written only through the run-state tracker,
 * using conditional single-row updates in {@code JobScheduleRepository}.
 * Entity updates only write changed columns, so an operator edit never overwrites
 * run state recorded by a worker in the meantime.
 */
@Entity
@Table(name = "job_schedules", indexes = {
        @Index(name = "idx_job_schedule_enabled_type", columnList = "enabled, job_type"),
        @Index(name = "idx_job_schedule_last_run_status", columnList = "last_run_status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@DynamicUpdate
public class JobSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    /**
     * Catalog tag selecting the handler; never changes after creation
     */
    @Column(name = "job_type", nullable = false, updatable = false, length = 100)
    private String jobType;

    /**
     * Shop the job is limited to; null means every eligible shop
     */
    @Column(name = "shop_id")
    private Long shopId;

    /**
     * Job-type specific options, re-read by the handler on every run
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "options", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> options = new HashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "frequency", nullable = false, length = 30)
    private ScheduleFrequency frequency;

    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    @Column(name = "timezone", length = 64)
    private String timezone;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    // === Run State ===

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "last_run_ended_at")
    private Instant lastRunEndedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_run_status", length = 20)
    private RunStatus lastRunStatus;

    @Column(name = "last_run_message", columnDefinition = "TEXT")
    private String lastRunMessage;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.options == null) {
            this.options = new HashMap<>();
        }
        if (this.frequency == null) {
            this.frequency = ScheduleFrequency.CUSTOM;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Get an option value, or null if absent or of another type
     */
    @SuppressWarnings("unchecked")
    public <T> T getOptionValue(String key, Class<T> type) {
        if (this.options == null) {
            return null;
        }
        var value = this.options.get(key);
        return type.isInstance(value) ? (T) value : null;
    }

    /**
     * Get a numeric option as int, falling back when absent or not numeric.
     * Numeric strings are accepted since the catalog validates them as numbers.
     */
    public int getIntOption(String key, int fallback) {
        var value = this.options != null ? this.options.get(key) : null;
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
