package com.syncbridge.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One unit of scheduled or triggered connector work.
 * Rows are append-only history: the executor moves them through
 * QUEUED -> RUNNING -> {SUCCEEDED | QUEUED (retry) | FAILED} and never deletes them.
 * At most one QUEUED/RUNNING incremental job exists per connection
 * (partial unique index {@code idx_sync_jobs_incremental_pending}).
 */
@Entity
@Table(name = "sync_jobs", indexes = {
        @Index(name = "idx_sync_jobs_status_scheduled", columnList = "status, scheduled_at, priority"),
        @Index(name = "idx_sync_jobs_tenant_provider", columnList = "tenant_id, provider_slug, status, scheduled_at"),
        @Index(name = "idx_sync_jobs_connection", columnList = "connection_id, status, scheduled_at")
})
public class SyncJob {

    public static final String PENDING_INCREMENTAL_INDEX = "idx_sync_jobs_incremental_pending";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @NotNull
    @Column(name = "provider_slug", nullable = false)
    private String providerSlug;

    @NotNull
    @Column(name = "connection_id", nullable = false)
    private UUID connectionId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false)
    private JobType jobType;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status;

    @Column(nullable = false)
    private int priority;

    @Column(nullable = false)
    private int attempts;

    @NotNull
    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "retry_after")
    private Instant retryAfter;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "cursor", columnDefinition = "jsonb")
    private Map<String, Object> cursor;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error", columnDefinition = "jsonb")
    private Map<String, Object> error;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected SyncJob() {}

    public boolean isTerminal() {
        return status == JobStatus.SUCCEEDED || status == JobStatus.FAILED;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getTenantId() { return tenantId; }
    public String getProviderSlug() { return providerSlug; }
    public UUID getConnectionId() { return connectionId; }
    public JobType getJobType() { return jobType; }
    public JobStatus getStatus() { return status; }
    public int getPriority() { return priority; }
    public int getAttempts() { return attempts; }
    public Instant getScheduledAt() { return scheduledAt; }
    public Instant getRetryAfter() { return retryAfter; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public Map<String, Object> getCursor() { return cursor; }
    public Map<String, Object> getError() { return error; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public enum JobType {
        FULL,
        INCREMENTAL,
        WEBHOOK
    }

    public enum JobStatus {
        QUEUED,
        RUNNING,
        SUCCEEDED,
        FAILED
    }
}
