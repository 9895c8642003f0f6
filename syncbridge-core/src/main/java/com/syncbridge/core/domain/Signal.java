package com.syncbridge.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A normalized provider event. Immutable once written.
 */
@Entity
@Table(name = "signals", indexes = {
        @Index(name = "idx_signals_tenant_occurred", columnList = "tenant_id, occurred_at"),
        @Index(name = "idx_signals_connection", columnList = "connection_id, occurred_at")
})
public class Signal {

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
    @Column(nullable = false)
    private String kind;

    @NotNull
    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @NotNull
    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    @NotNull
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> payload;

    @Column(name = "dedupe_key")
    private String dedupeKey;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Signal() {}

    public UUID getId() { return id; }
    public UUID getTenantId() { return tenantId; }
    public String getProviderSlug() { return providerSlug; }
    public UUID getConnectionId() { return connectionId; }
    public String getKind() { return kind; }
    public Instant getOccurredAt() { return occurredAt; }
    public Instant getReceivedAt() { return receivedAt; }
    public Map<String, Object> getPayload() { return payload; }
    public String getDedupeKey() { return dedupeKey; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
