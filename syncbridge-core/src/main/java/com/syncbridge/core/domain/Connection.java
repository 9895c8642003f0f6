package com.syncbridge.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A tenant's authorization to one provider.
 * Credentials are stored encrypted; the {@code metadata.sync} sub-object carries scheduler state
 * (see {@link ConnectionSyncMetadata}).
 */
@Entity
@Table(name = "connections", indexes = {
        @Index(name = "idx_connections_tenant_provider", columnList = "tenant_id, provider_slug"),
        @Index(name = "idx_connections_status", columnList = "status"),
        @Index(name = "idx_connections_expires_at", columnList = "expires_at")
})
public class Connection {

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
    @Column(name = "external_id", nullable = false)
    private String externalId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConnectionStatus status;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "access_token_ciphertext")
    private byte[] accessTokenCiphertext;

    @Column(name = "refresh_token_ciphertext")
    private byte[] refreshTokenCiphertext;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "scopes", columnDefinition = "jsonb")
    private List<String> scopes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Connection() {}

    public static Connection create(UUID tenantId, String providerSlug, String externalId) {
        Connection connection = new Connection();
        connection.tenantId = tenantId;
        connection.providerSlug = providerSlug;
        connection.externalId = externalId;
        connection.status = ConnectionStatus.ACTIVE;
        connection.metadata = new HashMap<>();
        connection.scopes = List.of();
        connection.createdAt = Instant.now();
        connection.updatedAt = connection.createdAt;
        return connection;
    }

    public boolean isActive() {
        return status == ConnectionStatus.ACTIVE;
    }

    public boolean hasRefreshToken() {
        return refreshTokenCiphertext != null && refreshTokenCiphertext.length > 0;
    }

    public void markError() {
        this.status = ConnectionStatus.ERROR;
        this.updatedAt = Instant.now();
    }

    public ConnectionSyncMetadata syncMetadata() {
        return ConnectionSyncMetadata.fromConnectionMetadata(metadata);
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }

    // Getters and setters
    public UUID getId() { return id; }
    public UUID getTenantId() { return tenantId; }
    public String getProviderSlug() { return providerSlug; }
    public String getExternalId() { return externalId; }
    public ConnectionStatus getStatus() { return status; }
    public void setStatus(ConnectionStatus status) { this.status = status; }
    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public byte[] getAccessTokenCiphertext() { return accessTokenCiphertext; }
    public void setAccessTokenCiphertext(byte[] accessTokenCiphertext) { this.accessTokenCiphertext = accessTokenCiphertext; }
    public byte[] getRefreshTokenCiphertext() { return refreshTokenCiphertext; }
    public void setRefreshTokenCiphertext(byte[] refreshTokenCiphertext) { this.refreshTokenCiphertext = refreshTokenCiphertext; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
    public List<String> getScopes() { return scopes; }
    public void setScopes(List<String> scopes) { this.scopes = scopes; }
    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public enum ConnectionStatus {
        ACTIVE,
        ERROR,
        REVOKED
    }
}
