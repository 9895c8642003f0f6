package com.syncbridge.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Single-use OAuth state token bound to a tenant and provider.
 */
@Entity
@Table(name = "oauth_states", indexes = {
        @Index(name = "idx_oauth_states_expires", columnList = "expires_at")
})
public class OAuthState {

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
    @Column(nullable = false, unique = true)
    private String state;

    @Column(name = "redirect_uri")
    private String redirectUri;

    @NotNull
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected OAuthState() {}

    public static OAuthState create(UUID tenantId, String providerSlug, String state,
                                    String redirectUri, Instant expiresAt) {
        OAuthState oauthState = new OAuthState();
        oauthState.tenantId = tenantId;
        oauthState.providerSlug = providerSlug;
        oauthState.state = state;
        oauthState.redirectUri = redirectUri;
        oauthState.expiresAt = expiresAt;
        oauthState.createdAt = Instant.now();
        return oauthState;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public UUID getId() { return id; }
    public UUID getTenantId() { return tenantId; }
    public String getProviderSlug() { return providerSlug; }
    public String getState() { return state; }
    public String getRedirectUri() { return redirectUri; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getCreatedAt() { return createdAt; }
}
