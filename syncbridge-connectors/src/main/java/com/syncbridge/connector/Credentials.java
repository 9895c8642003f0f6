package com.syncbridge.connector;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Token material and identity returned by a token exchange or refresh.
 *
 * @param accessToken  New access token
 * @param refreshToken New refresh token, or null when the provider did not rotate it
 *                     and the previous one stays valid
 * @param expiresAt    Access token expiry, or null for non-expiring tokens
 * @param scopes       Granted scopes
 * @param externalId   Provider-side account identifier (exchange only)
 * @param displayName  Human readable account label (exchange only)
 * @param metadata     Provider-specific connection metadata (exchange only)
 */
public record Credentials(
        String accessToken,
        String refreshToken,
        Instant expiresAt,
        List<String> scopes,
        String externalId,
        String displayName,
        Map<String, Object> metadata
) {
    public Credentials {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or blank");
        }
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static Credentials tokens(String accessToken, String refreshToken, Instant expiresAt, List<String> scopes) {
        return new Credentials(accessToken, refreshToken, expiresAt, scopes, null, null, null);
    }

    public boolean reusesPreviousRefreshToken() {
        return refreshToken == null;
    }

    public Credentials withIdentity(String externalId, String displayName, Map<String, Object> metadata) {
        return new Credentials(accessToken, refreshToken, expiresAt, scopes, externalId, displayName, metadata);
    }
}
