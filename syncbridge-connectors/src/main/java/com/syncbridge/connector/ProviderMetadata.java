package com.syncbridge.connector;

import java.util.List;

/**
 * Immutable description of a registered provider.
 *
 * @param name     Provider name used in routes and on connection rows (e.g. "github", "google-calendar")
 * @param authType Authentication style
 * @param scopes   Scopes requested during authorization
 * @param webhooks Whether the provider pushes webhooks
 */
public record ProviderMetadata(
        String name,
        AuthType authType,
        List<String> scopes,
        boolean webhooks
) {
    public ProviderMetadata {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name cannot be null or blank");
        }
        if (authType == null) {
            throw new IllegalArgumentException("Auth type cannot be null");
        }
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
    }
}
