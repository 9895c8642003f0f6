package com.syncbridge.connector;

import java.util.Map;

/**
 * Client registration and endpoint overrides for one provider.
 *
 * @param clientId     OAuth client id
 * @param clientSecret OAuth client secret
 * @param authBaseUrl  Override for the authorization server base URL, null for the provider default
 * @param apiBaseUrl   Override for the API base URL, null for the provider default
 * @param options      Provider-specific settings (e.g. Zoho data center)
 */
public record ProviderConfig(
        String clientId,
        String clientSecret,
        String authBaseUrl,
        String apiBaseUrl,
        Map<String, String> options
) {
    public ProviderConfig {
        options = options != null ? Map.copyOf(options) : Map.of();
    }

    public static ProviderConfig empty() {
        return new ProviderConfig(null, null, null, null, Map.of());
    }

    public static ProviderConfig of(String clientId, String clientSecret) {
        return new ProviderConfig(clientId, clientSecret, null, null, Map.of());
    }

    public boolean hasClientCredentials() {
        return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
    }

    public String authBaseUrlOr(String defaultUrl) {
        return authBaseUrl != null && !authBaseUrl.isBlank() ? trimSlash(authBaseUrl) : defaultUrl;
    }

    public String apiBaseUrlOr(String defaultUrl) {
        return apiBaseUrl != null && !apiBaseUrl.isBlank() ? trimSlash(apiBaseUrl) : defaultUrl;
    }

    public String option(String key, String defaultValue) {
        return options.getOrDefault(key, defaultValue);
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
