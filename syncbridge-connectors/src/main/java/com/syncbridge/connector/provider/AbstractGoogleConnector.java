package com.syncbridge.connector.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.connector.AbstractConnector;
import com.syncbridge.connector.Credentials;
import com.syncbridge.connector.ProviderConfig;
import com.syncbridge.connector.ProviderMetadata;
import com.syncbridge.connector.bridge.ProviderBridge;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Shared Google OAuth 2.0 plumbing for Gmail, Calendar and Drive.
 */
public abstract class AbstractGoogleConnector extends AbstractConnector {

    private final String authBase;
    private final String tokenUrl;
    private final String userinfoUrl;
    protected final String apiBase;

    protected AbstractGoogleConnector(ProviderMetadata metadata, ProviderConfig config, ProviderBridge bridge,
                                      ObjectMapper objectMapper, Executor executor, String defaultApiBase) {
        super(metadata, config, bridge, objectMapper, executor);
        this.authBase = this.config.authBaseUrlOr("https://accounts.google.com");
        this.tokenUrl = this.config.option("token-url", "https://oauth2.googleapis.com/token");
        this.userinfoUrl = this.config.option("userinfo-url", "https://www.googleapis.com/oauth2/v2/userinfo");
        this.apiBase = this.config.apiBaseUrlOr(defaultApiBase);
    }

    @Override
    protected String authorizeEndpoint() {
        return authBase + "/o/oauth2/v2/auth";
    }

    @Override
    protected String tokenEndpoint() {
        return tokenUrl;
    }

    @Override
    protected Map<String, String> extraAuthorizeParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("access_type", "offline");
        params.put("prompt", "consent");
        params.put("include_granted_scopes", "true");
        return params;
    }

    /**
     * Uses the account email as the external id, which push notifications also carry.
     */
    @Override
    protected Credentials identify(Credentials credentials) {
        JsonNode userinfo = getJson(URI.create(userinfoUrl), credentials.accessToken());
        String email = text(userinfo, "email");
        String externalId = email != null ? email : text(userinfo, "id");
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (email != null) {
            metadata.put("email", email);
        }
        return credentials.withIdentity(externalId, email, metadata);
    }
}
