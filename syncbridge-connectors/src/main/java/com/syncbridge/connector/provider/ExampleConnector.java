package com.syncbridge.connector.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncbridge.connector.AuthType;
import com.syncbridge.connector.AuthorizeParams;
import com.syncbridge.connector.Connector;
import com.syncbridge.connector.Credentials;
import com.syncbridge.connector.Cursor;
import com.syncbridge.connector.ExchangeTokenParams;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.connector.ProviderMetadata;
import com.syncbridge.connector.RefreshParams;
import com.syncbridge.connector.SyncParams;
import com.syncbridge.connector.SyncResult;
import com.syncbridge.connector.WebhookParams;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * In-process reference connector. Needs no network and produces deterministic output,
 * which makes it useful for local runs and end-to-end tests.
 */
public class ExampleConnector implements Connector {

    public static final String NAME = "example";

    private static final ProviderMetadata METADATA =
            new ProviderMetadata(NAME, AuthType.OAUTH2, List.of("read"), true);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderMetadata metadata() {
        return METADATA;
    }

    @Override
    public URI authorize(AuthorizeParams params) {
        return URI.create("https://example.com/oauth/authorize?state="
                + URLEncoder.encode(params.state(), StandardCharsets.UTF_8)
                + "&redirect_uri=" + URLEncoder.encode(params.redirectUri(), StandardCharsets.UTF_8));
    }

    @Override
    public CompletableFuture<Credentials> exchangeToken(ExchangeTokenParams params) {
        Credentials credentials = Credentials.tokens("example-access-" + params.code(), "example-refresh",
                Instant.now().plusSeconds(3600), METADATA.scopes());
        return CompletableFuture.completedFuture(
                credentials.withIdentity("example-" + params.tenantId(), "Example account", Map.of()));
    }

    @Override
    public CompletableFuture<Credentials> refreshToken(RefreshParams params) {
        return CompletableFuture.completedFuture(Credentials.tokens(
                "example-access-refreshed", null, Instant.now().plusSeconds(3600), METADATA.scopes()));
    }

    @Override
    public CompletableFuture<SyncResult> sync(SyncParams params) {
        Instant now = Instant.now();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", "example sync");
        payload.put("connection_id", params.connection().getId().toString());
        NormalizedSignal signal = new NormalizedSignal("example_sync", now, payload,
                "example:" + params.connection().getId() + ":" + now.toEpochMilli());
        return CompletableFuture.completedFuture(SyncResult.complete(List.of(signal), Cursor.ofInstant(now)));
    }

    @Override
    public List<NormalizedSignal> handleWebhook(WebhookParams params) {
        JsonNode eventType = params.payload().get("event_type");
        String type = eventType != null && eventType.isTextual() ? eventType.asText() : "unknown";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", type);
        payload.put("body", params.payload().toString());
        return List.of(new NormalizedSignal("webhook:" + type, Instant.now(), payload, null));
    }
}
