package com.syncbridge.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.connector.bridge.BridgeRequest;
import com.syncbridge.connector.bridge.BridgeResponse;
import com.syncbridge.connector.bridge.ProviderBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Base class for provider connectors.
 *
 * Provides:
 * - OAuth2 authorize URL building, code exchange and refresh over form-encoded token endpoints
 * - HTTP status mapping onto {@link SyncException}
 * - JSON parsing of provider responses
 * - Running blocking bridge calls on the connector executor
 */
public abstract class AbstractConnector implements Connector {

    private static final Logger log = LoggerFactory.getLogger(AbstractConnector.class);

    private static final List<String> QUOTA_MARKERS = List.of(
            "ratelimitexceeded", "userratelimitexceeded", "quotaexceeded", "rate limit", "quota");

    private final ProviderMetadata metadata;
    protected final ProviderConfig config;
    protected final ProviderBridge bridge;
    protected final ObjectMapper objectMapper;
    private final Executor executor;

    protected AbstractConnector(ProviderMetadata metadata, ProviderConfig config, ProviderBridge bridge,
                                ObjectMapper objectMapper, Executor executor) {
        if (metadata == null) {
            throw new IllegalArgumentException("Provider metadata cannot be null");
        }
        if (bridge == null) {
            throw new IllegalArgumentException("Provider bridge cannot be null");
        }
        this.metadata = metadata;
        this.config = config != null ? config : ProviderConfig.empty();
        this.bridge = bridge;
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.executor = executor != null ? executor : Runnable::run;
    }

    @Override
    public String name() {
        return metadata.name();
    }

    @Override
    public ProviderMetadata metadata() {
        return metadata;
    }

    // ==================== OAuth2 ====================

    /**
     * Provider authorization endpoint, e.g. {@code https://github.com/login/oauth/authorize}.
     */
    protected abstract String authorizeEndpoint();

    /**
     * Provider token endpoint used for both code exchange and refresh.
     */
    protected abstract String tokenEndpoint();

    /**
     * Extra query parameters appended to the authorization URL.
     */
    protected Map<String, String> extraAuthorizeParams() {
        return Map.of();
    }

    /**
     * Resolves account identity after a code exchange. The default keeps the credentials as-is
     * and lets the caller fall back to a generated external id.
     */
    protected Credentials identify(Credentials credentials) {
        return credentials;
    }

    @Override
    public URI authorize(AuthorizeParams params) {
        requireClientCredentials();
        Map<String, String> query = new LinkedHashMap<>();
        query.put("client_id", config.clientId());
        query.put("redirect_uri", params.redirectUri());
        query.put("response_type", "code");
        query.put("state", params.state());
        if (!metadata.scopes().isEmpty()) {
            query.put("scope", String.join(" ", metadata.scopes()));
        }
        query.putAll(extraAuthorizeParams());
        return uri(authorizeEndpoint(), query);
    }

    @Override
    public CompletableFuture<Credentials> exchangeToken(ExchangeTokenParams params) {
        return async(() -> {
            requireClientCredentials();
            if (params.code() == null || params.code().isBlank()) {
                throw SyncException.permanent("Authorization code is required");
            }
            Map<String, String> form = new LinkedHashMap<>();
            form.put("grant_type", "authorization_code");
            form.put("code", params.code());
            form.put("redirect_uri", params.redirectUri());
            form.put("client_id", config.clientId());
            form.put("client_secret", config.clientSecret());
            Credentials credentials = postTokenForm(form, null);
            return identify(credentials);
        });
    }

    @Override
    public CompletableFuture<Credentials> refreshToken(RefreshParams params) {
        return async(() -> {
            requireClientCredentials();
            if (params.refreshToken() == null || params.refreshToken().isBlank()) {
                throw SyncException.permanent("No refresh token available for connection");
            }
            Map<String, String> form = new LinkedHashMap<>();
            form.put("grant_type", "refresh_token");
            form.put("refresh_token", params.refreshToken());
            form.put("client_id", config.clientId());
            form.put("client_secret", config.clientSecret());
            return postTokenForm(form, params.refreshToken());
        });
    }

    /**
     * Posts a token request and reads the standard OAuth2 token response.
     * An error body is mapped by its {@code error} code so that refresh classification
     * sees strings like {@code invalid_grant}.
     */
    protected Credentials postTokenForm(Map<String, String> form, String previousRefreshToken) {
        BridgeResponse response = bridge.send(BridgeRequest.postForm(URI.create(tokenEndpoint()), form));
        JsonNode body = response.body().isBlank() ? objectMapper.createObjectNode() : readJson(response);
        String error = text(body, "error");
        if (!response.isSuccess() || error != null) {
            String description = text(body, "error_description");
            String message = "Token endpoint rejected request: " + (error != null ? error : "status " + response.statusCode())
                    + (description != null ? " (" + description + ")" : "");
            if (response.statusCode() == 429 || response.statusCode() >= 500) {
                throw SyncException.fromHttpStatus(response.statusCode(), retryAfterSeconds(response), message);
            }
            throw SyncException.permanent(message, Map.of("status", response.statusCode()));
        }

        String accessToken = text(body, "access_token");
        if (accessToken == null) {
            throw SyncException.transientFailure("Token response did not contain an access token");
        }
        String refreshToken = text(body, "refresh_token");
        if (refreshToken != null && refreshToken.equals(previousRefreshToken)) {
            refreshToken = null;
        }
        Instant expiresAt = body.hasNonNull("expires_in")
                ? Instant.now().plusSeconds(body.get("expires_in").asLong())
                : null;
        String scope = text(body, "scope");
        List<String> scopes = scope == null ? metadata.scopes()
                : Arrays.stream(scope.split("[ ,]+")).filter(s -> !s.isBlank()).toList();
        return Credentials.tokens(accessToken, refreshToken, expiresAt, scopes);
    }

    protected void requireClientCredentials() {
        if (!config.hasClientCredentials()) {
            throw SyncException.permanent("Provider " + name() + " is not configured with client credentials");
        }
    }

    // ==================== HTTP helpers ====================

    /**
     * Sends an authenticated GET and returns the parsed body, or throws the mapped failure.
     */
    protected JsonNode getJson(URI uri, String accessToken) {
        BridgeResponse response = bridge.send(BridgeRequest.get(uri).withBearer(accessToken));
        checkResponse(response);
        return readJson(response);
    }

    /**
     * Throws the {@link SyncException} matching a non-success response.
     */
    protected void checkResponse(BridgeResponse response) {
        if (response.isSuccess()) {
            return;
        }
        int status = response.statusCode();
        String message = name() + " API returned status " + status;
        if (status == 403 && looksLikeQuota(response.body())) {
            Long hint = retryAfterSeconds(response);
            throw SyncException.rateLimited(hint != null ? hint : defaultQuotaRetrySeconds(), message + " (quota exceeded)");
        }
        log.debug("{} API error status={}", name(), status);
        throw SyncException.fromHttpStatus(status, retryAfterSeconds(response), message);
    }

    /**
     * Backoff hint used when a quota-style 403 carries no Retry-After header.
     */
    protected Long defaultQuotaRetrySeconds() {
        return null;
    }

    protected JsonNode readJson(BridgeResponse response) {
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw SyncException.transientFailure("Malformed " + name() + " response body", e);
        }
    }

    /**
     * Parses a numeric {@code Retry-After} header; HTTP-date values are ignored.
     */
    protected static Long retryAfterSeconds(BridgeResponse response) {
        return response.header("Retry-After")
                .map(String::trim)
                .filter(v -> !v.isEmpty() && v.chars().allMatch(Character::isDigit))
                .map(Long::parseLong)
                .orElse(null);
    }

    private static boolean looksLikeQuota(String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        return QUOTA_MARKERS.stream().anyMatch(lower::contains);
    }

    protected static URI uri(String base, Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return URI.create(base);
        }
        String encoded = query.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                        + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return URI.create(base + (base.contains("?") ? "&" : "?") + encoded);
    }

    protected <T> CompletableFuture<T> async(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, executor);
    }

    // ==================== JSON helpers ====================

    protected static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && !value.isNull() && !value.isMissingNode() ? value.asText() : null;
    }

    protected static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    protected Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = objectMapper.convertValue(node, Map.class);
        return map;
    }

    protected static SyncException unsupported(String operation) {
        return SyncException.permanent("unsupported operation: " + operation);
    }
}
