package com.syncbridge.api.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.api.config.SyncBridgeProperties;
import com.syncbridge.api.config.SyncBridgeProperties.ConnectionResolution;
import com.syncbridge.api.config.WebhookRateLimiter;
import com.syncbridge.api.executor.JobRunner;
import com.syncbridge.api.executor.SyncJobQueue;
import com.syncbridge.api.security.OperatorAuthenticator;
import com.syncbridge.connector.Connector;
import com.syncbridge.connector.ConnectorRegistry;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.connector.SyncException;
import com.syncbridge.connector.WebhookParams;
import com.syncbridge.core.domain.Connection;
import com.syncbridge.core.domain.Connection.ConnectionStatus;
import com.syncbridge.core.domain.SyncJob.JobType;
import com.syncbridge.core.repository.ConnectionRepository;
import io.github.bucket4j.ConsumptionProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Accepts provider webhook pushes and turns them into webhook jobs.
 *
 * Checks run in a fixed order: provider lookup, authentication, rate limit, signature,
 * body parsing, connection resolution. Nothing reaches the connector or the queue
 * unless every check passed.
 */
@Service
public class WebhookIngestService {

    private static final Logger log = LoggerFactory.getLogger(WebhookIngestService.class);

    static final String TENANT_HEADER = "x-tenant-id";
    static final String CONNECTION_HEADER = "x-connection-id";

    static final Set<String> SENSITIVE_HEADERS = Set.of(
            "authorization", "cookie", "set-cookie", "proxy-authorization", "www-authenticate",
            "authentication-info", "x-api-key", "x-auth-token", "x-csrf-token", "x-xsrf-token");

    private final SyncBridgeProperties.Webhooks settings;
    private final ConnectorRegistry registry;
    private final OperatorAuthenticator operatorAuthenticator;
    private final WebhookVerifier verifier;
    private final WebhookRateLimiter rateLimiter;
    private final ConnectionRepository connectionRepository;
    private final SyncJobQueue jobQueue;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebhookIngestService(SyncBridgeProperties properties,
                                ConnectorRegistry registry,
                                OperatorAuthenticator operatorAuthenticator,
                                WebhookVerifier verifier,
                                WebhookRateLimiter rateLimiter,
                                ConnectionRepository connectionRepository,
                                SyncJobQueue jobQueue,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.settings = properties.getWebhooks();
        this.registry = registry;
        this.operatorAuthenticator = operatorAuthenticator;
        this.verifier = verifier;
        this.rateLimiter = rateLimiter;
        this.connectionRepository = connectionRepository;
        this.jobQueue = jobQueue;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Operator path: bearer token plus {@code X-Tenant-Id}, no signature check.
     */
    public IngestResult ingestAsOperator(String provider, byte[] rawBody, Map<String, String> rawHeaders) {
        Connector connector = registry.get(provider);
        Map<String, String> headers = lowerCaseHeaders(rawHeaders);
        if (!operatorAuthenticator.isOperator(headers.get("authorization"))) {
            throw new WebhookUnauthorizedException("Operator token required");
        }
        UUID tenantId = parseUuid(headers.get(TENANT_HEADER), "X-Tenant-Id header must be a UUID");
        return process(connector, tenantId, rawBody, headers);
    }

    /**
     * Public path: authenticated by the provider's signature scheme, or by an operator token.
     */
    public IngestResult ingestSigned(String provider, String tenantSegment, byte[] rawBody, Map<String, String> rawHeaders) {
        Connector connector = registry.get(provider);
        Map<String, String> headers = lowerCaseHeaders(rawHeaders);
        UUID tenantId = parseUuid(tenantSegment, "Tenant must be a UUID");

        if (!operatorAuthenticator.isOperator(headers.get("authorization"))) {
            if (!verifier.hasSecret(provider)) {
                log.warn("Rejected {} webhook for tenant {}: no secret configured", provider, tenantId);
                throw new WebhookUnauthorizedException("Webhook verification is not configured for " + provider);
            }
            ConsumptionProbe probe = rateLimiter.tryConsume(provider, tenantId);
            if (!probe.isConsumed()) {
                long retryAfter = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()));
                log.warn("Rejected {} webhook for tenant {}: rate limited", provider, tenantId);
                throw new WebhookRateLimitedException(retryAfter);
            }
            try {
                verifier.verify(provider, rawBody, headers);
            } catch (WebhookVerifier.VerificationException e) {
                log.warn("Rejected {} webhook for tenant {}: {}", provider, tenantId, e.getMessage());
                throw new WebhookUnauthorizedException(e.getMessage());
            }
        }
        return process(connector, tenantId, rawBody, headers);
    }

    private IngestResult process(Connector connector, UUID tenantId, byte[] rawBody, Map<String, String> headers) {
        String provider = connector.name();
        if (rawBody != null && rawBody.length > settings.getMaxBodyBytes()) {
            throw new WebhookPayloadTooLargeException(rawBody.length, settings.getMaxBodyBytes());
        }
        JsonNode payload = parseBody(rawBody);
        Map<String, String> forwarded = forwardedHeaders(headers);
        Connection connection = resolveConnection(provider, tenantId, headers.get(CONNECTION_HEADER));

        List<NormalizedSignal> signals;
        try {
            signals = connector.handleWebhook(new WebhookParams(tenantId, connection, payload, forwarded));
        } catch (SyncException e) {
            if (e.getKind() == SyncException.Kind.PERMANENT) {
                log.warn("Rejected {} webhook for tenant {}: {}", provider, tenantId, e.getMessage());
                throw new WebhookPayloadRejectedException(e.getMessage());
            }
            log.warn("{} webhook handler failed ({}), enqueueing without signals: {}",
                    provider, e.getKind().wireName(), e.getMessage());
            signals = List.of();
        }

        if (connection == null) {
            log.info("Accepted {} webhook for tenant {} with {} signals but no resolvable connection; nothing enqueued",
                    provider, tenantId, signals.size());
            return new IngestResult(null, signals.size());
        }

        Instant now = clock.instant();
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("webhook_headers", forwarded);
        envelope.put("webhook_payload", objectMapper.convertValue(payload, Object.class));
        envelope.put(JobRunner.WEBHOOK_SIGNALS, signals.stream().map(NormalizedSignal::toMap).toList());
        envelope.put("received_at", now.toString());

        UUID jobId = jobQueue.enqueue(JobType.WEBHOOK, tenantId, provider, connection.getId(),
                now, SyncJobQueue.WEBHOOK_PRIORITY, envelope);
        log.info("Accepted {} webhook for connection {}: job {} with {} signals",
                provider, connection.getId(), jobId, signals.size());
        return new IngestResult(jobId, signals.size());
    }

    private Connection resolveConnection(String provider, UUID tenantId, String connectionHeader) {
        if (connectionHeader != null && !connectionHeader.isBlank()) {
            UUID connectionId = parseUuid(connectionHeader, "X-Connection-Id header must be a UUID");
            Connection connection = connectionRepository.findByIdAndTenantIdAndProviderSlug(connectionId, tenantId, provider)
                    .orElseThrow(() -> new WebhookConnectionNotFoundException(connectionId));
            if (!connection.isActive()) {
                log.info("Connection {} is {}, webhook not enqueued", connectionId, connection.getStatus());
                return null;
            }
            return connection;
        }

        ConnectionResolution strategy = settings.getConnectionResolution();
        if (strategy == ConnectionResolution.REQUIRE_HEADER) {
            return null;
        }
        List<Connection> active = connectionRepository
                .findByTenantIdAndProviderSlugAndStatusOrderByCreatedAtAsc(tenantId, provider, ConnectionStatus.ACTIVE);
        if (active.isEmpty()) {
            return null;
        }
        if (strategy == ConnectionResolution.SINGLE_ACTIVE && active.size() > 1) {
            log.info("Tenant {} has {} active {} connections; webhook needs X-Connection-Id", tenantId, active.size(), provider);
            return null;
        }
        return active.get(0);
    }

    private JsonNode parseBody(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(rawBody);
            return node != null && !node.isMissingNode() ? node : objectMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            throw new InvalidWebhookException("Body is not valid JSON");
        } catch (IOException e) {
            throw new InvalidWebhookException("Body could not be read");
        }
    }

    static Map<String, String> lowerCaseHeaders(Map<String, String> headers) {
        Map<String, String> lower = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null) {
                    lower.putIfAbsent(name.toLowerCase(Locale.ROOT), value);
                }
            });
        }
        return lower;
    }

    static Map<String, String> forwardedHeaders(Map<String, String> lowerCaseHeaders) {
        Map<String, String> forwarded = new LinkedHashMap<>(lowerCaseHeaders);
        forwarded.keySet().removeAll(SENSITIVE_HEADERS);
        return forwarded;
    }

    private static UUID parseUuid(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new InvalidWebhookException(message);
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidWebhookException(message);
        }
    }

    /**
     * @param jobId       Enqueued webhook job, null when no connection could be resolved
     * @param signalCount Signals produced by the connector
     */
    public record IngestResult(UUID jobId, int signalCount) {}

    public static class WebhookUnauthorizedException extends RuntimeException {
        public WebhookUnauthorizedException(String message) {
            super(message);
        }
    }

    public static class InvalidWebhookException extends RuntimeException {
        public InvalidWebhookException(String message) {
            super(message);
        }
    }

    public static class WebhookPayloadRejectedException extends RuntimeException {
        public WebhookPayloadRejectedException(String message) {
            super(message);
        }
    }

    public static class WebhookPayloadTooLargeException extends RuntimeException {
        public WebhookPayloadTooLargeException(int size, int limit) {
            super("Body of " + size + " bytes exceeds limit of " + limit);
        }
    }

    public static class WebhookConnectionNotFoundException extends RuntimeException {
        public WebhookConnectionNotFoundException(UUID connectionId) {
            super("Connection " + connectionId + " not found for this tenant and provider");
        }
    }

    public static class WebhookRateLimitedException extends RuntimeException {
        private final long retryAfterSeconds;

        public WebhookRateLimitedException(long retryAfterSeconds) {
            super("Too many webhook requests");
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public long getRetryAfterSeconds() { return retryAfterSeconds; }
    }
}
