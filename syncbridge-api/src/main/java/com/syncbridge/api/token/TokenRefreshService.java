package com.syncbridge.api.token;

import com.syncbridge.api.config.SyncBridgeProperties;
import com.syncbridge.api.security.TokenEncryptionService;
import com.syncbridge.connector.Connector;
import com.syncbridge.connector.ConnectorRegistry;
import com.syncbridge.connector.Credentials;
import com.syncbridge.connector.RefreshParams;
import com.syncbridge.connector.SyncException;
import com.syncbridge.core.domain.Connection;
import com.syncbridge.core.domain.Connection.ConnectionStatus;
import com.syncbridge.core.repository.ConnectionRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.random.RandomGenerator;

/**
 * Keeps OAuth credentials fresh.
 *
 * A periodic tick refreshes connections whose access token expires within the lead time.
 * {@link #refreshOnDemand} serves the executor after a 401. Both paths share one in-flight
 * future per connection, so a connection is never refreshed twice concurrently.
 * On shutdown new refreshes are refused and in-flight ones get a grace period to store
 * whatever tokens the provider has already rotated.
 */
@Service
public class TokenRefreshService {

    private static final Logger log = LoggerFactory.getLogger(TokenRefreshService.class);

    private static final Duration MAX_JITTER = Duration.ofSeconds(5);
    private static final Duration REFRESH_TIMEOUT = Duration.ofSeconds(60);

    private static final List<String> PERMANENT_MARKERS = List.of(
            "invalid_grant", "invalid_client", "unauthorized_client", "revoked",
            "forbidden", "access_denied", "unsupported_grant_type");

    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "rate_limit", "too_many_requests", "temporarily_unavailable", "quota_exceeded");

    private final SyncBridgeProperties.TokenRefresh settings;
    private final ConnectionRepository connectionRepository;
    private final ConnectorRegistry registry;
    private final TokenEncryptionService encryption;
    private final Clock clock;
    private final RandomGenerator random;
    private final ExecutorService refreshPool;
    private final Map<UUID, CompletableFuture<Connection>> inFlight = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    public TokenRefreshService(SyncBridgeProperties properties,
                               ConnectionRepository connectionRepository,
                               ConnectorRegistry registry,
                               TokenEncryptionService encryption,
                               Clock clock,
                               RandomGenerator random) {
        this.settings = properties.getTokenRefresh();
        this.connectionRepository = connectionRepository;
        this.registry = registry;
        this.encryption = encryption;
        this.clock = clock;
        this.random = random;
        AtomicInteger counter = new AtomicInteger();
        this.refreshPool = Executors.newFixedThreadPool(Math.max(1, settings.getConcurrency()), runnable -> {
            Thread thread = new Thread(runnable, "token-refresh-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Scheduled(fixedDelayString = "${syncbridge.token-refresh.tick-interval:3600s}")
    public void scheduledTick() {
        if (!settings.isEnabled() || !accepting) {
            return;
        }
        tick();
    }

    /**
     * Refreshes every active connection whose token expires within the lead time.
     */
    public TokenRefreshStats tick() {
        Instant threshold = clock.instant().plus(settings.getLeadTime());
        List<Connection> candidates = connectionRepository.findRefreshCandidates(ConnectionStatus.ACTIVE, threshold);
        if (candidates.isEmpty()) {
            log.debug("Token refresh tick: nothing expires before {}", threshold);
            return TokenRefreshStats.empty();
        }

        List<CompletableFuture<Connection>> futures = new ArrayList<>(candidates.size());
        for (Connection connection : candidates) {
            futures.add(refresh(connection.getId(), jitterMillis()));
        }

        int refreshed = 0;
        int failed = 0;
        int permanent = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).join();
                refreshed++;
            } catch (CompletionException e) {
                SyncException error = SyncException.unwrap(e);
                failed++;
                if (error.getKind() == SyncException.Kind.PERMANENT) {
                    permanent++;
                }
                log.warn("Token refresh failed for connection {}: {} ({})",
                        candidates.get(i).getId(), error.getMessage(), error.getKind().wireName());
            }
        }

        TokenRefreshStats stats = new TokenRefreshStats(candidates.size(), refreshed, failed, permanent);
        log.info("Token refresh tick: attempted={} refreshed={} failed={} permanentFailures={}",
                stats.attempted(), stats.refreshed(), stats.failed(), stats.permanentFailures());
        return stats;
    }

    /**
     * Refreshes one connection right away, joining an in-flight refresh if there is one.
     *
     * @return the connection as stored after the refresh
     * @throws SyncException classified refresh failure
     */
    public Connection refreshOnDemand(UUID connectionId) {
        try {
            return refresh(connectionId, 0).join();
        } catch (CompletionException e) {
            throw SyncException.unwrap(e);
        }
    }

    CompletableFuture<Connection> refresh(UUID connectionId, long jitterMillis) {
        if (!accepting) {
            return CompletableFuture.failedFuture(
                    SyncException.transientFailure("Token refresh service is shutting down"));
        }
        CompletableFuture<Connection> created = new CompletableFuture<>();
        CompletableFuture<Connection> existing = inFlight.putIfAbsent(connectionId, created);
        if (existing != null) {
            return existing;
        }
        try {
            refreshPool.execute(() -> {
                Connection result = null;
                Throwable failure = null;
                try {
                    result = doRefresh(connectionId, jitterMillis);
                } catch (Throwable t) {
                    failure = t;
                }
                inFlight.remove(connectionId, created);
                if (failure != null) {
                    created.completeExceptionally(failure);
                } else {
                    created.complete(result);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(connectionId, created);
            created.completeExceptionally(SyncException.transientFailure("Token refresh pool is shut down", e));
        }
        return created;
    }

    private Connection doRefresh(UUID connectionId, long jitterMillis) {
        if (jitterMillis > 0) {
            try {
                Thread.sleep(jitterMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw SyncException.transientFailure("Token refresh interrupted", e);
            }
        }

        Connection connection = connectionRepository.findById(connectionId)
                .orElseThrow(() -> SyncException.permanent("Connection " + connectionId + " not found"));
        if (!connection.isActive()) {
            throw SyncException.permanent("Connection " + connectionId + " is " + connection.getStatus());
        }
        if (!connection.hasRefreshToken()) {
            markError(connection, "no refresh token");
            throw SyncException.permanent("Connection " + connectionId + " has no refresh token");
        }

        Credentials credentials;
        try {
            Connector connector = registry.get(connection.getProviderSlug());
            String refreshToken = encryption.decrypt(connection.getRefreshTokenCiphertext(),
                    connection.getTenantId(), connection.getProviderSlug());
            credentials = await(connector.refreshToken(new RefreshParams(connection, refreshToken)));
        } catch (ConnectorRegistry.ProviderNotFoundException e) {
            throw SyncException.permanent("Provider " + e.getProvider() + " is not registered");
        } catch (TokenEncryptionService.DecryptionException e) {
            markError(connection, "refresh token cannot be decrypted");
            throw new SyncException(SyncException.Kind.PERMANENT, "Stored refresh token cannot be decrypted",
                    null, null, e);
        } catch (SyncException e) {
            SyncException classified = classifyRefreshFailure(e);
            if (classified.getKind() == SyncException.Kind.PERMANENT) {
                markError(connection, classified.getMessage());
            }
            throw classified;
        }

        Instant now = clock.instant();
        byte[] accessToken = encryption.encrypt(credentials.accessToken(),
                connection.getTenantId(), connection.getProviderSlug());
        if (credentials.reusesPreviousRefreshToken()) {
            connectionRepository.updateAccessToken(connectionId, accessToken, credentials.expiresAt(), now);
        } else {
            byte[] refreshToken = encryption.encrypt(credentials.refreshToken(),
                    connection.getTenantId(), connection.getProviderSlug());
            connectionRepository.updateTokens(connectionId, accessToken, refreshToken, credentials.expiresAt(), now);
        }
        log.info("Refreshed credentials for connection {} ({}), expires at {}",
                connectionId, connection.getProviderSlug(), credentials.expiresAt());
        return connectionRepository.findById(connectionId)
                .orElseThrow(() -> SyncException.permanent("Connection " + connectionId + " vanished during refresh"));
    }

    private Credentials await(CompletableFuture<Credentials> future) {
        try {
            return future.get(REFRESH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw SyncException.transientFailure("Token refresh timed out after " + REFRESH_TIMEOUT.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            throw SyncException.unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SyncException.transientFailure("Token refresh interrupted", e);
        }
    }

    private void markError(Connection connection, String reason) {
        connectionRepository.updateStatus(connection.getId(), ConnectionStatus.ERROR, clock.instant());
        log.warn("Connection {} ({}) moved to ERROR: {}", connection.getId(), connection.getProviderSlug(), reason);
    }

    private long jitterMillis() {
        long bound = Math.min(
                (long) (settings.getLeadTime().toMillis() * settings.getJitterFraction()),
                MAX_JITTER.toMillis());
        return bound > 0 ? random.nextLong(bound + 1) : 0;
    }

    /**
     * Maps a refresh failure onto the taxonomy by the OAuth error codes in its message.
     * Revoked or invalid grants are permanent, throttling is rate limited, the rest is transient.
     */
    public static SyncException classifyRefreshFailure(SyncException error) {
        String message = error.getMessage() != null ? error.getMessage().toLowerCase(Locale.ROOT) : "";
        if (PERMANENT_MARKERS.stream().anyMatch(message::contains)) {
            return new SyncException(SyncException.Kind.PERMANENT, error.getMessage(), null, error.getDetails(), error);
        }
        if (error.isRateLimited() || RATE_LIMIT_MARKERS.stream().anyMatch(message::contains)) {
            return new SyncException(SyncException.Kind.RATE_LIMITED, error.getMessage(),
                    error.getRetryAfterSeconds(), error.getDetails(), error);
        }
        return new SyncException(SyncException.Kind.TRANSIENT, error.getMessage(), null, error.getDetails(), error);
    }

    @PreDestroy
    public void shutdown() {
        accepting = false;
        refreshPool.shutdown();
        try {
            if (!refreshPool.awaitTermination(settings.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = refreshPool.shutdownNow();
                log.warn("Token refresh grace period expired with {} refreshes in flight, {} not started",
                        inFlight.size(), dropped.size());
            }
        } catch (InterruptedException e) {
            refreshPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
