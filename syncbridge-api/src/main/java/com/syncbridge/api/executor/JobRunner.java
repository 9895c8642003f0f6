package com.syncbridge.api.executor;

import com.syncbridge.api.config.SyncBridgeProperties;
import com.syncbridge.api.ratelimit.RateLimitPolicy;
import com.syncbridge.api.security.TokenEncryptionService;
import com.syncbridge.api.token.TokenRefreshService;
import com.syncbridge.connector.Connector;
import com.syncbridge.connector.ConnectorRegistry;
import com.syncbridge.connector.Cursor;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.connector.SyncException;
import com.syncbridge.connector.SyncParams;
import com.syncbridge.connector.SyncResult;
import com.syncbridge.core.domain.Connection;
import com.syncbridge.core.domain.Connection.ConnectionStatus;
import com.syncbridge.core.domain.SyncJob.JobType;
import com.syncbridge.core.repository.ConnectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one claimed job against its connector and records the outcome.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    public static final String WEBHOOK_SIGNALS = "webhook_signals";
    public static final String MAX_ATTEMPTS_EXCEEDED = "max_attempts_exceeded";

    private final SyncBridgeProperties.Executor settings;
    private final SyncJobQueue jobQueue;
    private final ConnectionRepository connectionRepository;
    private final ConnectorRegistry registry;
    private final TokenEncryptionService encryption;
    private final TokenRefreshService tokenRefreshService;
    private final RateLimitPolicy rateLimitPolicy;
    private final Clock clock;

    public JobRunner(SyncBridgeProperties properties,
                     SyncJobQueue jobQueue,
                     ConnectionRepository connectionRepository,
                     ConnectorRegistry registry,
                     TokenEncryptionService encryption,
                     TokenRefreshService tokenRefreshService,
                     RateLimitPolicy rateLimitPolicy,
                     Clock clock) {
        this.settings = properties.getExecutor();
        this.jobQueue = jobQueue;
        this.connectionRepository = connectionRepository;
        this.registry = registry;
        this.encryption = encryption;
        this.tokenRefreshService = tokenRefreshService;
        this.rateLimitPolicy = rateLimitPolicy;
        this.clock = clock;
    }

    public JobOutcome run(ClaimedJob job) {
        try {
            return execute(job);
        } catch (JobInterruptedException e) {
            log.warn("Job {} interrupted, leaving it RUNNING for the stale sweep", job.id());
            return JobOutcome.ABANDONED;
        } catch (SyncJobQueue.StaleClaimException e) {
            log.warn("Job {} was released while running; result discarded", job.id());
            return JobOutcome.ABANDONED;
        }
    }

    private JobOutcome execute(ClaimedJob job) {
        Connection connection = connectionRepository.findById(job.connectionId()).orElse(null);
        if (connection == null) {
            return fail(job, SyncException.permanent("Connection " + job.connectionId() + " not found"), false);
        }
        if (!connection.isActive()) {
            return fail(job, SyncException.permanent("Connection " + job.connectionId() + " is " + connection.getStatus()), false);
        }
        Connector connector;
        try {
            connector = registry.get(job.providerSlug());
        } catch (ConnectorRegistry.ProviderNotFoundException e) {
            return fail(job, SyncException.permanent("Provider " + e.getProvider() + " is not registered"), false);
        }

        List<NormalizedSignal> carried = job.jobType() == JobType.WEBHOOK ? webhookSignals(job) : List.of();
        Cursor cursor = effectiveCursor(job, connection);

        SyncResult result;
        try {
            result = syncWithRefresh(connector, connection, cursor);
        } catch (TerminalUnauthorized e) {
            connectionRepository.updateStatus(connection.getId(), ConnectionStatus.ERROR, clock.instant());
            log.warn("Connection {} ({}) moved to ERROR after failed re-authorization",
                    connection.getId(), connection.getProviderSlug());
            return fail(job, e.error, false);
        } catch (SyncException e) {
            return handleFailure(job, e);
        }

        List<NormalizedSignal> signals = carried;
        if (!result.signals().isEmpty()) {
            signals = new ArrayList<>(carried);
            signals.addAll(result.signals());
        }
        int inserted = jobQueue.complete(job, signals, result.nextCursor(), result.needsContinuation());
        log.info("Job {} ({} {}) succeeded: {} signals ({} new), continuation={}",
                job.id(), job.providerSlug(), job.jobType(), signals.size(), inserted, result.needsContinuation());
        return JobOutcome.SUCCEEDED;
    }

    /**
     * Runs the sync; on UNAUTHORIZED refreshes the credentials once and tries again.
     */
    private SyncResult syncWithRefresh(Connector connector, Connection connection, Cursor cursor) {
        try {
            return invoke(connector, connection, cursor);
        } catch (SyncException e) {
            if (e.getKind() != SyncException.Kind.UNAUTHORIZED) {
                throw e;
            }
            log.info("Connection {} returned 401, refreshing credentials", connection.getId());
        }

        Connection refreshed;
        try {
            refreshed = tokenRefreshService.refreshOnDemand(connection.getId());
        } catch (SyncException refreshError) {
            if (refreshError.getKind() == SyncException.Kind.PERMANENT) {
                throw new TerminalUnauthorized(refreshError);
            }
            throw refreshError;
        }

        try {
            return invoke(connector, refreshed, cursor);
        } catch (SyncException retryError) {
            if (retryError.getKind() == SyncException.Kind.UNAUTHORIZED) {
                throw new TerminalUnauthorized(retryError);
            }
            throw retryError;
        }
    }

    private SyncResult invoke(Connector connector, Connection connection, Cursor cursor) {
        String accessToken = decryptAccessToken(connection);
        CompletableFuture<SyncResult> future;
        try {
            future = connector.sync(new SyncParams(connection, accessToken, cursor));
        } catch (RuntimeException e) {
            throw SyncException.unwrap(e);
        }
        try {
            return future.get(settings.getMaxRunSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw SyncException.transientFailure("Sync timed out after " + settings.getMaxRunSeconds() + "s", e);
        } catch (ExecutionException e) {
            throw SyncException.unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new JobInterruptedException();
        }
    }

    private String decryptAccessToken(Connection connection) {
        if (connection.getAccessTokenCiphertext() == null) {
            return null;
        }
        try {
            return encryption.decrypt(connection.getAccessTokenCiphertext(),
                    connection.getTenantId(), connection.getProviderSlug());
        } catch (TokenEncryptionService.DecryptionException e) {
            throw new SyncException(SyncException.Kind.PERMANENT, "Stored access token cannot be decrypted",
                    null, null, e);
        }
    }

    private JobOutcome handleFailure(ClaimedJob job, SyncException error) {
        if (error.getKind() == SyncException.Kind.PERMANENT) {
            return fail(job, error, false);
        }
        if (job.attempts() >= settings.getMaxAttempts()) {
            return fail(job, error, true);
        }
        Duration delay = rateLimitPolicy.delay(job.attempts(), job.providerSlug(), error.getRetryAfterSeconds());
        Instant retryAfter = clock.instant().plus(delay);
        jobQueue.retry(job, retryAfter, errorPayload(job, error, delay));
        log.warn("Job {} ({}) attempt {} failed ({}): {}; retrying at {}",
                job.id(), job.providerSlug(), job.attempts(), error.getKind().wireName(), error.getMessage(), retryAfter);
        return JobOutcome.RETRY_SCHEDULED;
    }

    private JobOutcome fail(ClaimedJob job, SyncException error, boolean attemptsExhausted) {
        Map<String, Object> payload = errorPayload(job, error, null);
        if (attemptsExhausted) {
            payload.put("reason", MAX_ATTEMPTS_EXCEEDED);
        }
        jobQueue.fail(job, payload);
        log.warn("Job {} ({}) failed after {} attempts ({}): {}",
                job.id(), job.providerSlug(), job.attempts(),
                attemptsExhausted ? MAX_ATTEMPTS_EXCEEDED : error.getKind().wireName(), error.getMessage());
        return JobOutcome.FAILED;
    }

    /**
     * {@code {message, type, attempts, backoff_seconds, timestamp, is_rate_limited, retry_after_secs?, details?}}
     */
    Map<String, Object> errorPayload(ClaimedJob job, SyncException error, Duration backoff) {
        Map<String, Object> payload = new LinkedHashMap<>(error.toErrorMap());
        payload.put("attempts", job.attempts());
        payload.put("backoff_seconds", backoff != null ? backoff.toMillis() / 1000.0 : null);
        payload.put("timestamp", clock.instant().toString());
        payload.put("is_rate_limited", error.isRateLimited());
        return payload;
    }

    static Cursor effectiveCursor(ClaimedJob job, Connection connection) {
        if (job.jobType() == JobType.WEBHOOK) {
            return Cursor.fromObject(connection.syncMetadata().getCursor());
        }
        Cursor jobCursor = Cursor.fromJobPayload(job.cursor());
        if (jobCursor != null || job.jobType() == JobType.FULL) {
            return jobCursor;
        }
        return Cursor.fromObject(connection.syncMetadata().getCursor());
    }

    @SuppressWarnings("unchecked")
    static List<NormalizedSignal> webhookSignals(ClaimedJob job) {
        if (job.cursor() == null || !(job.cursor().get(WEBHOOK_SIGNALS) instanceof List<?> entries)) {
            return List.of();
        }
        List<NormalizedSignal> signals = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            NormalizedSignal signal = entry instanceof Map<?, ?> map
                    ? NormalizedSignal.fromMap((Map<String, Object>) map)
                    : null;
            if (signal != null) {
                signals.add(signal);
            } else {
                log.warn("Dropping unreadable webhook signal on job {}", job.id());
            }
        }
        return signals;
    }

    private static class TerminalUnauthorized extends RuntimeException {
        private final SyncException error;

        TerminalUnauthorized(SyncException error) {
            super(error.getMessage(), error);
            this.error = error;
        }
    }

    private static class JobInterruptedException extends RuntimeException {
        JobInterruptedException() {
            super("Job interrupted");
        }
    }
}
