package com.syncbridge.api.executor;

import com.syncbridge.api.support.IntegrationTestSupport;
import com.syncbridge.connector.Credentials;
import com.syncbridge.connector.Cursor;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.connector.SyncException;
import com.syncbridge.connector.SyncResult;
import com.syncbridge.core.domain.Connection;
import com.syncbridge.core.domain.Connection.ConnectionStatus;
import com.syncbridge.core.domain.ConnectionSyncMetadata;
import com.syncbridge.core.domain.SyncJob;
import com.syncbridge.core.domain.SyncJob.JobStatus;
import com.syncbridge.core.domain.SyncJob.JobType;
import com.syncbridge.core.repository.SignalRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Executor behaviour against PostgreSQL: claiming, retries, refresh-on-401, signals and cursors.
 */
class SyncExecutorTest extends IntegrationTestSupport {

    private static final Instant T1 = Instant.parse("2024-06-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-06-02T10:00:00Z");

    @Autowired
    private SyncExecutor executor;

    @Autowired
    private SyncJobQueue jobQueue;

    @Autowired
    private SignalRepository signalRepository;

    private UUID enqueue(Connection connection, JobType type) {
        return enqueue(connection, type, null);
    }

    private UUID enqueue(Connection connection, JobType type, Map<String, Object> cursor) {
        return jobQueue.enqueue(type, connection.getTenantId(), connection.getProviderSlug(), connection.getId(),
                Instant.now().minusSeconds(1), SyncJobQueue.SCHEDULED_PRIORITY, cursor);
    }

    private static NormalizedSignal signal(String kind, String dedupeKey) {
        return new NormalizedSignal(kind, T1, Map.of("id", dedupeKey != null ? dedupeKey : "none"), dedupeKey);
    }

    // ==================== Success path ====================

    @Test
    void successfulRunStoresSignalsAndCursor() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSync(SyncResult.complete(
                List.of(signal("issue_created", "issue-1"), signal("issue_updated", "issue-2")),
                Cursor.ofInstant(T1)));

        List<JobOutcome> outcomes = executor.runOnce();

        assertThat(outcomes).containsExactly(JobOutcome.SUCCEEDED);
        SyncJob job = job(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(job.getFinishedAt()).isNotNull();
        assertThat(job.getError()).isNull();
        assertThat(signalRepository.countByConnectionId(connection.getId())).isEqualTo(2);
        assertThat(reload(connection).syncMetadata().getCursor()).isEqualTo(T1.toString());
        assertThat(scripted.syncCalls().get(0).accessToken()).isEqualTo("access-token");
    }

    @Test
    void duplicateSignalsAreStoredOnce() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        enqueue(connection, JobType.INCREMENTAL);
        scripted.onSync(SyncResult.complete(List.of(signal("pr_opened", "pr-1")), null));
        executor.runOnce();

        enqueue(connection, JobType.INCREMENTAL);
        scripted.onSync(SyncResult.complete(
                List.of(signal("pr_opened", "pr-1"), signal("pr_merged", "pr-2"), signal("code_pushed", null)),
                null));
        executor.runOnce();

        assertThat(signalRepository.countByConnectionId(connection.getId())).isEqualTo(3);
        assertThat(signalRepository.findByTenantIdAndProviderSlugAndDedupeKey(
                connection.getTenantId(), "scripted", "pr-1")).isPresent();
    }

    @Test
    void cursorNeverMovesBackwards() {
        ConnectionSyncMetadata sync = ConnectionSyncMetadata.empty();
        sync.setCursor(T2.toString());
        Connection connection = createConnection("scripted", UUID.randomUUID(), "access-token", "refresh-token",
                null, sync.writeTo(Map.of()));
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSync(SyncResult.complete(List.of(), Cursor.ofInstant(T1)));

        executor.runOnce();

        assertThat(scripted.syncCalls().get(0).cursor()).isEqualTo(Cursor.ofInstant(T2));
        assertThat(job(jobId).getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(reload(connection).syncMetadata().getCursor()).isEqualTo(T2.toString());
    }

    @Test
    void hasMoreEnqueuesImmediateContinuation() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID first = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSync(SyncResult.partial(List.of(signal("file_created", "f-1")), Cursor.ofString("page-2")))
                .onSync(SyncResult.complete(List.of(signal("file_created", "f-2")), Cursor.ofString("page-3")));

        executor.runOnce();

        List<SyncJob> jobs = syncJobRepository.findByConnectionIdAndJobTypeOrderByCreatedAtAsc(
                connection.getId(), JobType.INCREMENTAL);
        assertThat(jobs).hasSize(2);
        assertThat(jobs.get(0).getId()).isEqualTo(first);
        SyncJob continuation = jobs.get(1);
        assertThat(continuation.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(continuation.getCursor()).containsEntry("value", "page-2");
        assertThat(continuation.getPriority()).isEqualTo(SyncJobQueue.SCHEDULED_PRIORITY);

        executor.runOnce();

        assertThat(scripted.syncCalls().get(1).cursor()).isEqualTo(Cursor.ofString("page-2"));
        assertThat(job(continuation.getId()).getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(reload(connection).syncMetadata().getCursor()).isEqualTo("page-3");
        assertThat(signalRepository.countByConnectionId(connection.getId())).isEqualTo(2);
    }

    @Test
    void webhookContinuationPullsScheduledIncrementalForward() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        assertThat(jobQueue.enqueueIncremental(connection.getTenantId(), connection.getProviderSlug(),
                connection.getId(), Instant.now().plusSeconds(900), SyncJobQueue.SCHEDULED_PRIORITY, null)).isTrue();
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("webhook_payload", Map.of("action", "opened"));
        envelope.put(JobRunner.WEBHOOK_SIGNALS, List.of());
        UUID webhookJob = enqueue(connection, JobType.WEBHOOK, envelope);
        scripted.onSync(SyncResult.partial(List.of(signal("pr_updated", "wh-page-1")), Cursor.ofString("page-2")))
                .onSync(SyncResult.complete(List.of(), Cursor.ofString("page-3")));

        executor.runOnce();

        assertThat(job(webhookJob).getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        List<SyncJob> pending = syncJobRepository.findByConnectionIdAndJobTypeOrderByCreatedAtAsc(
                connection.getId(), JobType.INCREMENTAL);
        assertThat(pending).singleElement().satisfies(job -> {
            assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
            assertThat(job.getScheduledAt()).isBeforeOrEqualTo(Instant.now());
            assertThat(job.getCursor()).containsEntry("value", "page-2");
        });

        executor.runOnce();

        assertThat(scripted.syncCalls()).hasSize(2);
        assertThat(scripted.syncCalls().get(1).cursor()).isEqualTo(Cursor.ofString("page-2"));
        assertThat(job(pending.get(0).getId()).getStatus()).isEqualTo(JobStatus.SUCCEEDED);
    }

    @Test
    void webhookJobPersistsCarriedSignals() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("webhook_payload", Map.of("action", "opened"));
        envelope.put(JobRunner.WEBHOOK_SIGNALS, List.of(signal("pr_opened", "wh-1").toMap()));
        UUID jobId = enqueue(connection, JobType.WEBHOOK, envelope);
        scripted.onSync(SyncResult.complete(List.of(signal("pr_updated", "sync-1")), null));

        executor.runOnce();

        assertThat(job(jobId).getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(signalRepository.findByConnectionIdOrderByOccurredAtAsc(connection.getId()))
                .extracting(s -> s.getDedupeKey())
                .containsExactlyInAnyOrder("wh-1", "sync-1");
    }

    // ==================== Claiming ====================

    @Test
    void concurrentClaimsNeverShareAJob() throws Exception {
        Set<UUID> expected = new HashSet<>();
        for (int i = 0; i < 6; i++) {
            expected.add(enqueue(createConnection("scripted", UUID.randomUUID()), JobType.INCREMENTAL));
        }

        CyclicBarrier barrier = new CyclicBarrier(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<ClaimedJob> claimed = new ArrayList<>();
        try {
            List<Future<List<ClaimedJob>>> results = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                results.add(pool.submit(() -> {
                    barrier.await(10, TimeUnit.SECONDS);
                    return jobQueue.claim(10);
                }));
            }
            for (Future<List<ClaimedJob>> result : results) {
                claimed.addAll(result.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(claimed).extracting(ClaimedJob::id).doesNotHaveDuplicates();
        assertThat(claimed).extracting(ClaimedJob::id).containsExactlyInAnyOrderElementsOf(expected);
        assertThat(jobQueue.claim(10)).isEmpty();
        assertThat(syncJobRepository.countByStatus(JobStatus.RUNNING)).isEqualTo(6);
    }

    @Test
    void connectionRunsAtMostOneJobAtATime() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        enqueue(connection, JobType.INCREMENTAL);
        enqueue(connection, JobType.WEBHOOK, Map.of());

        List<ClaimedJob> first = jobQueue.claim(10);
        List<ClaimedJob> second = jobQueue.claim(10);

        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();

        jobQueue.complete(first.get(0), List.of(), null, false);
        assertThat(jobQueue.claim(10)).hasSize(1);
    }

    @Test
    void higherPriorityJobsAreClaimedFirst() {
        Connection low = createConnection("scripted", UUID.randomUUID());
        Connection high = createConnection("scripted", UUID.randomUUID());
        enqueue(low, JobType.INCREMENTAL);
        UUID webhookJob = jobQueue.enqueue(JobType.WEBHOOK, high.getTenantId(), "scripted", high.getId(),
                Instant.now().minusSeconds(1), SyncJobQueue.WEBHOOK_PRIORITY, Map.of());

        List<ClaimedJob> claimed = jobQueue.claim(1);

        assertThat(claimed).extracting(ClaimedJob::id).containsExactly(webhookJob);
    }

    @Test
    void futureJobsAreNotClaimed() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        jobQueue.enqueue(JobType.INCREMENTAL, connection.getTenantId(), "scripted", connection.getId(),
                Instant.now().plusSeconds(600), SyncJobQueue.SCHEDULED_PRIORITY, null);

        assertThat(jobQueue.claim(10)).isEmpty();
    }

    @Test
    void staleClaimsAreReleasedAndRetried() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        jdbcTemplate.update("UPDATE sync_jobs SET status = 'RUNNING', attempts = 1, started_at = ? WHERE id = ?",
                Timestamp.from(Instant.now().minusSeconds(20 * 60)), jobId);

        assertThat(executor.releaseStaleClaims()).isEqualTo(1);

        SyncJob released = job(jobId);
        assertThat(released.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(released.getError()).containsEntry("type", "stale_claim");

        scripted.onSync(SyncResult.empty(null));
        assertThat(executor.runOnce()).containsExactly(JobOutcome.SUCCEEDED);
        assertThat(job(jobId).getAttempts()).isEqualTo(2);
    }

    @Test
    void recentlyStartedJobsAreNotReleased() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        jdbcTemplate.update("UPDATE sync_jobs SET status = 'RUNNING', started_at = ? WHERE id = ?",
                Timestamp.from(Instant.now().minusSeconds(60)), jobId);

        assertThat(executor.releaseStaleClaims()).isZero();
        assertThat(job(jobId).getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    // ==================== Failures ====================

    @Test
    void transientFailureIsRetriedWithBackoff() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSyncFail(SyncException.transientFailure("502 from provider"))
                .onSync(SyncResult.complete(List.of(signal("issue_created", "i-1")), null));
        Instant before = Instant.now();

        assertThat(executor.runOnce()).containsExactly(JobOutcome.RETRY_SCHEDULED);

        SyncJob retried = job(jobId);
        assertThat(retried.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(retried.getAttempts()).isEqualTo(1);
        assertThat(retried.getRetryAfter()).isAfter(before.plusSeconds(9));
        assertThat(retried.getRetryAfter()).isBefore(before.plusSeconds(20));
        assertThat(retried.getError())
                .containsEntry("type", "transient")
                .containsEntry("message", "502 from provider")
                .containsEntry("attempts", 1)
                .containsEntry("is_rate_limited", false)
                .containsKey("backoff_seconds")
                .containsKey("timestamp");
        assertThat(executor.runOnce()).isEmpty();

        makeDue(jobId);
        assertThat(executor.runOnce()).containsExactly(JobOutcome.SUCCEEDED);
        SyncJob succeeded = job(jobId);
        assertThat(succeeded.getAttempts()).isEqualTo(2);
        assertThat(succeeded.getError()).isNull();
        assertThat(succeeded.getRetryAfter()).isNull();
    }

    @Test
    void rateLimitHintIsHonoured() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSyncFail(SyncException.rateLimited(600L, "secondary rate limit"));
        Instant before = Instant.now();

        executor.runOnce();

        SyncJob retried = job(jobId);
        assertThat(retried.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(retried.getRetryAfter()).isAfterOrEqualTo(before.plusSeconds(600));
        assertThat(retried.getError())
                .containsEntry("type", "rate_limited")
                .containsEntry("retry_after_secs", 600)
                .containsEntry("is_rate_limited", true);
    }

    @Test
    void permanentFailureFailsImmediately() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSyncFail(SyncException.permanent("404 repository gone"));

        assertThat(executor.runOnce()).containsExactly(JobOutcome.FAILED);

        SyncJob failed = job(jobId);
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getFinishedAt()).isNotNull();
        assertThat(failed.getError()).containsEntry("type", "permanent");
        assertThat(reload(connection).getStatus()).isEqualTo(ConnectionStatus.ACTIVE);
    }

    @Test
    void exhaustedAttemptsFailTheJob() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        jdbcTemplate.update("UPDATE sync_jobs SET attempts = 9 WHERE id = ?", jobId);
        scripted.onSyncFail(SyncException.transientFailure("still down"));

        assertThat(executor.runOnce()).containsExactly(JobOutcome.FAILED);

        SyncJob failed = job(jobId);
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getAttempts()).isEqualTo(10);
        assertThat(failed.getError())
                .containsEntry("reason", JobRunner.MAX_ATTEMPTS_EXCEEDED)
                .containsEntry("type", "transient");
    }

    @Test
    void slowSyncTimesOutAndIsRetried() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSync(params -> new CompletableFuture<>());

        assertThat(executor.runOnce()).containsExactly(JobOutcome.RETRY_SCHEDULED);

        assertThat(job(jobId).getError())
                .containsEntry("type", "transient")
                .hasEntrySatisfying("message", message -> assertThat((String) message).contains("timed out"));
    }

    @Test
    void inactiveConnectionFailsJobWithoutCallingConnector() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        setStatus(connection, ConnectionStatus.REVOKED);

        assertThat(executor.runOnce()).containsExactly(JobOutcome.FAILED);

        assertThat(job(jobId).getError()).containsEntry("type", "permanent");
        assertThat(scripted.syncCalls()).isEmpty();
    }

    @Test
    void unregisteredProviderFailsJob() {
        Connection connection = createConnection("retired-provider", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);

        assertThat(executor.runOnce()).containsExactly(JobOutcome.FAILED);

        assertThat(job(jobId).getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void undecryptableTokenFailsJob() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        jdbcTemplate.update("UPDATE connections SET access_token_ciphertext = ? WHERE id = ?",
                new byte[40], connection.getId());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);

        assertThat(executor.runOnce()).containsExactly(JobOutcome.FAILED);

        assertThat(job(jobId).getError()).containsEntry("type", "permanent");
        assertThat(scripted.syncCalls()).isEmpty();
    }

    // ==================== Unauthorized handling ====================

    @Test
    void unauthorizedTriggersRefreshAndRetry() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        Instant newExpiry = Instant.parse("2030-01-01T00:00:00Z");
        scripted.onSyncFail(SyncException.unauthorized("token expired"))
                .onRefresh(Credentials.tokens("fresh-access", "fresh-refresh", newExpiry, List.of("read")))
                .onSync(params -> "fresh-access".equals(params.accessToken())
                        ? CompletableFuture.completedFuture(SyncResult.empty(null))
                        : CompletableFuture.failedFuture(SyncException.unauthorized("stale token")));

        assertThat(executor.runOnce()).containsExactly(JobOutcome.SUCCEEDED);

        assertThat(job(jobId).getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(scripted.refreshCalls()).hasSize(1);
        assertThat(scripted.refreshCalls().get(0).refreshToken()).isEqualTo("refresh-token");
        Connection reloaded = reload(connection);
        assertThat(reloaded.getStatus()).isEqualTo(ConnectionStatus.ACTIVE);
        assertThat(decrypt(reloaded.getAccessTokenCiphertext(), reloaded)).isEqualTo("fresh-access");
        assertThat(decrypt(reloaded.getRefreshTokenCiphertext(), reloaded)).isEqualTo("fresh-refresh");
        assertThat(reloaded.getExpiresAt()).isEqualTo(newExpiry);
    }

    @Test
    void secondUnauthorizedMovesConnectionToError() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSyncFail(SyncException.unauthorized("token expired"))
                .onRefresh(Credentials.tokens("fresh-access", null, null, List.of()))
                .onSyncFail(SyncException.unauthorized("still unauthorized"));

        assertThat(executor.runOnce()).containsExactly(JobOutcome.FAILED);

        assertThat(job(jobId).getError()).containsEntry("type", "unauthorized");
        assertThat(reload(connection).getStatus()).isEqualTo(ConnectionStatus.ERROR);
    }

    @Test
    void revokedGrantMovesConnectionToError() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSyncFail(SyncException.unauthorized("token expired"))
                .onRefreshFail(SyncException.permanent("invalid_grant: token has been revoked"));

        assertThat(executor.runOnce()).containsExactly(JobOutcome.FAILED);

        assertThat(job(jobId).getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(reload(connection).getStatus()).isEqualTo(ConnectionStatus.ERROR);
    }

    @Test
    void transientRefreshFailureRetriesJobAndKeepsConnectionActive() {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSyncFail(SyncException.unauthorized("token expired"))
                .onRefreshFail(SyncException.transientFailure("connection reset"));

        assertThat(executor.runOnce()).containsExactly(JobOutcome.RETRY_SCHEDULED);

        assertThat(job(jobId).getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(reload(connection).getStatus()).isEqualTo(ConnectionStatus.ACTIVE);
    }

    @Test
    void workerPoolRunsClaimedJobs() throws Exception {
        Connection connection = createConnection("scripted", UUID.randomUUID());
        UUID jobId = enqueue(connection, JobType.INCREMENTAL);
        scripted.onSync(SyncResult.complete(List.of(signal("message_posted", "m-1")), null));

        assertThat(executor.tick()).isEqualTo(1);

        long deadline = System.currentTimeMillis() + 10_000;
        while (job(jobId).getStatus() != JobStatus.SUCCEEDED && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(job(jobId).getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(signalRepository.countByConnectionId(connection.getId())).isEqualTo(1);
    }
}
