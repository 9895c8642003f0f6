package com.syncbridge.api.executor;

import com.syncbridge.api.jdbc.JsonColumns;
import com.syncbridge.connector.Cursor;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.core.domain.ConnectionSyncMetadata;
import com.syncbridge.core.domain.SyncJob.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * The sync_jobs table as a work queue.
 *
 * Every state transition is a single SQL transaction using row locks with SKIP LOCKED,
 * so any number of worker processes can share the table without further coordination.
 */
@Repository
public class SyncJobQueue {

    private static final Logger log = LoggerFactory.getLogger(SyncJobQueue.class);

    public static final int SCHEDULED_PRIORITY = 30;
    public static final int WEBHOOK_PRIORITY = 50;

    /** Extra candidate rows scanned per claim slot, to step over connections that are busy. */
    private static final int CANDIDATE_SCAN_FACTOR = 4;

    private static final String INSERT_INCREMENTAL = """
            INSERT INTO sync_jobs (id, tenant_id, provider_slug, connection_id, job_type, status, priority,
                                   attempts, scheduled_at, cursor, created_at, updated_at)
            VALUES (:id, :tenantId, :provider, :connectionId, 'INCREMENTAL', 'QUEUED', :priority,
                    0, :scheduledAt, CAST(:cursor AS jsonb), :now, :now)
            ON CONFLICT (connection_id) WHERE job_type = 'INCREMENTAL' AND status IN ('QUEUED', 'RUNNING')
            DO NOTHING
            """;

    private static final String PULL_FORWARD_INCREMENTAL = """
            UPDATE sync_jobs
            SET scheduled_at = LEAST(scheduled_at, :now), priority = GREATEST(priority, :priority),
                cursor = CAST(:cursor AS jsonb), updated_at = :now
            WHERE connection_id = :connectionId AND job_type = 'INCREMENTAL' AND status = 'QUEUED'
            """;

    private static final String INSERT_JOB = """
            INSERT INTO sync_jobs (id, tenant_id, provider_slug, connection_id, job_type, status, priority,
                                   attempts, scheduled_at, cursor, created_at, updated_at)
            VALUES (:id, :tenantId, :provider, :connectionId, :jobType, 'QUEUED', :priority,
                    0, :scheduledAt, CAST(:cursor AS jsonb), :now, :now)
            """;

    private static final String SELECT_CANDIDATES = """
            SELECT id, connection_id FROM sync_jobs
            WHERE status = 'QUEUED'
              AND scheduled_at <= :now
              AND (retry_after IS NULL OR retry_after <= :now)
            ORDER BY priority DESC, scheduled_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """;

    private static final String LOCK_CONNECTION = """
            SELECT id FROM connections WHERE id = :connectionId FOR UPDATE SKIP LOCKED
            """;

    private static final String RUNNING_EXISTS = """
            SELECT EXISTS (SELECT 1 FROM sync_jobs WHERE connection_id = :connectionId AND status = 'RUNNING')
            """;

    private static final String MARK_RUNNING = """
            UPDATE sync_jobs
            SET status = 'RUNNING', started_at = :now, attempts = attempts + 1, updated_at = :now
            WHERE id = :id
            RETURNING id, tenant_id, provider_slug, connection_id, job_type, priority, attempts,
                      cursor::text AS cursor_json, started_at
            """;

    private static final String INSERT_SIGNAL = """
            INSERT INTO signals (id, tenant_id, provider_slug, connection_id, kind, occurred_at, received_at,
                                 payload, dedupe_key, created_at, updated_at)
            VALUES (:id, :tenantId, :provider, :connectionId, :kind, :occurredAt, :now,
                    CAST(:payload AS jsonb), :dedupeKey, :now, :now)
            ON CONFLICT (tenant_id, provider_slug, dedupe_key) WHERE dedupe_key IS NOT NULL
            DO NOTHING
            """;

    private static final String SELECT_CONNECTION_METADATA = """
            SELECT metadata::text FROM connections WHERE id = :connectionId FOR UPDATE
            """;

    private static final String UPDATE_CONNECTION_METADATA = """
            UPDATE connections SET metadata = CAST(:metadata AS jsonb), updated_at = :now WHERE id = :connectionId
            """;

    private static final String MARK_SUCCEEDED = """
            UPDATE sync_jobs
            SET status = 'SUCCEEDED', finished_at = :now, error = NULL, retry_after = NULL, updated_at = :now
            WHERE id = :id AND status = 'RUNNING'
            """;

    private static final String MARK_FAILED = """
            UPDATE sync_jobs
            SET status = 'FAILED', finished_at = :now, error = CAST(:error AS jsonb), updated_at = :now
            WHERE id = :id AND status = 'RUNNING'
            """;

    private static final String MARK_RETRY = """
            UPDATE sync_jobs
            SET status = 'QUEUED', retry_after = :retryAfter, error = CAST(:error AS jsonb), updated_at = :now
            WHERE id = :id AND status = 'RUNNING'
            """;

    private static final String RELEASE_STALE = """
            UPDATE sync_jobs
            SET status = 'QUEUED', retry_after = :now, updated_at = :now,
                error = jsonb_build_object('type', 'stale_claim',
                                           'message', 'claim expired without completion',
                                           'attempts', attempts,
                                           'timestamp', CAST(:nowText AS text))
            WHERE status = 'RUNNING' AND started_at < :threshold
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;
    private final Clock clock;

    public SyncJobQueue(NamedParameterJdbcTemplate jdbc, JsonColumns json, Clock clock) {
        this.jdbc = jdbc;
        this.json = json;
        this.clock = clock;
    }

    /**
     * Inserts an incremental job unless the connection already has one queued or running.
     *
     * @return true if a row was inserted
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean enqueueIncremental(UUID tenantId, String provider, UUID connectionId,
                                      Instant scheduledAt, int priority, Cursor cursor) {
        MapSqlParameterSource params = jobParams(tenantId, provider, connectionId, scheduledAt, priority)
                .addValue("cursor", cursor != null ? json.write(cursor.toJobPayload()) : null);
        return jdbc.update(INSERT_INCREMENTAL, params) == 1;
    }

    /**
     * Inserts a job of any type without the pending-incremental guard.
     */
    @Transactional
    public UUID enqueue(JobType jobType, UUID tenantId, String provider, UUID connectionId,
                        Instant scheduledAt, int priority, Map<String, Object> cursorPayload) {
        UUID id = UUID.randomUUID();
        MapSqlParameterSource params = jobParams(tenantId, provider, connectionId, scheduledAt, priority)
                .addValue("id", id)
                .addValue("jobType", jobType.name())
                .addValue("cursor", json.write(cursorPayload));
        jdbc.update(INSERT_JOB, params);
        return id;
    }

    /**
     * Claims up to {@code limit} due jobs, at most one per connection, skipping any connection
     * that already has a running job.
     */
    @Transactional
    public List<ClaimedJob> claim(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        MapSqlParameterSource selectParams = new MapSqlParameterSource()
                .addValue("now", JsonColumns.timestamp(now))
                .addValue("limit", limit * CANDIDATE_SCAN_FACTOR);
        List<UUID[]> candidates = jdbc.query(SELECT_CANDIDATES, selectParams,
                (rs, rowNum) -> new UUID[] {rs.getObject("id", UUID.class), rs.getObject("connection_id", UUID.class)});

        List<ClaimedJob> claimed = new ArrayList<>();
        Set<UUID> connectionsSeen = new HashSet<>();
        for (UUID[] candidate : candidates) {
            if (claimed.size() >= limit) {
                break;
            }
            UUID jobId = candidate[0];
            UUID connectionId = candidate[1];
            if (!connectionsSeen.add(connectionId)) {
                continue;
            }
            MapSqlParameterSource connectionParams = new MapSqlParameterSource("connectionId", connectionId);
            if (jdbc.queryForList(LOCK_CONNECTION, connectionParams, UUID.class).isEmpty()) {
                log.debug("Connection {} locked elsewhere, skipping job {}", connectionId, jobId);
                continue;
            }
            if (Boolean.TRUE.equals(jdbc.queryForObject(RUNNING_EXISTS, connectionParams, Boolean.class))) {
                log.debug("Connection {} already has a running job, skipping job {}", connectionId, jobId);
                continue;
            }
            MapSqlParameterSource markParams = new MapSqlParameterSource()
                    .addValue("id", jobId)
                    .addValue("now", JsonColumns.timestamp(now));
            claimed.addAll(jdbc.query(MARK_RUNNING, markParams, claimedJobMapper()));
        }
        return claimed;
    }

    /**
     * Records a successful run: signals, cursor, job status and an optional continuation,
     * all in one transaction. A continuation that collides with a queued incremental job pulls
     * that job forward to now and hands it the new cursor.
     *
     * @return number of signals actually inserted (duplicates are skipped)
     */
    @Transactional
    public int complete(ClaimedJob job, List<NormalizedSignal> signals, Cursor nextCursor, boolean continuation) {
        Instant now = clock.instant();
        int inserted = insertSignals(job, signals, now);
        advanceCursor(job.connectionId(), nextCursor, now);

        int updated = jdbc.update(MARK_SUCCEEDED, new MapSqlParameterSource()
                .addValue("id", job.id())
                .addValue("now", JsonColumns.timestamp(now)));
        if (updated != 1) {
            throw new StaleClaimException(job.id());
        }

        if (continuation && !enqueueIncremental(job.tenantId(), job.providerSlug(), job.connectionId(),
                now, job.priority(), nextCursor)) {
            int pulled = jdbc.update(PULL_FORWARD_INCREMENTAL, new MapSqlParameterSource()
                    .addValue("connectionId", job.connectionId())
                    .addValue("now", JsonColumns.timestamp(now))
                    .addValue("priority", job.priority())
                    .addValue("cursor", nextCursor != null ? json.write(nextCursor.toJobPayload()) : null));
            log.info("Continuation for job {} merged into pending incremental job of connection {} (rows={})",
                    job.id(), job.connectionId(), pulled);
        }
        return inserted;
    }

    @Transactional
    public void fail(ClaimedJob job, Map<String, Object> error) {
        int updated = jdbc.update(MARK_FAILED, new MapSqlParameterSource()
                .addValue("id", job.id())
                .addValue("now", JsonColumns.timestamp(clock.instant()))
                .addValue("error", json.write(error)));
        if (updated != 1) {
            throw new StaleClaimException(job.id());
        }
    }

    @Transactional
    public void retry(ClaimedJob job, Instant retryAfter, Map<String, Object> error) {
        int updated = jdbc.update(MARK_RETRY, new MapSqlParameterSource()
                .addValue("id", job.id())
                .addValue("now", JsonColumns.timestamp(clock.instant()))
                .addValue("retryAfter", JsonColumns.timestamp(retryAfter))
                .addValue("error", json.write(error)));
        if (updated != 1) {
            throw new StaleClaimException(job.id());
        }
    }

    /**
     * Returns jobs stuck in RUNNING since before {@code threshold} to the queue.
     *
     * @return number of jobs released
     */
    @Transactional
    public int releaseStale(Instant threshold) {
        Instant now = clock.instant();
        return jdbc.update(RELEASE_STALE, new MapSqlParameterSource()
                .addValue("now", JsonColumns.timestamp(now))
                .addValue("nowText", now.toString())
                .addValue("threshold", JsonColumns.timestamp(threshold)));
    }

    private int insertSignals(ClaimedJob job, List<NormalizedSignal> signals, Instant now) {
        if (signals.isEmpty()) {
            return 0;
        }
        SqlParameterSource[] batch = signals.stream()
                .map(signal -> new MapSqlParameterSource()
                        .addValue("id", UUID.randomUUID())
                        .addValue("tenantId", job.tenantId())
                        .addValue("provider", job.providerSlug())
                        .addValue("connectionId", job.connectionId())
                        .addValue("kind", signal.kind())
                        .addValue("occurredAt", JsonColumns.timestamp(signal.occurredAt()))
                        .addValue("payload", json.write(signal.payload()))
                        .addValue("dedupeKey", signal.dedupeKey())
                        .addValue("now", JsonColumns.timestamp(now)))
                .toArray(SqlParameterSource[]::new);
        int inserted = 0;
        for (int count : jdbc.batchUpdate(INSERT_SIGNAL, batch)) {
            if (count > 0) {
                inserted += count;
            }
        }
        return inserted;
    }

    private void advanceCursor(UUID connectionId, Cursor nextCursor, Instant now) {
        if (nextCursor == null) {
            return;
        }
        MapSqlParameterSource params = new MapSqlParameterSource("connectionId", connectionId);
        List<String> rows = jdbc.queryForList(SELECT_CONNECTION_METADATA, params, String.class);
        if (rows.isEmpty()) {
            log.warn("Connection {} vanished before its cursor could be stored", connectionId);
            return;
        }
        Map<String, Object> metadata = json.readMap(rows.get(0));
        ConnectionSyncMetadata sync = ConnectionSyncMetadata.fromConnectionMetadata(metadata);
        Cursor stored = Cursor.fromObject(sync.getCursor());
        if (nextCursor.isBehind(stored)) {
            log.warn("Refusing to move cursor of connection {} backwards from {} to {}", connectionId, stored, nextCursor);
            return;
        }
        sync.setCursor(nextCursor.toObject());
        jdbc.update(UPDATE_CONNECTION_METADATA, params
                .addValue("metadata", json.write(sync.writeTo(metadata)))
                .addValue("now", JsonColumns.timestamp(now)));
    }

    private MapSqlParameterSource jobParams(UUID tenantId, String provider, UUID connectionId,
                                            Instant scheduledAt, int priority) {
        return new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("tenantId", tenantId)
                .addValue("provider", provider)
                .addValue("connectionId", connectionId)
                .addValue("priority", priority)
                .addValue("scheduledAt", JsonColumns.timestamp(scheduledAt))
                .addValue("now", JsonColumns.timestamp(clock.instant()));
    }

    private RowMapper<ClaimedJob> claimedJobMapper() {
        return (rs, rowNum) -> new ClaimedJob(
                rs.getObject("id", UUID.class),
                rs.getObject("tenant_id", UUID.class),
                rs.getString("provider_slug"),
                rs.getObject("connection_id", UUID.class),
                JobType.valueOf(rs.getString("job_type")),
                rs.getInt("priority"),
                rs.getInt("attempts"),
                json.readMap(rs.getString("cursor_json")),
                JsonColumns.instant(rs.getTimestamp("started_at")));
    }

    /**
     * The job is no longer RUNNING under this claim, typically because the stale sweep
     * handed it back to the queue while this worker was still busy.
     */
    public static class StaleClaimException extends RuntimeException {
        private final UUID jobId;

        public StaleClaimException(UUID jobId) {
            super("Job " + jobId + " is no longer claimed by this worker");
            this.jobId = jobId;
        }

        public UUID getJobId() { return jobId; }
    }
}
