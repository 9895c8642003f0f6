package com.syncbridge.api.scheduler;

import com.syncbridge.api.config.SyncBridgeProperties;
import com.syncbridge.api.executor.SyncJobQueue;
import com.syncbridge.api.jdbc.JsonColumns;
import com.syncbridge.core.domain.ConnectionSyncMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.random.RandomGenerator;

/**
 * Enqueues recurring incremental syncs for active connections.
 *
 * Each due connection is handled in its own transaction: the row is locked with SKIP LOCKED,
 * one incremental job is inserted behind the pending-job unique index, and the new
 * {@code next_run_at} is written back only if the insert went through.
 */
@Service
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private static final String SELECT_DUE = """
            SELECT id FROM connections
            WHERE status = 'ACTIVE'
              AND (metadata -> 'sync' ->> 'next_run_at' IS NULL
                   OR CAST(metadata -> 'sync' ->> 'next_run_at' AS timestamptz) <= :now)
            ORDER BY CAST(metadata -> 'sync' ->> 'next_run_at' AS timestamptz) ASC NULLS FIRST, id
            LIMIT :limit
            """;

    private static final String LOCK_DUE = """
            SELECT id, tenant_id, provider_slug, metadata::text AS metadata_json FROM connections
            WHERE id = :id
              AND status = 'ACTIVE'
              AND (metadata -> 'sync' ->> 'next_run_at' IS NULL
                   OR CAST(metadata -> 'sync' ->> 'next_run_at' AS timestamptz) <= :now)
            FOR UPDATE SKIP LOCKED
            """;

    private static final String UPDATE_METADATA = """
            UPDATE connections SET metadata = CAST(:metadata AS jsonb), updated_at = :now WHERE id = :id
            """;

    private final SyncBridgeProperties.Scheduler settings;
    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final SyncJobQueue jobQueue;
    private final JsonColumns json;
    private final Clock clock;
    private final RandomGenerator random;
    private final DueTimeCalculator calculator;

    public SyncScheduler(SyncBridgeProperties properties,
                         NamedParameterJdbcTemplate jdbc,
                         PlatformTransactionManager transactionManager,
                         SyncJobQueue jobQueue,
                         JsonColumns json,
                         Clock clock,
                         RandomGenerator random) {
        this.settings = properties.getScheduler();
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.jobQueue = jobQueue;
        this.json = json;
        this.clock = clock;
        this.random = random;
        this.calculator = new DueTimeCalculator(
                settings.getDefaultIntervalSeconds(),
                settings.getMinIntervalSeconds(),
                settings.getMaxIntervalSeconds(),
                settings.getJitterFraction());
    }

    @Scheduled(fixedDelayString = "${syncbridge.scheduler.tick-interval:60s}")
    public void scheduledTick() {
        if (!settings.isEnabled()) {
            return;
        }
        tick();
    }

    /**
     * Runs one scheduling pass over at most {@code batch-size} due connections.
     */
    public SchedulerTickStats tick() {
        Instant now = clock.instant();
        List<UUID> due = jdbc.queryForList(SELECT_DUE, new MapSqlParameterSource()
                .addValue("now", JsonColumns.timestamp(now))
                .addValue("limit", settings.getBatchSize()), UUID.class);
        if (due.isEmpty()) {
            log.debug("Scheduler tick: no connections due");
            return SchedulerTickStats.empty();
        }

        int enqueued = 0;
        int skippedPending = 0;
        int conflicts = 0;
        int errors = 0;
        for (UUID connectionId : due) {
            try {
                Outcome outcome = transactionTemplate.execute(status -> scheduleConnection(connectionId, now));
                if (outcome == Outcome.ENQUEUED) {
                    enqueued++;
                } else if (outcome == Outcome.PENDING) {
                    skippedPending++;
                } else {
                    conflicts++;
                }
            } catch (RuntimeException e) {
                errors++;
                log.warn("Failed to schedule connection {}", connectionId, e);
            }
        }

        SchedulerTickStats stats = new SchedulerTickStats(due.size(), enqueued, skippedPending, conflicts, errors);
        log.info("Scheduler tick: polled={} enqueued={} skippedPending={} conflicts={} errors={}",
                stats.polled(), stats.enqueued(), stats.skippedPending(), stats.conflicts(), stats.errors());
        return stats;
    }

    private Outcome scheduleConnection(UUID connectionId, Instant now) {
        List<DueConnection> locked = jdbc.query(LOCK_DUE, new MapSqlParameterSource()
                        .addValue("id", connectionId)
                        .addValue("now", JsonColumns.timestamp(now)),
                (rs, rowNum) -> new DueConnection(
                        rs.getObject("id", UUID.class),
                        rs.getObject("tenant_id", UUID.class),
                        rs.getString("provider_slug"),
                        rs.getString("metadata_json")));
        if (locked.isEmpty()) {
            return Outcome.CONFLICT;
        }
        DueConnection connection = locked.get(0);

        Map<String, Object> metadata = json.readMap(connection.metadataJson());
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
        }
        ConnectionSyncMetadata sync = ConnectionSyncMetadata.fromConnectionMetadata(metadata);
        boolean sanitized = sync.sanitizeInterval(settings.getMinIntervalSeconds(), settings.getMaxIntervalSeconds());
        DueTimeCalculator.DueTime next = calculator.next(sync, now, random);

        boolean inserted = jobQueue.enqueueIncremental(connection.tenantId(), connection.providerSlug(),
                connection.id(), next.scheduledAt(), SyncJobQueue.SCHEDULED_PRIORITY, null);
        if (!inserted) {
            if (sanitized) {
                writeMetadata(connection.id(), sync.writeTo(metadata), now);
            }
            log.debug("Connection {} already has a pending incremental job", connection.id());
            return Outcome.PENDING;
        }

        sync.setNextRunAt(next.scheduledAt());
        sync.setLastJitterSeconds(next.jitterSeconds());
        if (sync.getFirstActivatedAt() == null) {
            sync.setFirstActivatedAt(now);
        }
        writeMetadata(connection.id(), sync.writeTo(metadata), now);
        log.debug("Connection {} scheduled at {} (jitter {}s)", connection.id(), next.scheduledAt(), next.jitterSeconds());
        return Outcome.ENQUEUED;
    }

    private void writeMetadata(UUID connectionId, Map<String, Object> metadata, Instant now) {
        jdbc.update(UPDATE_METADATA, new MapSqlParameterSource()
                .addValue("id", connectionId)
                .addValue("metadata", json.write(metadata))
                .addValue("now", JsonColumns.timestamp(now)));
    }

    public DueTimeCalculator calculator() {
        return calculator;
    }

    private enum Outcome { ENQUEUED, PENDING, CONFLICT }

    private record DueConnection(UUID id, UUID tenantId, String providerSlug, String metadataJson) {}
}
