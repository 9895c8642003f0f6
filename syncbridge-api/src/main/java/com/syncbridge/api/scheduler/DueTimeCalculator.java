package com.syncbridge.api.scheduler;

import com.syncbridge.core.domain.ConnectionSyncMetadata;

import java.time.Instant;
import java.util.random.RandomGenerator;

/**
 * Next-run arithmetic for recurring incremental syncs.
 *
 * The previous run is reconstructed as {@code next_run_at - last_jitter_seconds}, so jitter
 * never accumulates into the cadence. After downtime {@code max(now, ...)} collapses the
 * missed runs into a single immediate one.
 */
public final class DueTimeCalculator {

    private final long defaultIntervalSeconds;
    private final long minIntervalSeconds;
    private final long maxIntervalSeconds;
    private final double jitterFraction;

    public DueTimeCalculator(long defaultIntervalSeconds, long minIntervalSeconds, long maxIntervalSeconds,
                             double jitterFraction) {
        if (minIntervalSeconds <= 0 || maxIntervalSeconds < minIntervalSeconds) {
            throw new IllegalArgumentException("Invalid interval bounds [" + minIntervalSeconds + ", " + maxIntervalSeconds + "]");
        }
        if (jitterFraction < 0) {
            throw new IllegalArgumentException("Jitter fraction cannot be negative");
        }
        this.defaultIntervalSeconds = defaultIntervalSeconds;
        this.minIntervalSeconds = minIntervalSeconds;
        this.maxIntervalSeconds = maxIntervalSeconds;
        this.jitterFraction = jitterFraction;
    }

    public long intervalSeconds(ConnectionSyncMetadata sync) {
        return sync.effectiveIntervalSeconds(defaultIntervalSeconds, minIntervalSeconds, maxIntervalSeconds);
    }

    public long maxJitterSeconds(long intervalSeconds) {
        return (long) Math.floor(jitterFraction * intervalSeconds);
    }

    public DueTime next(ConnectionSyncMetadata sync, Instant now, RandomGenerator random) {
        Instant lastRunBase = sync.lastRunBase();
        if (lastRunBase == null) {
            return new DueTime(now, 0);
        }
        long interval = intervalSeconds(sync);
        Instant base = lastRunBase.plusSeconds(interval);
        if (base.isBefore(now)) {
            base = now;
        }
        long maxJitter = maxJitterSeconds(interval);
        long jitter = maxJitter > 0 ? random.nextLong(maxJitter + 1) : 0;
        return new DueTime(base.plusSeconds(jitter), jitter);
    }

    /**
     * @param scheduledAt   When the job becomes claimable
     * @param jitterSeconds Jitter folded into {@code scheduledAt}
     */
    public record DueTime(Instant scheduledAt, long jitterSeconds) {}
}
