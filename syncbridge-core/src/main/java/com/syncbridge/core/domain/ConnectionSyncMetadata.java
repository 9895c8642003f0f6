package com.syncbridge.core.domain;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view over {@code connections.metadata.sync}.
 *
 * Keys this class does not know about are carried through untouched so that
 * other writers of the sync object do not lose data on a round trip.
 */
public final class ConnectionSyncMetadata {

    public static final String SYNC_KEY = "sync";

    static final String INTERVAL_SECONDS = "interval_seconds";
    static final String NEXT_RUN_AT = "next_run_at";
    static final String LAST_JITTER_SECONDS = "last_jitter_seconds";
    static final String FIRST_ACTIVATED_AT = "first_activated_at";
    static final String CURSOR = "cursor";

    private Long intervalSeconds;
    private Instant nextRunAt;
    private Long lastJitterSeconds;
    private Instant firstActivatedAt;
    private Object cursor;
    private final Map<String, Object> extra;

    private ConnectionSyncMetadata(Map<String, Object> extra) {
        this.extra = extra;
    }

    public static ConnectionSyncMetadata empty() {
        return new ConnectionSyncMetadata(new LinkedHashMap<>());
    }

    /**
     * Reads the sync sub-object out of a connection's metadata map.
     * Malformed fields are ignored rather than failing the read.
     */
    @SuppressWarnings("unchecked")
    public static ConnectionSyncMetadata fromConnectionMetadata(Map<String, Object> metadata) {
        if (metadata == null || !(metadata.get(SYNC_KEY) instanceof Map<?, ?> raw)) {
            return empty();
        }
        Map<String, Object> sync = new LinkedHashMap<>((Map<String, Object>) raw);
        ConnectionSyncMetadata result = new ConnectionSyncMetadata(sync);
        result.intervalSeconds = asLong(sync.remove(INTERVAL_SECONDS));
        result.nextRunAt = asInstant(sync.remove(NEXT_RUN_AT));
        result.lastJitterSeconds = asLong(sync.remove(LAST_JITTER_SECONDS));
        result.firstActivatedAt = asInstant(sync.remove(FIRST_ACTIVATED_AT));
        result.cursor = sync.remove(CURSOR);
        return result;
    }

    /**
     * Returns a copy of {@code metadata} with the sync sub-object replaced by this view.
     */
    public Map<String, Object> writeTo(Map<String, Object> metadata) {
        Map<String, Object> copy = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        copy.put(SYNC_KEY, toMap());
        return copy;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> sync = new LinkedHashMap<>(extra);
        putIfPresent(sync, INTERVAL_SECONDS, intervalSeconds);
        putIfPresent(sync, NEXT_RUN_AT, nextRunAt != null ? nextRunAt.toString() : null);
        putIfPresent(sync, LAST_JITTER_SECONDS, lastJitterSeconds);
        putIfPresent(sync, FIRST_ACTIVATED_AT, firstActivatedAt != null ? firstActivatedAt.toString() : null);
        putIfPresent(sync, CURSOR, cursor);
        return sync;
    }

    /**
     * Interval to use for scheduling: the stored override if any, else the default,
     * clamped to [min, max].
     */
    public long effectiveIntervalSeconds(long defaultSeconds, long minSeconds, long maxSeconds) {
        long interval = intervalSeconds != null ? intervalSeconds : defaultSeconds;
        return Math.max(minSeconds, Math.min(maxSeconds, interval));
    }

    /**
     * Clamps a stored override into range.
     *
     * @return true if the stored value changed and should be persisted
     */
    public boolean sanitizeInterval(long minSeconds, long maxSeconds) {
        if (intervalSeconds == null) {
            return false;
        }
        long clamped = Math.max(minSeconds, Math.min(maxSeconds, intervalSeconds));
        if (clamped != intervalSeconds) {
            intervalSeconds = clamped;
            return true;
        }
        return false;
    }

    /**
     * Time of the previous scheduled run without its jitter, or null before the first run.
     */
    public Instant lastRunBase() {
        if (nextRunAt == null) {
            return null;
        }
        long jitter = lastJitterSeconds != null ? lastJitterSeconds : 0L;
        return nextRunAt.minusSeconds(jitter);
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        } else {
            map.remove(key);
        }
    }

    private static Long asLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Instant asInstant(Object value) {
        if (!(value instanceof String s) || s.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    // Accessors
    public Long getIntervalSeconds() { return intervalSeconds; }
    public void setIntervalSeconds(Long intervalSeconds) { this.intervalSeconds = intervalSeconds; }
    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }
    public Long getLastJitterSeconds() { return lastJitterSeconds; }
    public void setLastJitterSeconds(Long lastJitterSeconds) { this.lastJitterSeconds = lastJitterSeconds; }
    public Instant getFirstActivatedAt() { return firstActivatedAt; }
    public void setFirstActivatedAt(Instant firstActivatedAt) { this.firstActivatedAt = firstActivatedAt; }
    public Object getCursor() { return cursor; }
    public void setCursor(Object cursor) { this.cursor = cursor; }
}
