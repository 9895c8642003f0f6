package com.syncbridge.connector;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A provider event mapped onto the canonical taxonomy, before it is bound to a
 * tenant and connection and persisted.
 *
 * @param kind       Canonical kind (see {@link SignalKind})
 * @param occurredAt Provider-side event time
 * @param payload    Normalized fields
 * @param dedupeKey  Stable identifier used to suppress duplicates, may be null
 */
public record NormalizedSignal(
        String kind,
        Instant occurredAt,
        Map<String, Object> payload,
        String dedupeKey
) {
    public NormalizedSignal {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Signal kind cannot be null or blank");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("Signal occurredAt cannot be null");
        }
        payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
    }

    public static NormalizedSignal of(SignalKind kind, Instant occurredAt, Map<String, Object> payload, String dedupeKey) {
        return new NormalizedSignal(kind.wireName(), occurredAt, payload, dedupeKey);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("kind", kind);
        map.put("occurred_at", occurredAt.toString());
        map.put("payload", payload);
        if (dedupeKey != null) {
            map.put("dedupe_key", dedupeKey);
        }
        return map;
    }

    /**
     * Inverse of {@link #toMap()}; returns null for entries that cannot be read back.
     */
    @SuppressWarnings("unchecked")
    public static NormalizedSignal fromMap(Map<String, Object> map) {
        if (map == null || !(map.get("kind") instanceof String kind) || !(map.get("occurred_at") instanceof String occurred)) {
            return null;
        }
        Instant occurredAt;
        try {
            occurredAt = OffsetDateTime.parse(occurred).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
        Object payload = map.get("payload");
        Object dedupe = map.get("dedupe_key");
        return new NormalizedSignal(
                kind,
                occurredAt,
                payload instanceof Map<?, ?> p ? (Map<String, Object>) p : Map.of(),
                dedupe instanceof String d ? d : null);
    }
}
