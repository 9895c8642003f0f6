package com.syncbridge.core.domain;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionSyncMetadataTest {

    @Test
    @SuppressWarnings("unchecked")
    void readsKnownFieldsAndKeepsUnknownOnes() {
        Map<String, Object> sync = new HashMap<>();
        sync.put("interval_seconds", 300);
        sync.put("next_run_at", "2024-05-01T10:05:00Z");
        sync.put("last_jitter_seconds", "20");
        sync.put("cursor", "2024-05-01T09:00:00Z");
        sync.put("owner", "ops");
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("sync", sync);
        metadata.put("cloud_id", "c1");

        ConnectionSyncMetadata view = ConnectionSyncMetadata.fromConnectionMetadata(metadata);

        assertThat(view.getIntervalSeconds()).isEqualTo(300L);
        assertThat(view.getNextRunAt()).isEqualTo(Instant.parse("2024-05-01T10:05:00Z"));
        assertThat(view.getLastJitterSeconds()).isEqualTo(20L);
        assertThat(view.getCursor()).isEqualTo("2024-05-01T09:00:00Z");
        assertThat(view.lastRunBase()).isEqualTo(Instant.parse("2024-05-01T10:04:40Z"));

        Map<String, Object> written = view.writeTo(metadata);
        assertThat(written).containsEntry("cloud_id", "c1");
        assertThat((Map<String, Object>) written.get("sync"))
                .containsEntry("owner", "ops")
                .containsEntry("next_run_at", "2024-05-01T10:05:00Z")
                .containsEntry("cursor", "2024-05-01T09:00:00Z");
    }

    @Test
    @SuppressWarnings("unchecked")
    void objectCursorIsKeptVerbatimEvenWhenShapedLikeAWrapper() {
        Map<String, Object> providerCursor = Map.of("value", "page-token-7");
        Map<String, Object> metadata = Map.of("sync", Map.of("cursor", providerCursor));

        ConnectionSyncMetadata view = ConnectionSyncMetadata.fromConnectionMetadata(metadata);

        assertThat(view.getCursor()).isEqualTo(providerCursor);
        assertThat((Map<String, Object>) view.writeTo(metadata).get("sync")).containsEntry("cursor", providerCursor);
    }

    @Test
    void malformedFieldsReadAsAbsent() {
        Map<String, Object> sync = new HashMap<>();
        sync.put("interval_seconds", "often");
        sync.put("next_run_at", "soon");
        Map<String, Object> metadata = Map.of("sync", sync);

        ConnectionSyncMetadata view = ConnectionSyncMetadata.fromConnectionMetadata(metadata);

        assertThat(view.getIntervalSeconds()).isNull();
        assertThat(view.getNextRunAt()).isNull();
        assertThat(view.lastRunBase()).isNull();
        assertThat(view.effectiveIntervalSeconds(900, 60, 86400)).isEqualTo(900);
    }

    @Test
    void missingSyncObjectIsEmpty() {
        assertThat(ConnectionSyncMetadata.fromConnectionMetadata(null).toMap()).isEmpty();
        assertThat(ConnectionSyncMetadata.fromConnectionMetadata(Map.of("sync", "x")).toMap()).isEmpty();
    }

    @Test
    void sanitizeReportsWhetherOverrideChanged() {
        ConnectionSyncMetadata view = ConnectionSyncMetadata.empty();
        assertThat(view.sanitizeInterval(60, 86400)).isFalse();

        view.setIntervalSeconds(5L);
        assertThat(view.sanitizeInterval(60, 86400)).isTrue();
        assertThat(view.getIntervalSeconds()).isEqualTo(60L);
        assertThat(view.sanitizeInterval(60, 86400)).isFalse();
    }

    @Property(tries = 200)
    void effectiveIntervalIsAlwaysWithinBounds(@ForAll @LongRange(min = -1_000_000, max = 10_000_000) long override) {
        ConnectionSyncMetadata view = ConnectionSyncMetadata.empty();
        view.setIntervalSeconds(override);

        long effective = view.effectiveIntervalSeconds(900, 60, 86400);

        assertThat(effective).isBetween(60L, 86400L);
        if (override >= 60 && override <= 86400) {
            assertThat(effective).isEqualTo(override);
        }
    }
}
