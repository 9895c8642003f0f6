package com.syncbridge.api.executor;

import com.syncbridge.connector.Cursor;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.core.domain.Connection;
import com.syncbridge.core.domain.SyncJob.JobType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class JobRunnerCursorTest {

    private static final Instant STARTED = Instant.parse("2024-06-01T12:00:00Z");

    private static Connection connectionWithCursor(Object cursor) {
        Connection connection = Connection.create(UUID.randomUUID(), "github", "acct");
        Map<String, Object> metadata = new HashMap<>();
        if (cursor != null) {
            metadata.put("sync", Map.of("cursor", cursor));
        }
        connection.setMetadata(metadata);
        return connection;
    }

    private static ClaimedJob job(JobType type, Map<String, Object> cursor) {
        return new ClaimedJob(UUID.randomUUID(), UUID.randomUUID(), "github", UUID.randomUUID(),
                type, 30, 1, cursor, STARTED);
    }

    @Test
    void incrementalPrefersJobCursorOverStoredCursor() {
        Connection connection = connectionWithCursor("2024-05-01T00:00:00Z");
        ClaimedJob job = job(JobType.INCREMENTAL, Cursor.ofString("page-2").toJobPayload());

        assertThat(JobRunner.effectiveCursor(job, connection)).isEqualTo(Cursor.ofString("page-2"));
    }

    @Test
    void incrementalFallsBackToStoredCursor() {
        Connection connection = connectionWithCursor("2024-05-01T00:00:00Z");

        assertThat(JobRunner.effectiveCursor(job(JobType.INCREMENTAL, null), connection))
                .isEqualTo(Cursor.ofString("2024-05-01T00:00:00Z"));
    }

    @Test
    void fullSyncIgnoresStoredCursor() {
        Connection connection = connectionWithCursor("2024-05-01T00:00:00Z");

        assertThat(JobRunner.effectiveCursor(job(JobType.FULL, null), connection)).isNull();
    }

    @Test
    void webhookJobResumesFromStoredCursor() {
        Connection connection = connectionWithCursor(42);
        Map<String, Object> envelope = Map.of("webhook_payload", Map.of("action", "opened"));

        assertThat(JobRunner.effectiveCursor(job(JobType.WEBHOOK, envelope), connection))
                .isEqualTo(Cursor.ofLong(42));
    }

    @Test
    void webhookSignalsAreReadFromEnvelope() {
        NormalizedSignal signal = new NormalizedSignal("pr_opened", STARTED, Map.of("number", 7), "gh-7");
        Map<String, Object> envelope = Map.of(JobRunner.WEBHOOK_SIGNALS,
                List.of(signal.toMap(), Map.of("kind", "broken")));

        List<NormalizedSignal> signals = JobRunner.webhookSignals(job(JobType.WEBHOOK, envelope));

        assertThat(signals).hasSize(1);
        assertThat(signals.get(0).kind()).isEqualTo("pr_opened");
        assertThat(signals.get(0).occurredAt()).isEqualTo(STARTED);
        assertThat(signals.get(0).dedupeKey()).isEqualTo("gh-7");
        assertThat(signals.get(0).payload()).containsEntry("number", 7);
    }

    @Test
    void missingEnvelopeMeansNoCarriedSignals() {
        assertThat(JobRunner.webhookSignals(job(JobType.WEBHOOK, null))).isEmpty();
        assertThat(JobRunner.webhookSignals(job(JobType.WEBHOOK, Map.of()))).isEmpty();
    }
}
