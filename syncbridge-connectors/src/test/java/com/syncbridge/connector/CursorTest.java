package com.syncbridge.connector;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CursorTest {

    @Test
    void jobPayloadWrapsAndUnwrapsValue() {
        Cursor cursor = Cursor.ofString("2024-05-01T10:00:00Z");

        Map<String, Object> payload = cursor.toJobPayload();

        assertThat(payload).containsEntry("value", "2024-05-01T10:00:00Z");
        assertThat(Cursor.fromJobPayload(payload)).isEqualTo(cursor);
    }

    @Test
    void jobPayloadUnwrapsOnlyItsOwnWrapper() {
        Cursor cursor = Cursor.fromObject(Map.of("value", "page-token-7"));

        assertThat(Cursor.fromJobPayload(cursor.toJobPayload())).isEqualTo(cursor);
        assertThat(Cursor.fromObject(cursor.toObject())).isEqualTo(cursor);
        assertThat(cursor.asText()).isEmpty();
    }

    @Test
    void objectCursorsSurviveJsonColumnForm() {
        Cursor cursor = Cursor.fromObject(Map.of("sync_token", "abc"));

        assertThat(Cursor.fromObject(cursor.toObject())).isEqualTo(cursor);
        assertThat(cursor.asText()).isEmpty();
    }

    @Test
    void nullAndEmptyReadAsNoCursor() {
        assertThat(Cursor.fromObject(null)).isNull();
        assertThat(Cursor.fromJobPayload(null)).isNull();
        assertThat(Cursor.fromJobPayload(Map.of())).isNull();
    }

    @Test
    void timestampsCompareChronologicallyAcrossOffsets() {
        Cursor earlier = Cursor.ofString("2024-05-01T10:00:00+02:00");
        Cursor later = Cursor.ofInstant(Instant.parse("2024-05-01T09:00:00Z"));

        assertThat(earlier.isBehind(later)).isTrue();
        assertThat(later.isBehind(earlier)).isFalse();
    }

    @Test
    void numericCursorsCompareByValue() {
        assertThat(Cursor.ofString("999").isBehind(Cursor.ofString("1000"))).isTrue();
        assertThat(Cursor.ofLong(1000).isBehind(Cursor.ofString("999"))).isFalse();
    }

    @Test
    void opaqueTokensAreNeverBehind() {
        Cursor a = Cursor.ofString("CAESBggBEAEYAQ");
        Cursor b = Cursor.ofString("ZZZZ");

        assertThat(a.isBehind(b)).isFalse();
        assertThat(b.isBehind(a)).isFalse();
        assertThat(a.isBehind(null)).isFalse();
    }
}
