package com.syncbridge.connector;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SignalKindTest {

    @Test
    void wireNamesAreSnakeCase() {
        assertThat(SignalKind.CALENDAR_EVENT_UPDATED.wireName()).isEqualTo("calendar_event_updated");
        assertThat(SignalKind.fromWireName("pr_merged")).contains(SignalKind.PR_MERGED);
    }

    @Test
    void unknownWireNamesAreNotCanonical() {
        assertThat(SignalKind.isCanonical("issue_created")).isTrue();
        assertThat(SignalKind.isCanonical("ISSUE_CREATED")).isFalse();
        assertThat(SignalKind.isCanonical(null)).isFalse();
        assertThat(SignalKind.fromWireName("webhook:push")).isEmpty();
    }
}
