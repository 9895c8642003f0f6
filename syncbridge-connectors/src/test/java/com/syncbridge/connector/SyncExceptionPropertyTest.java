package com.syncbridge.connector;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the connector error taxonomy.
 */
class SyncExceptionPropertyTest {

    @Property(tries = 200)
    void clientErrorsOtherThan401And429ArePermanent(@ForAll @IntRange(min = 400, max = 499) int status) {
        Assume.that(status != 401 && status != 429);

        SyncException error = SyncException.fromHttpStatus(status, null, "failed");

        assertThat(error.getKind()).isEqualTo(SyncException.Kind.PERMANENT);
        assertThat(error.isRetryable()).isFalse();
    }

    @Property(tries = 100)
    void serverErrorsAreTransient(@ForAll @IntRange(min = 500, max = 599) int status) {
        SyncException error = SyncException.fromHttpStatus(status, 30L, "failed");

        assertThat(error.getKind()).isEqualTo(SyncException.Kind.TRANSIENT);
        assertThat(error.isRetryable()).isTrue();
        assertThat(error.getRetryAfterSeconds()).isNull();
    }

    @Test
    void unauthorizedAndRateLimitedAreDistinguished() {
        assertThat(SyncException.fromHttpStatus(401, null, "x").getKind()).isEqualTo(SyncException.Kind.UNAUTHORIZED);

        SyncException limited = SyncException.fromHttpStatus(429, 42L, "x");
        assertThat(limited.getKind()).isEqualTo(SyncException.Kind.RATE_LIMITED);
        assertThat(limited.getRetryAfterSeconds()).isEqualTo(42L);
        assertThat(limited.isRateLimited()).isTrue();
    }

    @Test
    void errorMapUsesSnakeCaseKinds() {
        SyncException limited = SyncException.rateLimited(60L, "slow down");

        assertThat(limited.toErrorMap())
                .containsEntry("type", "rate_limited")
                .containsEntry("message", "slow down")
                .containsEntry("retry_after_secs", 60L)
                .doesNotContainKey("details");
    }

    @Test
    void unwrapFindsCauseOfFailedFuture() {
        CompletableFuture<Object> failed = CompletableFuture.failedFuture(SyncException.permanent("bad"));

        Throwable thrown = catchThrowable(failed::join);

        assertThat(thrown).isInstanceOf(CompletionException.class);
        assertThat(SyncException.unwrap(thrown).getKind()).isEqualTo(SyncException.Kind.PERMANENT);
    }

    @Test
    void unwrapTreatsUnknownFailuresAsTransient() {
        SyncException error = SyncException.unwrap(new IllegalStateException("boom"));

        assertThat(error.getKind()).isEqualTo(SyncException.Kind.TRANSIENT);
        assertThat(error.getMessage()).isEqualTo("boom");
        assertThat(error.getCause()).isInstanceOf(IllegalStateException.class);
    }
}
