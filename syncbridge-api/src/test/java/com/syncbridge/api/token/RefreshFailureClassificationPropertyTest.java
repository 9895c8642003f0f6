package com.syncbridge.api.token;

import com.syncbridge.connector.SyncException;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for classifying token refresh failures.
 */
class RefreshFailureClassificationPropertyTest {

    @Property(tries = 200)
    void oauthGrantErrorsArePermanent(@ForAll("permanentCodes") String code,
                                      @ForAll("noise") String prefix,
                                      @ForAll("noise") String suffix) {
        SyncException error = SyncException.transientFailure(prefix + code + suffix);

        assertThat(TokenRefreshService.classifyRefreshFailure(error).getKind())
                .isEqualTo(SyncException.Kind.PERMANENT);
    }

    @Property(tries = 200)
    void throttlingErrorsAreRateLimited(@ForAll("rateLimitCodes") String code,
                                        @ForAll("noise") String prefix) {
        SyncException error = SyncException.transientFailure(prefix + code);

        assertThat(TokenRefreshService.classifyRefreshFailure(error).getKind())
                .isEqualTo(SyncException.Kind.RATE_LIMITED);
    }

    @Property(tries = 200)
    void otherErrorsAreTransient(@ForAll("noise") String message) {
        SyncException error = SyncException.transientFailure("connection reset " + message);

        assertThat(TokenRefreshService.classifyRefreshFailure(error).getKind())
                .isEqualTo(SyncException.Kind.TRANSIENT);
    }

    @Provide
    Arbitrary<String> permanentCodes() {
        return Arbitraries.of("invalid_grant", "INVALID_CLIENT", "unauthorized_client", "Token revoked",
                "forbidden", "access_denied", "unsupported_grant_type");
    }

    @Provide
    Arbitrary<String> rateLimitCodes() {
        return Arbitraries.of("rate_limit", "too_many_requests", "temporarily_unavailable", "quota_exceeded");
    }

    @Provide
    Arbitrary<String> noise() {
        return Arbitraries.strings().withCharRange('0', '9').withChars(' ', ':', '{', '}').ofMaxLength(20);
    }

    @Test
    void rateLimitedKindKeepsRetryAfter() {
        SyncException classified = TokenRefreshService.classifyRefreshFailure(
                SyncException.rateLimited(120L, "slow down"));

        assertThat(classified.getKind()).isEqualTo(SyncException.Kind.RATE_LIMITED);
        assertThat(classified.getRetryAfterSeconds()).isEqualTo(120L);
    }

    @Test
    void permanentMarkerWinsOverRateLimit() {
        SyncException classified = TokenRefreshService.classifyRefreshFailure(
                SyncException.rateLimited(5L, "invalid_grant after rate_limit"));

        assertThat(classified.getKind()).isEqualTo(SyncException.Kind.PERMANENT);
    }
}
