package com.syncbridge.api.security;

import com.syncbridge.api.config.SyncBridgeProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OperatorAuthenticatorTest {

    private static OperatorAuthenticator authenticator(List<String> tokens) {
        SyncBridgeProperties properties = new SyncBridgeProperties();
        properties.getWebhooks().setOperatorTokens(tokens);
        return new OperatorAuthenticator(properties);
    }

    @Test
    void acceptsAnyConfiguredToken() {
        OperatorAuthenticator authenticator = authenticator(List.of("first", "second"));

        assertThat(authenticator.isOperator("Bearer first")).isTrue();
        assertThat(authenticator.isOperator("bearer second")).isTrue();
        assertThat(authenticator.isOperator("Bearer third")).isFalse();
        assertThat(authenticator.isOperator("Bearer firs")).isFalse();
    }

    @Test
    void rejectsMissingOrMalformedHeaders() {
        OperatorAuthenticator authenticator = authenticator(List.of("token"));

        assertThat(authenticator.isOperator(null)).isFalse();
        assertThat(authenticator.isOperator("")).isFalse();
        assertThat(authenticator.isOperator("token")).isFalse();
        assertThat(authenticator.isOperator("Basic token")).isFalse();
        assertThat(authenticator.isOperator("Bearer ")).isFalse();
    }

    @Test
    void noConfiguredTokensMeansNoOperator() {
        OperatorAuthenticator authenticator = authenticator(List.of("", " "));

        assertThat(authenticator.isOperator("Bearer ")).isFalse();
        assertThat(authenticator.isOperator("Bearer  ")).isFalse();
    }

    @Test
    void bearerTokenStripsPrefix() {
        assertThat(OperatorAuthenticator.bearerToken("Bearer abc ")).isEqualTo("abc");
        assertThat(OperatorAuthenticator.bearerToken("BEARER abc")).isEqualTo("abc");
        assertThat(OperatorAuthenticator.bearerToken("Bearerabc")).isNull();
    }
}
