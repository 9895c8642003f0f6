package com.syncbridge.api.webhook;

import com.syncbridge.api.config.SyncBridgeProperties;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for webhook signature verification.
 */
class WebhookVerifierPropertyTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final String GITHUB_SECRET = "github-secret";
    private static final String SLACK_SECRET = "slack-secret";
    private static final String JIRA_SECRET = "jira-secret";

    private final WebhookVerifier verifier = new WebhookVerifier(properties(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static SyncBridgeProperties properties() {
        SyncBridgeProperties properties = new SyncBridgeProperties();
        properties.getWebhooks().getSecrets().put("github", GITHUB_SECRET);
        properties.getWebhooks().getSecrets().put("slack", SLACK_SECRET);
        properties.getWebhooks().getSignatureSchemes().put("slack", SignatureScheme.SLACK_V0);
        properties.getWebhooks().getSecrets().put("jira", JIRA_SECRET);
        properties.getWebhooks().getSecrets().put("gmail", " ");
        return properties;
    }

    private static Map<String, String> githubHeaders(byte[] body) {
        Map<String, String> headers = new HashMap<>();
        headers.put(WebhookVerifier.GITHUB_SIGNATURE, "sha256=" + WebhookVerifier.hmacSha256Hex(GITHUB_SECRET, body));
        return headers;
    }

    private static Map<String, String> slackHeaders(byte[] body, long timestamp) {
        byte[] prefix = ("v0:" + timestamp + ":").getBytes(StandardCharsets.UTF_8);
        Map<String, String> headers = new HashMap<>();
        headers.put(WebhookVerifier.SLACK_TIMESTAMP, String.valueOf(timestamp));
        headers.put(WebhookVerifier.SLACK_SIGNATURE, "v0=" + WebhookVerifier.hmacSha256Hex(SLACK_SECRET, prefix, body));
        return headers;
    }

    @Property(tries = 200)
    void validGithubSignatureIsAccepted(@ForAll @Size(max = 512) byte[] body) {
        assertThatCode(() -> verifier.verify("github", body, githubHeaders(body))).doesNotThrowAnyException();
    }

    @Property(tries = 200)
    void anyBodyMutationIsRejected(@ForAll @Size(min = 1, max = 256) byte[] body,
                                   @ForAll @IntRange(min = 0, max = 255) int position,
                                   @ForAll @IntRange(min = 1, max = 255) int delta) {
        Map<String, String> headers = githubHeaders(body);
        byte[] tampered = body.clone();
        int index = position % tampered.length;
        tampered[index] = (byte) (tampered[index] + delta);

        assertThatThrownBy(() -> verifier.verify("github", tampered, headers))
                .isInstanceOf(WebhookVerifier.VerificationException.class);
    }

    @Property(tries = 200)
    void anySignatureMutationIsRejected(@ForAll @Size(max = 256) byte[] body,
                                        @ForAll @IntRange(min = 0, max = 63) int position) {
        Map<String, String> headers = githubHeaders(body);
        String signature = headers.get(WebhookVerifier.GITHUB_SIGNATURE);
        int index = "sha256=".length() + position;
        char replacement = signature.charAt(index) == '0' ? '1' : '0';
        headers.put(WebhookVerifier.GITHUB_SIGNATURE,
                signature.substring(0, index) + replacement + signature.substring(index + 1));

        assertThatThrownBy(() -> verifier.verify("github", body, headers))
                .isInstanceOf(WebhookVerifier.VerificationException.class);
    }

    @Property(tries = 100)
    void slackTimestampWithinToleranceIsAccepted(@ForAll @Size(max = 256) byte[] body,
                                                 @ForAll @LongRange(min = -300, max = 300) long skew) {
        long timestamp = NOW.getEpochSecond() + skew;

        assertThatCode(() -> verifier.verify("slack", body, slackHeaders(body, timestamp))).doesNotThrowAnyException();
    }

    @Property(tries = 100)
    void staleSlackTimestampIsRejected(@ForAll @Size(max = 256) byte[] body,
                                       @ForAll @LongRange(min = 301, max = 1_000_000) long age) {
        long timestamp = NOW.getEpochSecond() - age;

        assertThatThrownBy(() -> verifier.verify("slack", body, slackHeaders(body, timestamp)))
                .isInstanceOf(WebhookVerifier.VerificationException.class)
                .hasMessageContaining("tolerance");
    }

    @Test
    void configuredSchemeOverridesConnectorDefault() {
        SyncBridgeProperties.Webhooks settings = new SyncBridgeProperties().getWebhooks();
        assertThat(settings.schemeFor("github")).isEqualTo(SignatureScheme.HMAC_SHA256);
        assertThat(settings.schemeFor("slack")).isEqualTo(SignatureScheme.NONE);

        settings.getSignatureSchemes().put("github", SignatureScheme.SHARED_SECRET);
        settings.getSignatureSchemes().put("slack", SignatureScheme.SLACK_V0);

        assertThat(settings.schemeFor("github")).isEqualTo(SignatureScheme.SHARED_SECRET);
        assertThat(settings.schemeFor("slack")).isEqualTo(SignatureScheme.SLACK_V0);
    }

    @Test
    void missingSecretNeverVerifies() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        Map<String, String> headers = Map.of(WebhookVerifier.GITHUB_SIGNATURE,
                "sha256=" + WebhookVerifier.hmacSha256Hex("", body));

        assertThat(verifier.hasSecret("gmail")).isFalse();
        assertThat(verifier.hasSecret("zoho-mail")).isFalse();
        assertThatThrownBy(() -> verifier.verify("gmail", body, headers))
                .isInstanceOf(WebhookVerifier.VerificationException.class);
        assertThatThrownBy(() -> verifier.verify("zoho-mail", body, headers))
                .isInstanceOf(WebhookVerifier.VerificationException.class);
    }

    @Test
    void missingOrMalformedGithubHeaderIsRejected() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> verifier.verify("github", body, Map.of()))
                .isInstanceOf(WebhookVerifier.VerificationException.class);
        assertThatThrownBy(() -> verifier.verify("github", body,
                Map.of(WebhookVerifier.GITHUB_SIGNATURE, WebhookVerifier.hmacSha256Hex(GITHUB_SECRET, body))))
                .isInstanceOf(WebhookVerifier.VerificationException.class);
    }

    @Test
    void uppercasedSignatureIsRejected() {
        byte[] body = "{\"action\":\"opened\"}".getBytes(StandardCharsets.UTF_8);
        String upper = "sha256=" + WebhookVerifier.hmacSha256Hex(GITHUB_SECRET, body).toUpperCase();

        assertThatThrownBy(() -> verifier.verify("github", body, Map.of(WebhookVerifier.GITHUB_SIGNATURE, upper)))
                .isInstanceOf(WebhookVerifier.VerificationException.class);
    }

    @Test
    void sharedSecretMustMatchExactly() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

        assertThatCode(() -> verifier.verify("jira", body,
                Map.of(WebhookVerifier.AUTHORIZATION, "Bearer " + JIRA_SECRET))).doesNotThrowAnyException();
        assertThatThrownBy(() -> verifier.verify("jira", body,
                Map.of(WebhookVerifier.AUTHORIZATION, "Bearer " + JIRA_SECRET + "x")))
                .isInstanceOf(WebhookVerifier.VerificationException.class);
        assertThatThrownBy(() -> verifier.verify("jira", body, Map.of()))
                .isInstanceOf(WebhookVerifier.VerificationException.class);
    }

    @Test
    void hmacMatchesKnownVector() {
        // RFC 4231 test case 2
        String hex = WebhookVerifier.hmacSha256Hex("Jefe",
                "what do ya want for nothing?".getBytes(StandardCharsets.UTF_8));

        assertThat(hex).isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }
}
