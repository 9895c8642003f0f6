package com.syncbridge.api.webhook;

import com.syncbridge.api.config.SyncBridgeProperties;
import com.syncbridge.api.security.OperatorAuthenticator;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;

/**
 * Verifies webhook signatures against the raw request body.
 *
 * All comparisons are constant time. A provider without a configured secret can never
 * pass verification, whatever headers it sends.
 */
@Component
public class WebhookVerifier {

    static final String GITHUB_SIGNATURE = "x-hub-signature-256";
    static final String SLACK_SIGNATURE = "x-slack-signature";
    static final String SLACK_TIMESTAMP = "x-slack-request-timestamp";
    static final String AUTHORIZATION = "authorization";

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final HexFormat HEX = HexFormat.of();

    private final SyncBridgeProperties.Webhooks settings;
    private final Clock clock;

    public WebhookVerifier(SyncBridgeProperties properties, Clock clock) {
        this.settings = properties.getWebhooks();
        this.clock = clock;
    }

    public boolean hasSecret(String provider) {
        return settings.secretFor(provider) != null;
    }

    /**
     * @param provider Provider name from the route
     * @param rawBody  Request body exactly as received
     * @param headers  Request headers with lower-case names
     * @throws VerificationException when the request is not authentic
     */
    public void verify(String provider, byte[] rawBody, Map<String, String> headers) {
        String secret = settings.secretFor(provider);
        if (secret == null) {
            throw new VerificationException("Webhook secret not configured for " + provider);
        }
        byte[] body = rawBody != null ? rawBody : new byte[0];
        switch (settings.schemeFor(provider)) {
            case HMAC_SHA256 -> verifyHubSignature(secret, body, headers.get(GITHUB_SIGNATURE));
            case SLACK_V0 -> verifySlackSignature(secret, body, headers.get(SLACK_TIMESTAMP), headers.get(SLACK_SIGNATURE));
            case SHARED_SECRET -> verifySharedSecret(secret, headers.get(AUTHORIZATION));
            case NONE -> throw new VerificationException("Provider " + provider + " does not support signed webhooks");
        }
    }

    private void verifyHubSignature(String secret, byte[] body, String header) {
        if (header == null || !header.startsWith("sha256=")) {
            throw new VerificationException("Missing or malformed X-Hub-Signature-256");
        }
        String expected = "sha256=" + hmacSha256Hex(secret, body);
        requireEqual(expected, header.trim());
    }

    private void verifySlackSignature(String secret, byte[] body, String timestampHeader, String signature) {
        if (timestampHeader == null || signature == null) {
            throw new VerificationException("Missing Slack signature headers");
        }
        long timestamp;
        try {
            timestamp = Long.parseLong(timestampHeader.trim());
        } catch (NumberFormatException e) {
            throw new VerificationException("Slack request timestamp is not numeric");
        }
        long skew = Math.abs(clock.instant().getEpochSecond() - timestamp);
        Duration tolerance = settings.getSignatureTolerance();
        if (skew > tolerance.toSeconds()) {
            throw new VerificationException("Slack request timestamp outside tolerance of " + tolerance.toSeconds() + "s");
        }
        byte[] prefix = ("v0:" + timestamp + ":").getBytes(StandardCharsets.UTF_8);
        String expected = "v0=" + hmacSha256Hex(secret, prefix, body);
        requireEqual(expected, signature.trim());
    }

    private void verifySharedSecret(String secret, String authorization) {
        String presented = OperatorAuthenticator.bearerToken(authorization);
        if (presented == null) {
            throw new VerificationException("Missing bearer secret");
        }
        requireEqual(secret, presented);
    }

    private static void requireEqual(String expected, String presented) {
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8))) {
            throw new VerificationException("Signature mismatch");
        }
    }

    /**
     * Lower-case hex HMAC-SHA256 over the concatenation of {@code parts}.
     */
    public static String hmacSha256Hex(String secret, byte[]... parts) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            for (byte[] part : parts) {
                mac.update(part);
            }
            return HEX.formatHex(mac.doFinal());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    public static class VerificationException extends RuntimeException {
        public VerificationException(String message) {
            super(message);
        }
    }
}
