package com.syncbridge.api.webhook;

import java.util.Map;

/**
 * How a provider authenticates its webhook pushes on the public path.
 *
 * Built-in connectors have a fixed scheme; {@code syncbridge.webhooks.signature-schemes}
 * assigns or overrides one per registered provider.
 */
public enum SignatureScheme {
    /** {@code X-Hub-Signature-256: sha256=<hex>} over the raw body. */
    HMAC_SHA256,
    /** {@code X-Slack-Signature: v0=<hex>} over {@code v0:<timestamp>:<body>}. */
    SLACK_V0,
    /** {@code Authorization: Bearer <secret>}. */
    SHARED_SECRET,
    /** No public verification; only the operator path is accepted. */
    NONE;

    private static final Map<String, SignatureScheme> BY_PROVIDER = Map.of(
            "github", HMAC_SHA256,
            "example", HMAC_SHA256,
            "jira", SHARED_SECRET,
            "zoho-cliq", SHARED_SECRET);

    public static SignatureScheme defaultFor(String provider) {
        return BY_PROVIDER.getOrDefault(provider, NONE);
    }
}
