package com.syncbridge.connector.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.connector.AbstractConnector;
import com.syncbridge.connector.AuthType;
import com.syncbridge.connector.Credentials;
import com.syncbridge.connector.Cursor;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.connector.ProviderConfig;
import com.syncbridge.connector.ProviderMetadata;
import com.syncbridge.connector.SignalKind;
import com.syncbridge.connector.SyncException;
import com.syncbridge.connector.SyncParams;
import com.syncbridge.connector.SyncResult;
import com.syncbridge.connector.WebhookParams;
import com.syncbridge.connector.bridge.BridgeRequest;
import com.syncbridge.connector.bridge.BridgeResponse;
import com.syncbridge.connector.bridge.ProviderBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Zoho Mail connector.
 *
 * The cursor is an RFC3339 timestamp. The first run stores "now" as a baseline without
 * listing anything; later runs list messages received since the cursor minus a dedupe window.
 */
public class ZohoMailConnector extends AbstractConnector {

    private static final Logger log = LoggerFactory.getLogger(ZohoMailConnector.class);

    public static final String NAME = "zoho-mail";
    static final Duration DEDUPE_WINDOW = Duration.ofMinutes(5);
    static final String ACCOUNT_ID = "account_id";

    private static final ProviderMetadata METADATA =
            new ProviderMetadata(NAME, AuthType.OAUTH2, List.of("ZohoMail.messages.READ", "ZohoMail.accounts.READ"), false);

    public enum DataCenter {
        US("https://accounts.zoho.com", "https://mail.zoho.com"),
        EU("https://accounts.zoho.eu", "https://mail.zoho.eu"),
        IN("https://accounts.zoho.in", "https://mail.zoho.in"),
        AU("https://accounts.zoho.com.au", "https://mail.zoho.com.au"),
        JP("https://accounts.zoho.jp", "https://mail.zoho.jp"),
        CA("https://accounts.zohocloud.ca", "https://mail.zohocloud.ca"),
        SA("https://accounts.zoho.sa", "https://mail.zoho.sa"),
        UK("https://accounts.zoho.uk", "https://mail.zoho.uk");

        private final String accountsBase;
        private final String mailBase;

        DataCenter(String accountsBase, String mailBase) {
            this.accountsBase = accountsBase;
            this.mailBase = mailBase;
        }

        public static DataCenter parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Invalid Zoho data center '" + value + "': must be one of us,eu,in,au,jp,ca,sa,uk", e);
            }
        }

        public String accountsBase() { return accountsBase; }
        public String mailBase() { return mailBase; }
    }

    private final String accountsBase;
    private final String mailBase;
    private final Duration dedupeWindow;

    public ZohoMailConnector(ProviderConfig config, ProviderBridge bridge, ObjectMapper objectMapper, Executor executor) {
        super(METADATA, config, bridge, objectMapper, executor);
        DataCenter dc = DataCenter.parse(this.config.option("dc", "us"));
        this.accountsBase = this.config.authBaseUrlOr(dc.accountsBase());
        this.mailBase = this.config.apiBaseUrlOr(dc.mailBase());
        this.dedupeWindow = Duration.ofSeconds(Long.parseLong(
                this.config.option("dedupe-window-seconds", Long.toString(DEDUPE_WINDOW.getSeconds()))));
    }

    @Override
    protected String authorizeEndpoint() {
        return accountsBase + "/oauth/v2/auth";
    }

    @Override
    protected String tokenEndpoint() {
        return accountsBase + "/oauth/v2/token";
    }

    @Override
    protected Map<String, String> extraAuthorizeParams() {
        return Map.of("access_type", "offline", "prompt", "consent");
    }

    @Override
    protected Credentials identify(Credentials credentials) {
        JsonNode accounts = zohoGet(URI.create(mailBase + "/api/accounts"), credentials.accessToken());
        JsonNode account = accounts.path("data").path(0);
        String accountId = text(account, "accountId");
        if (accountId == null) {
            throw SyncException.permanent("Zoho Mail returned no accounts for this user");
        }
        String address = text(account, "primaryEmailAddress");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ACCOUNT_ID, accountId);
        return credentials.withIdentity(accountId, address, metadata);
    }

    @Override
    public CompletableFuture<SyncResult> sync(SyncParams params) {
        return async(() -> {
            Instant since = params.cursor() != null ? params.cursor().asInstant().orElse(null) : null;
            if (since == null) {
                return SyncResult.empty(Cursor.ofInstant(Instant.now()));
            }
            Object accountId = params.connection().getMetadata() != null
                    ? params.connection().getMetadata().get(ACCOUNT_ID) : null;
            if (!(accountId instanceof String id) || id.isBlank()) {
                throw SyncException.permanent("Zoho Mail connection has no account_id");
            }

            Instant windowStart = since.minus(dedupeWindow);
            Map<String, String> query = new LinkedHashMap<>();
            query.put("limit", "200");
            query.put("sortorder", "false");
            JsonNode body = zohoGet(uri(mailBase + "/api/accounts/" + id + "/messages/view", query), params.accessToken());

            List<NormalizedSignal> signals = new ArrayList<>();
            Instant latest = since;
            for (JsonNode message : body.path("data")) {
                String received = text(message, "receivedTime");
                if (received == null || !received.chars().allMatch(Character::isDigit)) {
                    continue;
                }
                Instant receivedAt = Instant.ofEpochMilli(Long.parseLong(received));
                if (receivedAt.isBefore(windowStart)) {
                    continue;
                }
                String messageId = text(message, "messageId");
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("message_id", messageId);
                payload.put("subject", text(message, "subject"));
                payload.put("from", text(message, "fromAddress"));
                payload.put("folder_id", text(message, "folderId"));
                payload.put("occurred_at", receivedAt.toString());
                signals.add(NormalizedSignal.of(SignalKind.EMAIL_RECEIVED, receivedAt, payload,
                        "zoho-mail:" + messageId + ":" + received));
                if (receivedAt.isAfter(latest)) {
                    latest = receivedAt;
                }
            }
            log.debug("Zoho Mail sync connection={} messages={}", params.connection().getId(), signals.size());
            return SyncResult.complete(signals, Cursor.ofInstant(latest));
        });
    }

    private JsonNode zohoGet(URI uri, String accessToken) {
        BridgeResponse response = bridge.send(BridgeRequest.get(uri)
                .withHeader("Authorization", "Zoho-oauthtoken " + accessToken));
        checkResponse(response);
        return readJson(response);
    }

    @Override
    public List<NormalizedSignal> handleWebhook(WebhookParams params) {
        return List.of();
    }
}
