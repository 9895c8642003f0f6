package com.syncbridge.connector.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.connector.AuthType;
import com.syncbridge.connector.Cursor;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.connector.ProviderConfig;
import com.syncbridge.connector.ProviderMetadata;
import com.syncbridge.connector.SignalKind;
import com.syncbridge.connector.SyncException;
import com.syncbridge.connector.SyncParams;
import com.syncbridge.connector.SyncResult;
import com.syncbridge.connector.WebhookParams;
import com.syncbridge.connector.bridge.BridgeResponse;
import com.syncbridge.connector.bridge.ProviderBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Gmail connector using the History API.
 *
 * The cursor is the mailbox {@code historyId}. A first run records the current historyId from
 * the profile as a baseline and emits nothing.
 */
public class GmailConnector extends AbstractGoogleConnector {

    private static final Logger log = LoggerFactory.getLogger(GmailConnector.class);

    public static final String NAME = "gmail";
    static final long QUOTA_RETRY_SECONDS = 60;

    private static final ProviderMetadata METADATA = new ProviderMetadata(
            NAME, AuthType.OAUTH2, List.of("https://www.googleapis.com/auth/gmail.readonly"), true);

    public GmailConnector(ProviderConfig config, ProviderBridge bridge, ObjectMapper objectMapper, Executor executor) {
        super(METADATA, config, bridge, objectMapper, executor, "https://gmail.googleapis.com/gmail/v1/users");
    }

    @Override
    protected Long defaultQuotaRetrySeconds() {
        return QUOTA_RETRY_SECONDS;
    }

    @Override
    protected void checkResponse(BridgeResponse response) {
        if (response.statusCode() == 404) {
            // startHistoryId too old or unknown; the next run starts over from the profile
            throw SyncException.transientFailure("Gmail history ID not found or too old");
        }
        super.checkResponse(response);
    }

    @Override
    public CompletableFuture<SyncResult> sync(SyncParams params) {
        return async(() -> {
            Long start = params.cursor() != null ? params.cursor().asLong().orElse(null) : null;
            if (start == null) {
                JsonNode profile = getJson(URI.create(apiBase + "/me/profile"), params.accessToken());
                String historyId = text(profile, "historyId");
                if (historyId == null) {
                    throw SyncException.transientFailure("Gmail profile did not include a historyId");
                }
                log.info("Gmail baseline historyId={} connection={}", historyId, params.connection().getId());
                return SyncResult.empty(Cursor.ofString(historyId));
            }

            List<NormalizedSignal> signals = new ArrayList<>();
            String latestHistoryId = Long.toString(start);
            String pageToken = null;
            do {
                Map<String, String> query = new LinkedHashMap<>();
                query.put("startHistoryId", Long.toString(start));
                query.put("pageToken", pageToken);
                JsonNode body = getJson(uri(apiBase + "/me/history", query), params.accessToken());
                for (JsonNode record : body.path("history")) {
                    signals.add(toSignal(params, record));
                }
                if (text(body, "historyId") != null) {
                    latestHistoryId = text(body, "historyId");
                }
                pageToken = text(body, "nextPageToken");
            } while (pageToken != null);

            return SyncResult.complete(signals, Cursor.ofString(latestHistoryId));
        });
    }

    private NormalizedSignal toSignal(SyncParams params, JsonNode record) {
        boolean deleted = record.path("messagesDeleted").size() > 0;
        SignalKind kind = deleted ? SignalKind.EMAIL_DELETED : SignalKind.EMAIL_UPDATED;
        String historyId = record.path("id").asText();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("signal_type", kind.wireName());
        payload.put("history_id", historyId);
        payload.put("messages_added", record.path("messagesAdded").size());
        payload.put("messages_deleted", record.path("messagesDeleted").size());
        payload.put("labels_added", record.path("labelsAdded").size());
        payload.put("labels_removed", record.path("labelsRemoved").size());
        return NormalizedSignal.of(kind, Instant.now(), payload,
                "gmail:" + params.connection().getId() + ":" + historyId);
    }

    /**
     * Pub/Sub push. The decoded data only says that the mailbox changed; the follow-up
     * sync produces the signals.
     */
    @Override
    public List<NormalizedSignal> handleWebhook(WebhookParams params) {
        String data = text(params.payload().path("message"), "data");
        if (data == null) {
            throw SyncException.permanent("Gmail push is missing message.data");
        }
        try {
            JsonNode decoded = objectMapper.readTree(new String(Base64.getDecoder().decode(data), StandardCharsets.UTF_8));
            log.debug("Gmail push emailAddress={} historyId={}",
                    text(decoded, "emailAddress"), text(decoded, "historyId"));
        } catch (IllegalArgumentException | IOException e) {
            throw SyncException.permanent("Gmail push data is not base64 JSON");
        }
        return List.of();
    }
}
