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
import com.syncbridge.connector.bridge.ProviderBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Google Drive connector over the changes feed. The cursor is a Drive page token.
 */
public class GoogleDriveConnector extends AbstractGoogleConnector {

    private static final Logger log = LoggerFactory.getLogger(GoogleDriveConnector.class);

    public static final String NAME = "google-drive";

    private static final ProviderMetadata METADATA = new ProviderMetadata(
            NAME, AuthType.OAUTH2, List.of("https://www.googleapis.com/auth/drive.metadata.readonly"), true);

    public GoogleDriveConnector(ProviderConfig config, ProviderBridge bridge, ObjectMapper objectMapper, Executor executor) {
        super(METADATA, config, bridge, objectMapper, executor, "https://www.googleapis.com/drive/v3");
    }

    @Override
    public CompletableFuture<SyncResult> sync(SyncParams params) {
        return async(() -> {
            String pageToken = params.cursor() != null ? params.cursor().asText().orElse(null) : null;
            if (pageToken == null) {
                JsonNode start = getJson(URI.create(apiBase + "/changes/startPageToken"), params.accessToken());
                String startToken = text(start, "startPageToken");
                if (startToken == null) {
                    throw SyncException.transientFailure("Drive did not return a startPageToken");
                }
                log.info("Drive baseline pageToken recorded for connection={}", params.connection().getId());
                return SyncResult.empty(Cursor.ofString(startToken));
            }

            Map<String, String> query = new LinkedHashMap<>();
            query.put("pageToken", pageToken);
            query.put("pageSize", "100");
            query.put("fields", "nextPageToken,newStartPageToken,changes(fileId,removed,time,file(name,mimeType,trashed,webViewLink))");
            JsonNode body = getJson(uri(apiBase + "/changes", query), params.accessToken());

            List<NormalizedSignal> signals = new ArrayList<>();
            for (JsonNode change : body.path("changes")) {
                signals.add(toSignal(change));
            }
            String nextPageToken = text(body, "nextPageToken");
            if (nextPageToken != null) {
                return SyncResult.partial(signals, Cursor.ofString(nextPageToken));
            }
            String newStart = text(body, "newStartPageToken");
            return SyncResult.complete(signals, newStart != null ? Cursor.ofString(newStart) : params.cursor());
        });
    }

    private NormalizedSignal toSignal(JsonNode change) {
        JsonNode file = change.path("file");
        boolean deleted = change.path("removed").asBoolean(false) || file.path("trashed").asBoolean(false);
        SignalKind kind = deleted ? SignalKind.FILE_DELETED : SignalKind.FILE_UPDATED;
        Instant time = parseInstant(text(change, "time"));
        Instant occurredAt = time != null ? time : Instant.now();
        String fileId = text(change, "fileId");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("file_id", fileId);
        payload.put("name", text(file, "name"));
        payload.put("mime_type", text(file, "mimeType"));
        payload.put("url", text(file, "webViewLink"));
        payload.put("removed", deleted);
        return NormalizedSignal.of(kind, occurredAt, payload, "google-drive:" + fileId + ":" + occurredAt);
    }

    @Override
    public List<NormalizedSignal> handleWebhook(WebhookParams params) {
        log.debug("Drive notification state={} channel={}",
                params.header("x-goog-resource-state"), params.header("x-goog-channel-id"));
        return List.of();
    }
}
