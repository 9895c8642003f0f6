package com.syncbridge.connector.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.connector.AuthType;
import com.syncbridge.connector.Cursor;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.connector.ProviderConfig;
import com.syncbridge.connector.ProviderMetadata;
import com.syncbridge.connector.SignalKind;
import com.syncbridge.connector.SyncParams;
import com.syncbridge.connector.SyncResult;
import com.syncbridge.connector.WebhookParams;
import com.syncbridge.connector.bridge.ProviderBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Google Calendar connector on the primary calendar.
 *
 * The cursor is an object {@code {"sync_token": …}} or, while paging, {@code {"page_token": …}}.
 * One page is fetched per run; a returned {@code nextPageToken} produces a continuation.
 */
public class GoogleCalendarConnector extends AbstractGoogleConnector {

    private static final Logger log = LoggerFactory.getLogger(GoogleCalendarConnector.class);

    public static final String NAME = "google-calendar";
    static final String SYNC_TOKEN = "sync_token";
    static final String PAGE_TOKEN = "page_token";

    private static final ProviderMetadata METADATA = new ProviderMetadata(
            NAME, AuthType.OAUTH2, List.of("https://www.googleapis.com/auth/calendar.readonly"), true);

    public GoogleCalendarConnector(ProviderConfig config, ProviderBridge bridge, ObjectMapper objectMapper, Executor executor) {
        super(METADATA, config, bridge, objectMapper, executor, "https://www.googleapis.com/calendar/v3");
    }

    @Override
    public CompletableFuture<SyncResult> sync(SyncParams params) {
        return async(() -> {
            JsonNode cursor = params.cursor() != null ? params.cursor().value() : null;
            Map<String, String> query = new LinkedHashMap<>();
            query.put("maxResults", "250");
            query.put("showDeleted", "true");
            if (cursor != null && text(cursor, PAGE_TOKEN) != null) {
                query.put("pageToken", text(cursor, PAGE_TOKEN));
            } else if (cursor != null && text(cursor, SYNC_TOKEN) != null) {
                query.put("syncToken", text(cursor, SYNC_TOKEN));
            }

            JsonNode body = getJson(uri(apiBase + "/calendars/primary/events", query), params.accessToken());
            List<NormalizedSignal> signals = new ArrayList<>();
            for (JsonNode event : body.path("items")) {
                signals.add(toSignal(event));
            }

            String nextPageToken = text(body, "nextPageToken");
            String nextSyncToken = text(body, "nextSyncToken");
            log.debug("Calendar sync connection={} events={} more={}",
                    params.connection().getId(), signals.size(), nextPageToken != null);
            if (nextPageToken != null) {
                return SyncResult.partial(signals, tokenCursor(PAGE_TOKEN, nextPageToken));
            }
            Cursor next = nextSyncToken != null ? tokenCursor(SYNC_TOKEN, nextSyncToken) : params.cursor();
            return SyncResult.complete(signals, next);
        });
    }

    private Cursor tokenCursor(String key, String value) {
        return Cursor.of(objectMapper.createObjectNode().put(key, value));
    }

    private NormalizedSignal toSignal(JsonNode event) {
        boolean cancelled = "cancelled".equals(text(event, "status"));
        SignalKind kind = cancelled ? SignalKind.CALENDAR_EVENT_DELETED : SignalKind.CALENDAR_EVENT_UPDATED;
        Instant updated = parseInstant(text(event, "updated"));
        Instant occurredAt = updated != null ? updated : Instant.now();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_id", text(event, "id"));
        payload.put("summary", text(event, "summary"));
        payload.put("status", text(event, "status"));
        payload.put("html_link", text(event, "htmlLink"));
        payload.put("start", text(event.path("start"), "dateTime") != null
                ? text(event.path("start"), "dateTime") : text(event.path("start"), "date"));
        payload.put("organizer", text(event.path("organizer"), "email"));
        payload.put("updated", occurredAt.toString());
        return NormalizedSignal.of(kind, occurredAt, payload,
                "google-calendar:" + text(event, "id") + ":" + occurredAt);
    }

    /**
     * Channel notifications carry only headers; the follow-up sync fetches the changes.
     */
    @Override
    public List<NormalizedSignal> handleWebhook(WebhookParams params) {
        log.debug("Calendar notification state={} channel={}",
                params.header("x-goog-resource-state"), params.header("x-goog-channel-id"));
        return List.of();
    }
}
