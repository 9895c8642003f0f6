package com.syncbridge.connector.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncbridge.connector.AuthType;
import com.syncbridge.connector.AuthorizeParams;
import com.syncbridge.connector.Connector;
import com.syncbridge.connector.Credentials;
import com.syncbridge.connector.ExchangeTokenParams;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.connector.ProviderMetadata;
import com.syncbridge.connector.RefreshParams;
import com.syncbridge.connector.SignalKind;
import com.syncbridge.connector.SyncException;
import com.syncbridge.connector.SyncParams;
import com.syncbridge.connector.SyncResult;
import com.syncbridge.connector.WebhookParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Zoho Cliq connector. Webhook-only: messages arrive through the Cliq outgoing webhook
 * and there is nothing to poll.
 */
public class ZohoCliqConnector implements Connector {

    private static final Logger log = LoggerFactory.getLogger(ZohoCliqConnector.class);

    public static final String NAME = "zoho-cliq";

    private static final ProviderMetadata METADATA = new ProviderMetadata(NAME, AuthType.CUSTOM, List.of(), true);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderMetadata metadata() {
        return METADATA;
    }

    @Override
    public URI authorize(AuthorizeParams params) {
        throw SyncException.permanent("unsupported operation: authorize");
    }

    @Override
    public CompletableFuture<Credentials> exchangeToken(ExchangeTokenParams params) {
        return CompletableFuture.failedFuture(SyncException.permanent("unsupported operation: exchange_token"));
    }

    @Override
    public CompletableFuture<Credentials> refreshToken(RefreshParams params) {
        return CompletableFuture.failedFuture(SyncException.permanent("unsupported operation: refresh_token"));
    }

    @Override
    public CompletableFuture<SyncResult> sync(SyncParams params) {
        return CompletableFuture.completedFuture(SyncResult.empty(params.cursor()));
    }

    @Override
    public List<NormalizedSignal> handleWebhook(WebhookParams params) {
        JsonNode payload = params.payload();
        JsonNode eventType = payload.get("event_type");
        if (eventType == null || !eventType.isTextual()) {
            throw SyncException.permanent("Invalid Zoho Cliq webhook payload: missing event_type");
        }
        SignalKind kind = switch (eventType.asText()) {
            case "message_posted" -> SignalKind.MESSAGE_POSTED;
            case "message_updated" -> SignalKind.MESSAGE_UPDATED;
            case "message_deleted" -> SignalKind.MESSAGE_DELETED;
            default -> null;
        };
        if (kind == null) {
            log.debug("Ignoring Zoho Cliq event type {}", eventType.asText());
            return List.of();
        }

        JsonNode message = payload.get("message");
        JsonNode user = payload.get("user");
        JsonNode chat = payload.get("chat");
        if (message == null || !message.isObject() || !message.hasNonNull("id")
                || user == null || !user.hasNonNull("id") || chat == null || !chat.hasNonNull("id")) {
            throw SyncException.permanent("Invalid Zoho Cliq webhook payload: missing message, user or chat");
        }

        Instant occurredAt = parseTimestamp(message.get("posted_time"));
        if (occurredAt == null) {
            occurredAt = parseTimestamp(payload.get("time_stamp"));
        }
        if (occurredAt == null) {
            occurredAt = Instant.now();
        }

        String messageId = message.get("id").asText();
        Map<String, Object> normalized = new LinkedHashMap<>();
        normalized.put("message_id", messageId);
        normalized.put("channel_id", chat.get("id").asText());
        normalized.put("channel_name", textOrNull(chat, "name"));
        normalized.put("channel_type", textOrNull(chat, "chat_type"));
        normalized.put("user_id", user.get("id").asText());
        normalized.put("user_name", displayName(user));
        normalized.put("user_email", textOrNull(user, "email"));
        normalized.put("text", textOrNull(message, "text"));
        normalized.put("message_type", textOrNull(message, "message_type"));
        normalized.put("occurred_at", occurredAt.toString());

        String dedupeKey = "zoho-cliq:" + kind.wireName() + ":" + messageId + ":" + occurredAt.getEpochSecond();
        return List.of(NormalizedSignal.of(kind, occurredAt, normalized, dedupeKey));
    }

    private static String displayName(JsonNode user) {
        String first = textOrNull(user, "first_name");
        String last = textOrNull(user, "last_name");
        if (first != null && last != null) {
            return first + " " + last;
        }
        if (first != null) {
            return first;
        }
        return last != null ? last : user.get("id").asText();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    /**
     * Accepts RFC3339, or epoch digits: 13 digits are millis, 10 to 12 digits seconds,
     * anything else is millis when above 10^10.
     */
    static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.trace("Zoho Cliq timestamp {} is not RFC3339", value);
        }
        long number;
        try {
            number = Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Failed to parse Zoho Cliq timestamp: {}", value);
            return null;
        }
        int digits = value.startsWith("-") ? value.length() - 1 : value.length();
        if (digits == 13) {
            return Instant.ofEpochSecond(number / 1000);
        }
        if (digits >= 10 && digits <= 12) {
            return Instant.ofEpochSecond(number);
        }
        return Instant.ofEpochSecond(number > 10_000_000_000L ? number / 1000 : number);
    }
}
