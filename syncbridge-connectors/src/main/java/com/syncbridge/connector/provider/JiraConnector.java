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
import com.syncbridge.connector.bridge.ProviderBridge;
import com.syncbridge.core.domain.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Atlassian Jira Cloud connector (OAuth 2.0 3LO).
 *
 * The cloud id and site URL are discovered from accessible-resources at connect time and kept
 * in the connection metadata; sync searches through {@code /ex/jira/{cloudId}/rest/api/3/search}.
 */
public class JiraConnector extends AbstractConnector {

    private static final Logger log = LoggerFactory.getLogger(JiraConnector.class);

    public static final String NAME = "jira";
    static final int PAGE_SIZE = 50;
    static final int MAX_ITEMS = 1000;
    static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

    static final String CLOUD_ID = "cloud_id";
    static final String SITE_URL = "site_url";

    // Jira renders offsets without a colon, e.g. 2024-05-01T10:15:30.000+0000
    private static final DateTimeFormatter JIRA_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

    private static final ProviderMetadata METADATA = new ProviderMetadata(
            NAME, AuthType.OAUTH2, List.of("read:jira-work", "read:jira-user", "offline_access"), true);

    private final String authBase;
    private final String apiBase;

    public JiraConnector(ProviderConfig config, ProviderBridge bridge, ObjectMapper objectMapper, Executor executor) {
        super(METADATA, config, bridge, objectMapper, executor);
        this.authBase = this.config.authBaseUrlOr("https://auth.atlassian.com");
        this.apiBase = this.config.apiBaseUrlOr("https://api.atlassian.com");
    }

    @Override
    protected String authorizeEndpoint() {
        return authBase + "/authorize";
    }

    @Override
    protected String tokenEndpoint() {
        return authBase + "/oauth/token";
    }

    @Override
    protected Map<String, String> extraAuthorizeParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("audience", "api.atlassian.com");
        params.put("prompt", "consent");
        return params;
    }

    @Override
    protected Credentials identify(Credentials credentials) {
        JsonNode resources = getJson(URI.create(apiBase + "/oauth/token/accessible-resources"), credentials.accessToken());
        JsonNode chosen = null;
        if (resources.isArray()) {
            for (JsonNode resource : resources) {
                if (chosen == null) {
                    chosen = resource;
                }
                if (resource.path("scopes").toString().contains("read:jira-work")) {
                    chosen = resource;
                    break;
                }
            }
        }
        if (chosen == null) {
            throw SyncException.permanent("No accessible Jira site for this account");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CLOUD_ID, text(chosen, "id"));
        metadata.put(SITE_URL, text(chosen, "url"));
        return credentials.withIdentity(text(chosen, "id"), text(chosen, "name"), metadata);
    }

    @Override
    public CompletableFuture<SyncResult> sync(SyncParams params) {
        return async(() -> {
            String searchUrl = searchUrl(params.connection());
            Instant since = params.cursor() != null ? params.cursor().asInstant().orElse(null) : null;
            if (since == null) {
                since = Instant.now().minus(DEFAULT_WINDOW);
            }
            String jql = "updated >= \"" + jqlTimestamp(since) + "\" ORDER BY updated ASC";

            List<NormalizedSignal> signals = new ArrayList<>();
            Instant latest = null;
            int startAt = 0;
            while (true) {
                Map<String, String> query = new LinkedHashMap<>();
                query.put("jql", jql);
                query.put("startAt", Integer.toString(startAt));
                query.put("maxResults", Integer.toString(PAGE_SIZE));
                query.put("fields", "id,key,project,summary,status,assignee,updated");
                JsonNode body = getJson(uri(searchUrl, query), params.accessToken());
                JsonNode issues = body.path("issues");
                for (JsonNode issue : issues) {
                    Instant updated = eventTimestamp(issue, null);
                    signals.add(toSignal(issue, SignalKind.ISSUE_UPDATED, updated));
                    if (latest == null || updated.isAfter(latest)) {
                        latest = updated;
                    }
                }
                if (issues.size() < PAGE_SIZE || signals.size() >= MAX_ITEMS) {
                    break;
                }
                startAt += PAGE_SIZE;
            }

            log.debug("Jira sync connection={} issues={}", params.connection().getId(), signals.size());
            return SyncResult.complete(signals, latest != null ? Cursor.ofInstant(latest) : params.cursor());
        });
    }

    private String searchUrl(Connection connection) {
        Map<String, Object> metadata = connection.getMetadata();
        Object cloudId = metadata != null ? metadata.get(CLOUD_ID) : null;
        if (cloudId instanceof String id && !id.isBlank()) {
            return apiBase + "/ex/jira/" + id + "/rest/api/3/search";
        }
        Object siteUrl = metadata != null ? metadata.get(SITE_URL) : null;
        if (siteUrl instanceof String site && !site.isBlank()) {
            return (site.endsWith("/") ? site.substring(0, site.length() - 1) : site) + "/rest/api/3/search";
        }
        throw SyncException.permanent("Missing Jira cloud_id or site_url for search");
    }

    private static String jqlTimestamp(Instant instant) {
        // JQL accepts "yyyy-MM-dd HH:mm" in UTC
        return DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").format(instant.atOffset(ZoneOffset.UTC));
    }

    @Override
    public List<NormalizedSignal> handleWebhook(WebhookParams params) {
        JsonNode payload = params.payload();
        String event = text(payload, "webhookEvent");
        SignalKind kind = event == null ? null : switch (event) {
            case "jira:issue_created" -> SignalKind.ISSUE_CREATED;
            case "jira:issue_updated" -> SignalKind.ISSUE_UPDATED;
            default -> null;
        };
        if (kind == null || !payload.has("issue")) {
            log.debug("Jira webhook event ignored event={}", event);
            return List.of();
        }
        Instant occurredAt = eventTimestamp(payload.get("issue"), payload.path("timestamp"));
        return List.of(toSignal(payload.get("issue"), kind, occurredAt));
    }

    private NormalizedSignal toSignal(JsonNode issue, SignalKind kind, Instant occurredAt) {
        JsonNode fields = issue.path("fields");
        String issueId = issue.path("id").asText("");
        String issueKey = issue.path("key").asText("");
        String self = text(issue, "self");
        String base = self != null && self.contains("/rest/") ? self.substring(0, self.indexOf("/rest/")) : "https://atlassian.net";

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("issue_id", issueId);
        payload.put("issue_key", issueKey);
        payload.put("project_key", fields.path("project").path("key").asText(""));
        payload.put("summary", fields.path("summary").asText(""));
        payload.put("status", fields.path("status").path("name").asText(""));
        payload.put("assignee", fields.path("assignee").path("displayName").asText(""));
        payload.put("url", base + "/browse/" + (issueKey.isEmpty() ? issueId : issueKey));
        payload.put("occurred_at", occurredAt.toString());
        String dedupeKey = "jira:" + kind.wireName() + ":" + issueId + ":" + occurredAt;
        return NormalizedSignal.of(kind, occurredAt, payload, dedupeKey);
    }

    /**
     * Issue {@code fields.updated}, else the webhook's epoch-millis timestamp, else now.
     */
    static Instant eventTimestamp(JsonNode issue, JsonNode webhookTimestamp) {
        Instant updated = parseJiraTimestamp(issue.path("fields").path("updated").asText(null));
        if (updated != null) {
            return updated;
        }
        if (webhookTimestamp != null && webhookTimestamp.canConvertToLong()) {
            return Instant.ofEpochMilli(webhookTimestamp.asLong());
        }
        return Instant.now();
    }

    static Instant parseJiraTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Instant rfc3339 = parseInstant(value);
        if (rfc3339 != null) {
            return rfc3339;
        }
        try {
            return OffsetDateTime.parse(value, JIRA_TIMESTAMP).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
