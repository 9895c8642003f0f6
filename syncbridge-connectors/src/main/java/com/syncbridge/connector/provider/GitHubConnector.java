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
import com.syncbridge.connector.SyncParams;
import com.syncbridge.connector.SyncResult;
import com.syncbridge.connector.WebhookParams;
import com.syncbridge.connector.bridge.BridgeRequest;
import com.syncbridge.connector.bridge.BridgeResponse;
import com.syncbridge.connector.bridge.ProviderBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub OAuth App connector.
 *
 * Incremental sync walks {@code /user/issues}, which returns both issues and pull requests,
 * oldest-updated first, following {@code Link: rel="next"}. A walk cut short at {@link #MAX_ITEMS}
 * reports {@code has_more} with a cursor that stops before the first item it did not emit. Webhooks map issues, pull_request,
 * issue_comment, pull_request_review, push and release events.
 */
public class GitHubConnector extends AbstractConnector {

    private static final Logger log = LoggerFactory.getLogger(GitHubConnector.class);

    public static final String NAME = "github";
    static final int MAX_ITEMS = 5000;
    private static final String ACCEPT = "application/vnd.github+json";
    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"next\"");

    private static final ProviderMetadata METADATA =
            new ProviderMetadata(NAME, AuthType.OAUTH2, List.of("repo", "read:org"), true);

    private final String authBase;
    private final String apiBase;

    public GitHubConnector(ProviderConfig config, ProviderBridge bridge, ObjectMapper objectMapper, Executor executor) {
        super(METADATA, config, bridge, objectMapper, executor);
        this.authBase = this.config.authBaseUrlOr("https://github.com");
        this.apiBase = this.config.apiBaseUrlOr("https://api.github.com");
    }

    @Override
    protected String authorizeEndpoint() {
        return authBase + "/login/oauth/authorize";
    }

    @Override
    protected String tokenEndpoint() {
        return authBase + "/login/oauth/access_token";
    }

    @Override
    protected Credentials identify(Credentials credentials) {
        JsonNode user = getGitHubJson(URI.create(apiBase + "/user"), credentials.accessToken()).body();
        String id = text(user, "id");
        String login = text(user, "login");
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (login != null) {
            metadata.put("login", login);
        }
        return credentials.withIdentity(id, login, metadata);
    }

    @Override
    public CompletableFuture<SyncResult> sync(SyncParams params) {
        return async(() -> {
            Instant since = params.cursor() != null ? params.cursor().asInstant().orElse(null) : null;
            Map<String, String> query = new LinkedHashMap<>();
            query.put("filter", "all");
            query.put("state", "all");
            query.put("sort", "updated");
            query.put("direction", "asc");
            query.put("per_page", "100");
            if (since != null) {
                query.put("since", since.toString());
            }

            List<NormalizedSignal> signals = new ArrayList<>();
            Instant latest = since;
            URI next = uri(apiBase + "/user/issues", query);
            boolean truncated = false;

            while (next != null) {
                Page page = getGitHubJson(next, params.accessToken());
                if (!page.body().isArray()) {
                    break;
                }
                for (JsonNode item : page.body()) {
                    Instant updated = parseInstant(text(item, "updated_at"));
                    if (updated == null) {
                        updated = parseInstant(text(item, "created_at"));
                    }
                    // GitHub's since filter is inclusive
                    if (updated == null || (since != null && !updated.isAfter(since))) {
                        continue;
                    }
                    signals.add(toSignal(item, updated));
                    if (latest == null || updated.isAfter(latest)) {
                        latest = updated;
                    }
                }
                if (signals.size() >= MAX_ITEMS) {
                    truncated = page.next() != null;
                    break;
                }
                next = page.next();
            }

            log.debug("GitHub sync connection={} items={} truncated={}",
                    params.connection().getId(), signals.size(), truncated);
            if (truncated) {
                return truncatedResult(signals);
            }
            Cursor nextCursor = latest != null ? Cursor.ofInstant(latest) : params.cursor();
            return SyncResult.complete(signals, nextCursor);
        });
    }

    /**
     * Items sharing the last timestamp may continue on the next page, so the trailing run is
     * held back and re-read from an inclusive {@code since} on the continuation.
     */
    static SyncResult truncatedResult(List<NormalizedSignal> signals) {
        Instant boundary = signals.get(signals.size() - 1).occurredAt();
        int keep = signals.size();
        while (keep > 0 && signals.get(keep - 1).occurredAt().equals(boundary)) {
            keep--;
        }
        if (keep == 0) {
            // whole batch shares one timestamp
            return SyncResult.partial(signals, Cursor.ofInstant(boundary));
        }
        List<NormalizedSignal> emitted = List.copyOf(signals.subList(0, keep));
        return SyncResult.partial(emitted, Cursor.ofInstant(emitted.get(keep - 1).occurredAt()));
    }

    private NormalizedSignal toSignal(JsonNode item, Instant updated) {
        boolean pullRequest = item.has("pull_request");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", item.path("id").asLong());
        payload.put("number", item.path("number").asLong());
        payload.put("title", text(item, "title"));
        payload.put("state", text(item, "state"));
        payload.put("url", text(item, "html_url"));
        payload.put("repository", repositoryName(item));
        payload.put("author", text(item.path("user"), "login"));
        payload.put("updated_at", updated.toString());
        String prefix = pullRequest ? "github_pr_" : "github_issue_";
        return NormalizedSignal.of(
                pullRequest ? SignalKind.PR_UPDATED : SignalKind.ISSUE_UPDATED,
                updated,
                payload,
                prefix + item.path("id").asText());
    }

    private static String repositoryName(JsonNode item) {
        String fullName = text(item.path("repository"), "full_name");
        if (fullName != null) {
            return fullName;
        }
        String repositoryUrl = text(item, "repository_url");
        if (repositoryUrl != null && repositoryUrl.contains("/repos/")) {
            return repositoryUrl.substring(repositoryUrl.indexOf("/repos/") + "/repos/".length());
        }
        return null;
    }

    private Page getGitHubJson(URI uri, String accessToken) {
        BridgeResponse response = bridge.send(BridgeRequest.get(uri)
                .withBearer(accessToken)
                .withHeader("Accept", ACCEPT)
                .withHeader("User-Agent", "syncbridge"));
        checkResponse(response);
        URI next = response.header("Link").flatMap(GitHubConnector::nextLink).orElse(null);
        return new Page(readJson(response), next);
    }

    static Optional<URI> nextLink(String linkHeader) {
        Matcher matcher = NEXT_LINK.matcher(linkHeader);
        return matcher.find() ? Optional.of(URI.create(matcher.group(1))) : Optional.empty();
    }

    @Override
    public List<NormalizedSignal> handleWebhook(WebhookParams params) {
        JsonNode payload = params.payload();
        String event = params.header("x-github-event");
        if ("push".equals(event) || (event == null && payload.has("commits") && payload.has("ref"))) {
            return pushSignal(payload);
        }
        String action = text(payload, "action");
        if (action == null) {
            log.warn("Received GitHub webhook without action field");
            return List.of();
        }

        Instant now = Instant.now();
        if (payload.has("pull_request") && !payload.has("review") && !payload.has("comment")) {
            JsonNode pr = payload.get("pull_request");
            SignalKind kind = switch (action) {
                case "opened" -> SignalKind.PR_OPENED;
                case "closed" -> pr.path("merged").asBoolean(false) ? SignalKind.PR_MERGED : SignalKind.PR_CLOSED;
                case "reopened" -> SignalKind.PR_REOPENED;
                case "edited", "synchronize" -> SignalKind.PR_UPDATED;
                default -> null;
            };
            return single(kind, pr, "pr", "updated_at", now);
        }
        if (payload.has("review")) {
            return single(SignalKind.PR_REVIEW, payload.get("review"), "review", "submitted_at", now);
        }
        if (payload.has("comment")) {
            return single(SignalKind.ISSUE_COMMENT, payload.get("comment"), "comment", "updated_at", now);
        }
        if (payload.has("issue")) {
            SignalKind kind = switch (action) {
                case "opened" -> SignalKind.ISSUE_CREATED;
                case "closed" -> SignalKind.ISSUE_CLOSED;
                case "reopened" -> SignalKind.ISSUE_REOPENED;
                case "edited" -> SignalKind.ISSUE_UPDATED;
                default -> null;
            };
            return single(kind, payload.get("issue"), "issue", "updated_at", now);
        }
        if (payload.has("release")) {
            SignalKind kind = "published".equals(action) ? SignalKind.RELEASE_PUBLISHED : null;
            return single(kind, payload.get("release"), "release", "published_at", now);
        }
        log.debug("Unhandled GitHub webhook event={} action={}", event, action);
        return List.of();
    }

    private List<NormalizedSignal> single(SignalKind kind, JsonNode entity, String label, String timeField, Instant now) {
        if (kind == null) {
            return List.of();
        }
        Instant occurredAt = Optional.ofNullable(parseInstant(text(entity, timeField)))
                .or(() -> Optional.ofNullable(parseInstant(text(entity, "updated_at"))))
                .orElse(now);
        return List.of(NormalizedSignal.of(kind, occurredAt, toMap(entity),
                "github_webhook_" + label + "_" + entity.path("id").asText("0")));
    }

    private List<NormalizedSignal> pushSignal(JsonNode payload) {
        String after = text(payload, "after");
        Instant occurredAt = Optional.ofNullable(parseInstant(text(payload.path("head_commit"), "timestamp")))
                .orElse(Instant.now());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ref", text(payload, "ref"));
        body.put("before", text(payload, "before"));
        body.put("after", after);
        body.put("repository", text(payload.path("repository"), "full_name"));
        body.put("pusher", text(payload.path("pusher"), "name"));
        body.put("commit_count", payload.path("commits").size());
        return List.of(NormalizedSignal.of(SignalKind.CODE_PUSHED, occurredAt, body,
                "github_webhook_push_" + (after != null ? after : "0")));
    }

    private record Page(JsonNode body, URI next) {}
}
