package com.syncbridge.connector;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Capability interface every provider integration implements.
 *
 * Fallible operations fail with {@link SyncException}; asynchronous ones complete their
 * future exceptionally with it. A failed {@link #sync} never carries partial results.
 */
public interface Connector {

    /**
     * Returns the provider name this connector is registered under.
     *
     * @return Provider name (e.g. "github", "jira", "zoho-cliq")
     */
    String name();

    /**
     * Returns immutable provider metadata.
     */
    ProviderMetadata metadata();

    /**
     * Builds the provider authorization URL bound to the given state token.
     *
     * @param params Tenant, redirect URI and state token
     * @return URL the user agent should be sent to
     */
    URI authorize(AuthorizeParams params);

    /**
     * Exchanges an authorization code for tokens and account identity.
     */
    CompletableFuture<Credentials> exchangeToken(ExchangeTokenParams params);

    /**
     * Exchanges a refresh token for a new access token. A result whose refresh token is
     * null means the previous refresh token remains valid.
     */
    CompletableFuture<Credentials> refreshToken(RefreshParams params);

    /**
     * Fetches events since the given cursor.
     *
     * @param params Connection, decrypted access token and cursor
     * @return Signals, next cursor and whether more pages remain
     */
    CompletableFuture<SyncResult> sync(SyncParams params);

    /**
     * Maps a verified webhook push onto signals. May return none when the push only
     * says that something changed.
     */
    List<NormalizedSignal> handleWebhook(WebhookParams params);
}
