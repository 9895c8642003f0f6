package com.syncbridge.api.support;

import com.syncbridge.connector.AuthType;
import com.syncbridge.connector.AuthorizeParams;
import com.syncbridge.connector.Connector;
import com.syncbridge.connector.Credentials;
import com.syncbridge.connector.ExchangeTokenParams;
import com.syncbridge.connector.NormalizedSignal;
import com.syncbridge.connector.ProviderMetadata;
import com.syncbridge.connector.RefreshParams;
import com.syncbridge.connector.SyncException;
import com.syncbridge.connector.SyncParams;
import com.syncbridge.connector.SyncResult;
import com.syncbridge.connector.WebhookParams;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Connector whose sync and refresh results are scripted per test.
 * Unscripted calls fail the test with PERMANENT so they show up as failed jobs.
 */
public class ScriptedConnector implements Connector {

    public static final String NAME = "scripted";

    private static final ProviderMetadata METADATA =
            new ProviderMetadata(NAME, AuthType.OAUTH2, List.of("read"), true);

    private final ConcurrentLinkedDeque<Function<SyncParams, CompletableFuture<SyncResult>>> syncScript =
            new ConcurrentLinkedDeque<>();
    private final ConcurrentLinkedDeque<Supplier<CompletableFuture<Credentials>>> refreshScript =
            new ConcurrentLinkedDeque<>();
    private final List<SyncParams> syncCalls = Collections.synchronizedList(new ArrayList<>());
    private final List<RefreshParams> refreshCalls = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger refreshCount = new AtomicInteger();

    public void reset() {
        syncScript.clear();
        refreshScript.clear();
        syncCalls.clear();
        refreshCalls.clear();
        refreshCount.set(0);
    }

    public ScriptedConnector onSync(SyncResult result) {
        syncScript.add(params -> CompletableFuture.completedFuture(result));
        return this;
    }

    public ScriptedConnector onSyncFail(SyncException error) {
        syncScript.add(params -> CompletableFuture.failedFuture(error));
        return this;
    }

    public ScriptedConnector onSync(Function<SyncParams, CompletableFuture<SyncResult>> step) {
        syncScript.add(step);
        return this;
    }

    public ScriptedConnector onRefresh(Credentials credentials) {
        refreshScript.add(() -> CompletableFuture.completedFuture(credentials));
        return this;
    }

    public ScriptedConnector onRefreshFail(SyncException error) {
        refreshScript.add(() -> CompletableFuture.failedFuture(error));
        return this;
    }

    public ScriptedConnector onRefresh(Supplier<CompletableFuture<Credentials>> step) {
        refreshScript.add(step);
        return this;
    }

    public List<SyncParams> syncCalls() {
        return List.copyOf(syncCalls);
    }

    public List<RefreshParams> refreshCalls() {
        return List.copyOf(refreshCalls);
    }

    public int refreshCount() {
        return refreshCount.get();
    }

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
        return URI.create("https://scripted.test/authorize?state=" + params.state());
    }

    @Override
    public CompletableFuture<Credentials> exchangeToken(ExchangeTokenParams params) {
        Credentials credentials = Credentials.tokens("scripted-access-" + params.code(), "scripted-refresh", null, List.of("read"));
        return CompletableFuture.completedFuture(credentials.withIdentity("scripted-account", "Scripted", null));
    }

    @Override
    public CompletableFuture<Credentials> refreshToken(RefreshParams params) {
        refreshCalls.add(params);
        refreshCount.incrementAndGet();
        Supplier<CompletableFuture<Credentials>> step = refreshScript.poll();
        if (step == null) {
            return CompletableFuture.failedFuture(SyncException.permanent("unscripted refresh"));
        }
        return step.get();
    }

    @Override
    public CompletableFuture<SyncResult> sync(SyncParams params) {
        syncCalls.add(params);
        Function<SyncParams, CompletableFuture<SyncResult>> step = syncScript.poll();
        if (step == null) {
            return CompletableFuture.failedFuture(SyncException.permanent("unscripted sync"));
        }
        return step.apply(params);
    }

    @Override
    public List<NormalizedSignal> handleWebhook(WebhookParams params) {
        return List.of();
    }
}
