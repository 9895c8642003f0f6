package com.syncbridge.connector.bridge;

import com.syncbridge.connector.SyncException;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link ProviderBridge} backed by the JDK HTTP client.
 */
public class DefaultProviderBridge implements ProviderBridge {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;

    public DefaultProviderBridge() {
        this(HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public DefaultProviderBridge(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public BridgeResponse send(BridgeRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.uri())
                .timeout(REQUEST_TIMEOUT);
        request.headers().forEach(builder::header);
        if (request.body() != null) {
            builder.method(request.method(), HttpRequest.BodyPublishers.ofString(request.body()));
        } else {
            builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
        }

        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            return new BridgeResponse(response.statusCode(), response.headers().map(), response.body());
        } catch (IOException e) {
            throw SyncException.transientFailure(
                    "Network error calling " + request.uri().getHost() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw SyncException.transientFailure("Interrupted calling " + request.uri().getHost(), e);
        }
    }
}
