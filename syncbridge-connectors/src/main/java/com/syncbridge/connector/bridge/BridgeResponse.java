package com.syncbridge.connector.bridge;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Provider HTTP response as seen by connectors.
 */
public record BridgeResponse(int statusCode, Map<String, List<String>> headers, String body) {

    public BridgeResponse {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        body = body != null ? body : "";
    }

    public static BridgeResponse of(int statusCode, String body) {
        return new BridgeResponse(statusCode, Map.of(), body);
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * First value of a header, matched case-insensitively.
     */
    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }
}
