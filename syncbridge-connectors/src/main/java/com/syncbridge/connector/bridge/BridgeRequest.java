package com.syncbridge.connector.bridge;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outbound provider HTTP request.
 */
public record BridgeRequest(String method, URI uri, Map<String, String> headers, String body) {

    public BridgeRequest {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public static BridgeRequest get(URI uri) {
        return new BridgeRequest("GET", uri, Map.of("Accept", "application/json"), null);
    }

    public static BridgeRequest postForm(URI uri, Map<String, String> form) {
        String body = form.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/x-www-form-urlencoded");
        headers.put("Accept", "application/json");
        return new BridgeRequest("POST", uri, headers, body);
    }

    public BridgeRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new BridgeRequest(method, uri, copy, body);
    }

    public BridgeRequest withBearer(String token) {
        return withHeader("Authorization", "Bearer " + token);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
