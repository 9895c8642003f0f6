package com.syncbridge.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncbridge.core.domain.Connection;

import java.util.Map;
import java.util.UUID;

/**
 * @param tenantId   Tenant the push was addressed to
 * @param connection Resolved connection, or null when none could be resolved
 * @param payload    Parsed request body
 * @param headers    Request headers with lower-case names
 */
public record WebhookParams(UUID tenantId, Connection connection, JsonNode payload, Map<String, String> headers) {
    public WebhookParams {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public String header(String name) {
        return headers.get(name);
    }
}
