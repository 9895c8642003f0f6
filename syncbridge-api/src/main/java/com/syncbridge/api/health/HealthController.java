package com.syncbridge.api.health;

import com.syncbridge.connector.ConnectorRegistry;
import com.syncbridge.connector.ProviderMetadata;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Health check endpoints.
 * - Basic health check for load balancers
 * - Info endpoint listing registered providers
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final ConnectorRegistry registry;

    public HealthController(ConnectorRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "timestamp", Instant.now().toString()
        ));
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        return ResponseEntity.ok(Map.of(
            "name", "SyncBridge Sync Engine",
            "version", "1.0.0-SNAPSHOT",
            "providers", registry.listMetadata().stream().map(ProviderMetadata::name).toList(),
            "timestamp", Instant.now().toString()
        ));
    }
}
