package com.syncbridge.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token buckets for the public webhook path, one per (provider, tenant).
 */
@Component
public class WebhookRateLimiter {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final long perMinute;

    public WebhookRateLimiter(SyncBridgeProperties properties) {
        this.perMinute = Math.max(1, properties.getWebhooks().getRateLimitPerMinute());
    }

    public ConsumptionProbe tryConsume(String provider, UUID tenantId) {
        return resolveBucket(provider, tenantId).tryConsumeAndReturnRemaining(1);
    }

    public Bucket resolveBucket(String provider, UUID tenantId) {
        return buckets.computeIfAbsent(provider + ":" + tenantId, this::createBucket);
    }

    private Bucket createBucket(String key) {
        Bandwidth limit = Bandwidth.classic(perMinute, Refill.greedy(perMinute, Duration.ofMinutes(1)));
        return Bucket.builder().addLimit(limit).build();
    }

    /**
     * Clear the bucket for a provider and tenant (for testing).
     */
    public void clearBucket(String provider, UUID tenantId) {
        buckets.remove(provider + ":" + tenantId);
    }
}
