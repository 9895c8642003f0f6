package com.syncbridge.api.ratelimit;

import com.syncbridge.api.config.SyncBridgeProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Retry delay computation for failed sync jobs.
 *
 * <pre>
 * exp_backoff = min(base * 2^attempts, max)
 * effective   = max(hint, exp_backoff)
 * delay       = effective + uniform(0, jitter_factor * effective)
 * </pre>
 *
 * A provider supplied hint is never undercut by the exponential curve.
 */
@Component
public class RateLimitPolicy {

    private static final int MAX_EXPONENT = 30;

    private final Settings defaults;
    private final Map<String, SyncBridgeProperties.RateLimitOverride> overrides;
    private final RandomGenerator random;

    public RateLimitPolicy(SyncBridgeProperties properties, RandomGenerator random) {
        SyncBridgeProperties.RateLimit rateLimit = properties.getRateLimit();
        this.defaults = new Settings(rateLimit.getBaseSeconds(), rateLimit.getMaxSeconds(), rateLimit.getJitterFactor());
        this.overrides = Map.copyOf(rateLimit.getProviders());
        this.random = random;
    }

    /**
     * Delay before the next attempt.
     *
     * @param attempts    Attempts made so far
     * @param provider    Provider name used to pick overrides
     * @param hintSeconds Provider supplied retry-after, or null
     */
    public Duration delay(int attempts, String provider, Long hintSeconds) {
        Settings settings = settingsFor(provider);
        double effective = effectiveSeconds(attempts, settings, hintSeconds);
        double jitter = settings.jitterFactor() > 0 && effective > 0
                ? random.nextDouble(0, settings.jitterFactor() * effective)
                : 0;
        return Duration.ofMillis(Math.round((effective + jitter) * 1000));
    }

    public Settings settingsFor(String provider) {
        SyncBridgeProperties.RateLimitOverride override = provider != null ? overrides.get(provider) : null;
        if (override == null) {
            return defaults;
        }
        return new Settings(
                override.getBaseSeconds() != null ? override.getBaseSeconds() : defaults.baseSeconds(),
                override.getMaxSeconds() != null ? override.getMaxSeconds() : defaults.maxSeconds(),
                override.getJitterFactor() != null ? override.getJitterFactor() : defaults.jitterFactor());
    }

    public static double exponentialSeconds(int attempts, Settings settings) {
        int exponent = Math.min(Math.max(attempts, 0), MAX_EXPONENT);
        return Math.min(settings.baseSeconds() * Math.pow(2, exponent), settings.maxSeconds());
    }

    public static double effectiveSeconds(int attempts, Settings settings, Long hintSeconds) {
        double hint = hintSeconds != null && hintSeconds > 0 ? hintSeconds : 0;
        return Math.max(hint, exponentialSeconds(attempts, settings));
    }

    /**
     * Resolved backoff parameters for one provider.
     */
    public record Settings(double baseSeconds, double maxSeconds, double jitterFactor) {
        public Settings {
            if (baseSeconds < 0 || maxSeconds < 0 || jitterFactor < 0) {
                throw new IllegalArgumentException("Backoff settings cannot be negative");
            }
        }
    }
}
