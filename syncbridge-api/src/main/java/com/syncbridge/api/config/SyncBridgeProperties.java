package com.syncbridge.api.config;

import com.syncbridge.api.webhook.SignatureScheme;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine configuration, bound once from {@code syncbridge.*} and injected into each component.
 */
@ConfigurationProperties(prefix = "syncbridge")
public class SyncBridgeProperties {

    private final Scheduler scheduler = new Scheduler();
    private final Executor executor = new Executor();
    private final RateLimit rateLimit = new RateLimit();
    private final TokenRefresh tokenRefresh = new TokenRefresh();
    private final Webhooks webhooks = new Webhooks();
    private final Encryption encryption = new Encryption();
    private final OAuth oauth = new OAuth();
    private Map<String, Provider> providers = new HashMap<>();

    public Scheduler getScheduler() { return scheduler; }
    public Executor getExecutor() { return executor; }
    public RateLimit getRateLimit() { return rateLimit; }
    public TokenRefresh getTokenRefresh() { return tokenRefresh; }
    public Webhooks getWebhooks() { return webhooks; }
    public Encryption getEncryption() { return encryption; }
    public OAuth getOauth() { return oauth; }
    public Map<String, Provider> getProviders() { return providers; }
    public void setProviders(Map<String, Provider> providers) { this.providers = providers; }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(60);
        private long defaultIntervalSeconds = 900;
        private long minIntervalSeconds = 60;
        private long maxIntervalSeconds = 86_400;
        private double jitterFraction = 0.2;
        private int batchSize = 128;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getTickInterval() { return tickInterval; }
        public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
        public long getDefaultIntervalSeconds() { return defaultIntervalSeconds; }
        public void setDefaultIntervalSeconds(long defaultIntervalSeconds) { this.defaultIntervalSeconds = defaultIntervalSeconds; }
        public long getMinIntervalSeconds() { return minIntervalSeconds; }
        public void setMinIntervalSeconds(long minIntervalSeconds) { this.minIntervalSeconds = minIntervalSeconds; }
        public long getMaxIntervalSeconds() { return maxIntervalSeconds; }
        public void setMaxIntervalSeconds(long maxIntervalSeconds) { this.maxIntervalSeconds = maxIntervalSeconds; }
        public double getJitterFraction() { return jitterFraction; }
        public void setJitterFraction(double jitterFraction) { this.jitterFraction = jitterFraction; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    public static class Executor {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(5);
        private int concurrency = 10;
        private int claimBatch = 50;
        private long maxRunSeconds = 300;
        private int maxAttempts = 10;
        private Duration staleAfter = Duration.ofMinutes(15);
        private Duration shutdownGrace = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getTickInterval() { return tickInterval; }
        public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public int getClaimBatch() { return claimBatch; }
        public void setClaimBatch(int claimBatch) { this.claimBatch = claimBatch; }
        public long getMaxRunSeconds() { return maxRunSeconds; }
        public void setMaxRunSeconds(long maxRunSeconds) { this.maxRunSeconds = maxRunSeconds; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getStaleAfter() { return staleAfter; }
        public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }
        public Duration getShutdownGrace() { return shutdownGrace; }
        public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
    }

    public static class RateLimit {
        private double baseSeconds = 5;
        private double maxSeconds = 900;
        private double jitterFactor = 0.1;
        private Map<String, RateLimitOverride> providers = new HashMap<>();

        public double getBaseSeconds() { return baseSeconds; }
        public void setBaseSeconds(double baseSeconds) { this.baseSeconds = baseSeconds; }
        public double getMaxSeconds() { return maxSeconds; }
        public void setMaxSeconds(double maxSeconds) { this.maxSeconds = maxSeconds; }
        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
        public Map<String, RateLimitOverride> getProviders() { return providers; }
        public void setProviders(Map<String, RateLimitOverride> providers) { this.providers = providers; }
    }

    /**
     * Per-provider backoff override. Unset fields fall back to the global values.
     */
    public static class RateLimitOverride {
        private Double baseSeconds;
        private Double maxSeconds;
        private Double jitterFactor;

        public Double getBaseSeconds() { return baseSeconds; }
        public void setBaseSeconds(Double baseSeconds) { this.baseSeconds = baseSeconds; }
        public Double getMaxSeconds() { return maxSeconds; }
        public void setMaxSeconds(Double maxSeconds) { this.maxSeconds = maxSeconds; }
        public Double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(Double jitterFactor) { this.jitterFactor = jitterFactor; }
    }

    public static class TokenRefresh {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(3600);
        private Duration leadTime = Duration.ofSeconds(600);
        private int concurrency = 4;
        private double jitterFraction = 0.1;
        private Duration shutdownGrace = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getTickInterval() { return tickInterval; }
        public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
        public Duration getLeadTime() { return leadTime; }
        public void setLeadTime(Duration leadTime) { this.leadTime = leadTime; }
        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public double getJitterFraction() { return jitterFraction; }
        public void setJitterFraction(double jitterFraction) { this.jitterFraction = jitterFraction; }
        public Duration getShutdownGrace() { return shutdownGrace; }
        public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
    }

    public static class Webhooks {
        private List<String> operatorTokens = new ArrayList<>();
        private Map<String, String> secrets = new HashMap<>();
        private Map<String, SignatureScheme> signatureSchemes = new HashMap<>();
        private Duration signatureTolerance = Duration.ofSeconds(300);
        private long rateLimitPerMinute = 300;
        private ConnectionResolution connectionResolution = ConnectionResolution.SINGLE_ACTIVE;
        private int maxBodyBytes = 1024 * 1024;

        public List<String> getOperatorTokens() { return operatorTokens; }
        public void setOperatorTokens(List<String> operatorTokens) { this.operatorTokens = operatorTokens; }
        public Map<String, String> getSecrets() { return secrets; }
        public void setSecrets(Map<String, String> secrets) { this.secrets = secrets; }
        public Map<String, SignatureScheme> getSignatureSchemes() { return signatureSchemes; }
        public void setSignatureSchemes(Map<String, SignatureScheme> signatureSchemes) { this.signatureSchemes = signatureSchemes; }
        public Duration getSignatureTolerance() { return signatureTolerance; }
        public void setSignatureTolerance(Duration signatureTolerance) { this.signatureTolerance = signatureTolerance; }
        public long getRateLimitPerMinute() { return rateLimitPerMinute; }
        public void setRateLimitPerMinute(long rateLimitPerMinute) { this.rateLimitPerMinute = rateLimitPerMinute; }
        public ConnectionResolution getConnectionResolution() { return connectionResolution; }
        public void setConnectionResolution(ConnectionResolution connectionResolution) { this.connectionResolution = connectionResolution; }
        public int getMaxBodyBytes() { return maxBodyBytes; }
        public void setMaxBodyBytes(int maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; }

        public SignatureScheme schemeFor(String provider) {
            SignatureScheme configured = signatureSchemes.get(provider);
            return configured != null ? configured : SignatureScheme.defaultFor(provider);
        }

        public String secretFor(String provider) {
            String secret = secrets.get(provider);
            return secret != null && !secret.isBlank() ? secret : null;
        }
    }

    /**
     * How a webhook without an {@code X-Connection-Id} header is matched to a connection.
     */
    public enum ConnectionResolution {
        /** Only the explicit header is honoured. */
        REQUIRE_HEADER,
        /** Resolve only when the tenant has exactly one active connection for the provider. */
        SINGLE_ACTIVE,
        /** Oldest active connection for the tenant and provider. */
        PRIMARY
    }

    public static class Encryption {
        private String key;

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }
    }

    public static class OAuth {
        private Duration stateTtl = Duration.ofMinutes(10);
        private String redirectBaseUrl = "http://localhost:8080";

        public Duration getStateTtl() { return stateTtl; }
        public void setStateTtl(Duration stateTtl) { this.stateTtl = stateTtl; }
        public String getRedirectBaseUrl() { return redirectBaseUrl; }
        public void setRedirectBaseUrl(String redirectBaseUrl) { this.redirectBaseUrl = redirectBaseUrl; }
    }

    public static class Provider {
        private String clientId;
        private String clientSecret;
        private String authBaseUrl;
        private String apiBaseUrl;
        private Map<String, String> options = new HashMap<>();

        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }
        public String getClientSecret() { return clientSecret; }
        public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
        public String getAuthBaseUrl() { return authBaseUrl; }
        public void setAuthBaseUrl(String authBaseUrl) { this.authBaseUrl = authBaseUrl; }
        public String getApiBaseUrl() { return apiBaseUrl; }
        public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }
        public Map<String, String> getOptions() { return options; }
        public void setOptions(Map<String, String> options) { this.options = options; }
    }
}
