package com.syncbridge.api.connect;

import com.syncbridge.api.config.SyncBridgeProperties;
import com.syncbridge.core.domain.OAuthState;
import com.syncbridge.core.repository.OAuthStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

/**
 * Single-use OAuth state tokens bound to a tenant and provider.
 */
@Service
public class OAuthStateService {

    private static final Logger log = LoggerFactory.getLogger(OAuthStateService.class);
    private static final int STATE_BYTES = 32;
    private static final long CLEANUP_INTERVAL_MS = 3_600_000;

    private final OAuthStateRepository stateRepository;
    private final Duration ttl;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public OAuthStateService(OAuthStateRepository stateRepository, SyncBridgeProperties properties, Clock clock) {
        this.stateRepository = stateRepository;
        this.ttl = properties.getOauth().getStateTtl();
        this.clock = clock;
    }

    /**
     * Creates and stores a fresh URL-safe state token.
     */
    @Transactional
    public OAuthState create(UUID tenantId, String provider, String redirectUri) {
        byte[] raw = new byte[STATE_BYTES];
        secureRandom.nextBytes(raw);
        String state = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
        Instant expiresAt = clock.instant().plus(ttl);
        return stateRepository.save(OAuthState.create(tenantId, provider, state, redirectUri, expiresAt));
    }

    /**
     * Consumes a state token. A state is deleted on first use, whether or not it was valid.
     *
     * @throws InvalidStateException if unknown, expired, or issued for another provider
     */
    @Transactional(noRollbackFor = InvalidStateException.class)
    public OAuthState consume(String state, String provider) {
        if (state == null || state.isBlank()) {
            throw new InvalidStateException("Missing state");
        }
        OAuthState stored = stateRepository.findByState(state)
                .orElseThrow(() -> new InvalidStateException("Unknown or already used state"));
        stateRepository.delete(stored);
        if (!stored.getProviderSlug().equals(provider)) {
            throw new InvalidStateException("State was issued for another provider");
        }
        if (stored.isExpired(clock.instant())) {
            throw new InvalidStateException("State expired");
        }
        return stored;
    }

    @Scheduled(fixedRate = CLEANUP_INTERVAL_MS)
    @Transactional
    public void purgeExpired() {
        int removed = stateRepository.deleteExpired(clock.instant());
        if (removed > 0) {
            log.info("Purged {} expired OAuth states", removed);
        }
    }

    public static class InvalidStateException extends RuntimeException {
        public InvalidStateException(String message) {
            super(message);
        }
    }
}
