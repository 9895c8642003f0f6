package com.syncbridge.api.connect;

import com.syncbridge.api.config.SyncBridgeProperties;
import com.syncbridge.api.security.TokenEncryptionService;
import com.syncbridge.connector.AuthorizeParams;
import com.syncbridge.connector.Connector;
import com.syncbridge.connector.ConnectorRegistry;
import com.syncbridge.connector.Credentials;
import com.syncbridge.connector.ExchangeTokenParams;
import com.syncbridge.connector.SyncException;
import com.syncbridge.core.domain.Connection;
import com.syncbridge.core.domain.Connection.ConnectionStatus;
import com.syncbridge.core.domain.OAuthState;
import com.syncbridge.core.repository.ConnectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * OAuth connect flow: authorization URL, code exchange and connection upsert.
 */
@Service
public class ConnectionService {

    private static final Logger log = LoggerFactory.getLogger(ConnectionService.class);
    private static final long EXCHANGE_TIMEOUT_SECONDS = 60;

    private final ConnectorRegistry registry;
    private final OAuthStateService stateService;
    private final ConnectionRepository connectionRepository;
    private final TokenEncryptionService encryption;
    private final String redirectBaseUrl;

    public ConnectionService(ConnectorRegistry registry,
                             OAuthStateService stateService,
                             ConnectionRepository connectionRepository,
                             TokenEncryptionService encryption,
                             SyncBridgeProperties properties) {
        this.registry = registry;
        this.stateService = stateService;
        this.connectionRepository = connectionRepository;
        this.encryption = encryption;
        String base = properties.getOauth().getRedirectBaseUrl();
        this.redirectBaseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    public URI startAuthorization(UUID tenantId, String provider) {
        Connector connector = registry.get(provider);
        String redirectUri = redirectUri(provider);
        OAuthState state = stateService.create(tenantId, provider, redirectUri);
        return connector.authorize(new AuthorizeParams(tenantId, redirectUri, state.getState()));
    }

    /**
     * Exchanges the authorization code and stores the connection, updating it in place when
     * the tenant already connected the same provider account. The state is consumed in its
     * own transaction first, so it cannot be replayed even when the exchange fails.
     */
    public Connection completeAuthorization(String provider, String code, String state) {
        Connector connector = registry.get(provider);
        OAuthState consumed = stateService.consume(state, provider);
        if (code == null || code.isBlank()) {
            throw new MissingCodeException();
        }

        Credentials credentials;
        try {
            credentials = connector.exchangeToken(new ExchangeTokenParams(code, consumed.getRedirectUri(), consumed.getTenantId()))
                    .orTimeout(EXCHANGE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .join();
        } catch (CompletionException e) {
            SyncException error = SyncException.unwrap(e);
            log.warn("Token exchange for {} failed ({}): {}", provider, error.getKind().wireName(), error.getMessage());
            throw new AuthorizationFailedException("Token exchange failed: " + error.getMessage(), error);
        }

        UUID tenantId = consumed.getTenantId();
        String externalId = credentials.externalId() != null
                ? credentials.externalId()
                : provider + "-" + UUID.randomUUID();
        Connection connection = connectionRepository
                .findByTenantIdAndProviderSlugAndExternalId(tenantId, provider, externalId)
                .orElseGet(() -> Connection.create(tenantId, provider, externalId));

        connection.setAccessTokenCiphertext(encryption.encrypt(credentials.accessToken(), tenantId, provider));
        if (!credentials.reusesPreviousRefreshToken()) {
            connection.setRefreshTokenCiphertext(encryption.encrypt(credentials.refreshToken(), tenantId, provider));
        }
        connection.setExpiresAt(credentials.expiresAt());
        connection.setScopes(credentials.scopes());
        if (credentials.displayName() != null) {
            connection.setDisplayName(credentials.displayName());
        }
        Map<String, Object> metadata = connection.getMetadata() != null
                ? new LinkedHashMap<>(connection.getMetadata())
                : new LinkedHashMap<>();
        metadata.putAll(credentials.metadata());
        connection.setMetadata(metadata);
        connection.setStatus(ConnectionStatus.ACTIVE);
        connection.touch();

        Connection saved = connectionRepository.save(connection);
        log.info("Connected {} account {} for tenant {} as connection {}", provider, externalId, tenantId, saved.getId());
        return saved;
    }

    String redirectUri(String provider) {
        return redirectBaseUrl + "/connect/" + provider + "/callback";
    }

    public static class AuthorizationFailedException extends RuntimeException {
        public AuthorizationFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class MissingCodeException extends RuntimeException {
        public MissingCodeException() {
            super("Missing authorization code");
        }
    }
}
