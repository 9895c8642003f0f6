package com.syncbridge.api.security;

import com.syncbridge.api.config.SyncBridgeProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Checks operator bearer tokens for the internal webhook and connect routes.
 */
@Component
public class OperatorAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final List<byte[]> tokens;

    public OperatorAuthenticator(SyncBridgeProperties properties) {
        this.tokens = properties.getWebhooks().getOperatorTokens().stream()
                .filter(token -> token != null && !token.isBlank())
                .map(token -> token.trim().getBytes(StandardCharsets.UTF_8))
                .toList();
    }

    /**
     * @param authorizationHeader Raw {@code Authorization} header, may be null
     * @return true when it carries one of the configured operator tokens
     */
    public boolean isOperator(String authorizationHeader) {
        String presented = bearerToken(authorizationHeader);
        if (presented == null || tokens.isEmpty()) {
            return false;
        }
        byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
        boolean matched = false;
        for (byte[] token : tokens) {
            // no early exit
            matched |= MessageDigest.isEqual(token, candidate);
        }
        return matched;
    }

    public static String bearerToken(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.length() <= BEARER_PREFIX.length()
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
