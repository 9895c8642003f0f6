package com.syncbridge.connector;

import com.syncbridge.core.domain.Connection;

/**
 * @param connection   Connection being refreshed
 * @param refreshToken Decrypted refresh token
 */
public record RefreshParams(Connection connection, String refreshToken) {}
