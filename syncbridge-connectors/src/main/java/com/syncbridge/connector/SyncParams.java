package com.syncbridge.connector;

import com.syncbridge.core.domain.Connection;

/**
 * @param connection  Connection to sync
 * @param accessToken Decrypted access token
 * @param cursor      Progress marker to resume from, or null for a first run
 */
public record SyncParams(Connection connection, String accessToken, Cursor cursor) {}
