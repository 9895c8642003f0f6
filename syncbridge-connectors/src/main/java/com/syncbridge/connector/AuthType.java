package com.syncbridge.connector;

/**
 * How a provider authenticates connections.
 */
public enum AuthType {
    OAUTH2,
    API_KEY,
    BASIC,
    BEARER,
    CUSTOM
}
