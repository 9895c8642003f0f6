package com.syncbridge.api.token;

/**
 * Outcome of one token-refresh tick.
 *
 * @param attempted         Connections picked up for refresh
 * @param refreshed         Connections whose credentials were replaced
 * @param failed            Refreshes that failed for any reason
 * @param permanentFailures Failed refreshes that moved the connection to ERROR
 */
public record TokenRefreshStats(int attempted, int refreshed, int failed, int permanentFailures) {

    public static TokenRefreshStats empty() {
        return new TokenRefreshStats(0, 0, 0, 0);
    }
}
