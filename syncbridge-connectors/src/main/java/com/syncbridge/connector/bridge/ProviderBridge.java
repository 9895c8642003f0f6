package com.syncbridge.connector.bridge;

import com.syncbridge.connector.SyncException;

/**
 * Seam between connectors and the network. Connectors never talk to an HTTP client directly,
 * which lets tests script provider responses.
 */
public interface ProviderBridge {

    /**
     * Sends the request and returns whatever status the provider answered with.
     *
     * @throws SyncException TRANSIENT when the request could not be completed
     */
    BridgeResponse send(BridgeRequest request);
}
