package com.syncbridge.connector;

import java.util.UUID;

public record AuthorizeParams(UUID tenantId, String redirectUri, String state) {}
