package com.syncbridge.connector;

import java.util.UUID;

public record ExchangeTokenParams(String code, String redirectUri, UUID tenantId) {}
