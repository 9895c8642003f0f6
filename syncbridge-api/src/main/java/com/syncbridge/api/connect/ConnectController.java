package com.syncbridge.api.connect;

import com.syncbridge.api.security.OperatorAuthenticator;
import com.syncbridge.connector.ConnectorRegistry;
import com.syncbridge.core.domain.Connection;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * OAuth connect endpoints.
 * Starting a flow needs an operator token; the callback is authenticated by its single-use state.
 */
@RestController
@RequestMapping("/connect")
public class ConnectController {

    private final ConnectionService connectionService;
    private final OperatorAuthenticator operatorAuthenticator;

    public ConnectController(ConnectionService connectionService, OperatorAuthenticator operatorAuthenticator) {
        this.connectionService = connectionService;
        this.operatorAuthenticator = operatorAuthenticator;
    }

    /**
     * Start an authorization flow.
     * POST /connect/{provider}
     */
    @PostMapping("/{provider}")
    public ResponseEntity<Map<String, String>> start(
            @PathVariable String provider,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = "X-Tenant-Id", required = false) String tenantHeader) {

        if (!operatorAuthenticator.isOperator(authorization)) {
            throw new OperatorRequiredException();
        }
        UUID tenantId = parseTenant(tenantHeader);
        URI authorizeUrl = connectionService.startAuthorization(tenantId, provider);
        return ResponseEntity.ok(Map.of("authorize_url", authorizeUrl.toString()));
    }

    /**
     * Provider redirect target.
     * GET /connect/{provider}/callback?code=...&state=...
     */
    @GetMapping("/{provider}/callback")
    public ResponseEntity<ConnectionResponse> callback(
            @PathVariable String provider,
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String state) {

        Connection connection = connectionService.completeAuthorization(provider, code, state);
        return ResponseEntity.status(HttpStatus.CREATED).body(new ConnectionResponse(
                connection.getId(),
                connection.getProviderSlug(),
                connection.getExternalId(),
                connection.getStatus().name().toLowerCase(Locale.ROOT)));
    }

    private static UUID parseTenant(String tenantHeader) {
        try {
            return UUID.fromString(tenantHeader != null ? tenantHeader.trim() : "");
        } catch (IllegalArgumentException e) {
            throw new InvalidTenantException();
        }
    }

    public record ConnectionResponse(UUID connectionId, String provider, String externalId, String status) {}

    // Exception handlers
    @ExceptionHandler(ConnectorRegistry.ProviderNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUnknownProvider(ConnectorRegistry.ProviderNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("CONNECT_404", "Unknown provider: " + e.getProvider()));
    }

    @ExceptionHandler(OperatorRequiredException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(OperatorRequiredException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ErrorResponse("CONNECT_001", e.getMessage()));
    }

    @ExceptionHandler(OAuthStateService.InvalidStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(OAuthStateService.InvalidStateException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("CONNECT_002", e.getMessage()));
    }

    @ExceptionHandler(ConnectionService.AuthorizationFailedException.class)
    public ResponseEntity<ErrorResponse> handleExchangeFailed(ConnectionService.AuthorizationFailedException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("CONNECT_003", e.getMessage()));
    }

    @ExceptionHandler(ConnectionService.MissingCodeException.class)
    public ResponseEntity<ErrorResponse> handleMissingCode(ConnectionService.MissingCodeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("CONNECT_005", e.getMessage()));
    }

    @ExceptionHandler(InvalidTenantException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTenant(InvalidTenantException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("CONNECT_004", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}

    static class OperatorRequiredException extends RuntimeException {
        OperatorRequiredException() {
            super("Operator token required");
        }
    }

    static class InvalidTenantException extends RuntimeException {
        InvalidTenantException() {
            super("X-Tenant-Id header must be a UUID");
        }
    }
}
