package com.syncbridge.api.webhook;

import com.syncbridge.connector.ConnectorRegistry;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Webhook ingest endpoints.
 * POST /webhooks/{provider} is operator-authenticated, POST /webhooks/{provider}/{tenant}
 * is authenticated by the provider's signature.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {

    private static final Map<String, String> ACCEPTED = Map.of("status", "accepted");

    private final WebhookIngestService ingestService;

    public WebhookController(WebhookIngestService ingestService) {
        this.ingestService = ingestService;
    }

    @PostMapping("/{provider}")
    public ResponseEntity<Map<String, String>> operatorWebhook(
            @PathVariable String provider,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) byte[] body) {

        ingestService.ingestAsOperator(provider, body, firstValues(headers));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ACCEPTED);
    }

    @PostMapping("/{provider}/{tenant}")
    public ResponseEntity<Map<String, String>> signedWebhook(
            @PathVariable String provider,
            @PathVariable String tenant,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) byte[] body) {

        ingestService.ingestSigned(provider, tenant, body, firstValues(headers));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ACCEPTED);
    }

    private static Map<String, String> firstValues(HttpHeaders headers) {
        Map<String, String> values = new LinkedHashMap<>();
        headers.forEach((name, list) -> {
            if (list != null && !list.isEmpty()) {
                values.put(name, list.get(0));
            }
        });
        return values;
    }

    // Exception handlers
    @ExceptionHandler(ConnectorRegistry.ProviderNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUnknownProvider(ConnectorRegistry.ProviderNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("WEBHOOK_404", "Unknown provider: " + e.getProvider()));
    }

    @ExceptionHandler(WebhookIngestService.WebhookUnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(WebhookIngestService.WebhookUnauthorizedException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ErrorResponse("WEBHOOK_001", "Webhook authentication failed"));
    }

    @ExceptionHandler(WebhookIngestService.InvalidWebhookException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(WebhookIngestService.InvalidWebhookException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("WEBHOOK_002", e.getMessage()));
    }

    @ExceptionHandler(WebhookIngestService.WebhookRateLimitedException.class)
    public ResponseEntity<ErrorResponse> handleRateLimited(WebhookIngestService.WebhookRateLimitedException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .body(new ErrorResponse("WEBHOOK_003", e.getMessage()));
    }

    @ExceptionHandler(WebhookIngestService.WebhookConnectionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleConnectionNotFound(WebhookIngestService.WebhookConnectionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("WEBHOOK_004", e.getMessage()));
    }

    @ExceptionHandler(WebhookIngestService.WebhookPayloadTooLargeException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(WebhookIngestService.WebhookPayloadTooLargeException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(new ErrorResponse("WEBHOOK_005", e.getMessage()));
    }

    @ExceptionHandler(WebhookIngestService.WebhookPayloadRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejected(WebhookIngestService.WebhookPayloadRejectedException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("WEBHOOK_400", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
