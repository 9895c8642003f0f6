package com.syncbridge.connector;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure raised by a connector operation.
 *
 * The {@link Kind} drives the executor's retry decision: UNAUTHORIZED triggers one
 * refresh-and-retry, RATE_LIMITED and TRANSIENT are retried with backoff, PERMANENT is terminal.
 */
public class SyncException extends RuntimeException {

    public enum Kind {
        UNAUTHORIZED,
        RATE_LIMITED,
        TRANSIENT,
        PERMANENT;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;
    private final Long retryAfterSeconds;
    private final Map<String, Object> details;

    public SyncException(Kind kind, String message, Long retryAfterSeconds,
                         Map<String, Object> details, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("Kind cannot be null");
        }
        this.kind = kind;
        this.retryAfterSeconds = retryAfterSeconds;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static SyncException unauthorized(String message) {
        return new SyncException(Kind.UNAUTHORIZED, message, null, null, null);
    }

    public static SyncException rateLimited(Long retryAfterSeconds, String message) {
        return new SyncException(Kind.RATE_LIMITED, message, retryAfterSeconds, null, null);
    }

    public static SyncException transientFailure(String message) {
        return new SyncException(Kind.TRANSIENT, message, null, null, null);
    }

    public static SyncException transientFailure(String message, Throwable cause) {
        return new SyncException(Kind.TRANSIENT, message, null, null, cause);
    }

    public static SyncException permanent(String message) {
        return new SyncException(Kind.PERMANENT, message, null, null, null);
    }

    public static SyncException permanent(String message, Map<String, Object> details) {
        return new SyncException(Kind.PERMANENT, message, null, details, null);
    }

    /**
     * Maps a non-success HTTP status onto the taxonomy.
     * 401 is UNAUTHORIZED, 429 is RATE_LIMITED, other 4xx PERMANENT, 5xx and anything else TRANSIENT.
     */
    public static SyncException fromHttpStatus(int status, Long retryAfterSeconds, String message) {
        Map<String, Object> details = Map.of("status", status);
        if (status == 401) {
            return new SyncException(Kind.UNAUTHORIZED, message, null, details, null);
        }
        if (status == 429) {
            return new SyncException(Kind.RATE_LIMITED, message, retryAfterSeconds, details, null);
        }
        if (status >= 400 && status < 500) {
            return new SyncException(Kind.PERMANENT, message, null, details, null);
        }
        return new SyncException(Kind.TRANSIENT, message, null, details, null);
    }

    /**
     * Extracts the SyncException behind a failed future. Anything else is treated as transient.
     */
    public static SyncException unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof SyncException syncException) {
            return syncException;
        }
        String message = current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
        return transientFailure(message, current);
    }

    public boolean isRetryable() {
        return kind != Kind.PERMANENT;
    }

    public boolean isRateLimited() {
        return kind == Kind.RATE_LIMITED;
    }

    /**
     * Structured form persisted on job rows: {@code {type, message, retry_after_secs?, details?}}.
     */
    public Map<String, Object> toErrorMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", kind.wireName());
        map.put("message", getMessage());
        if (retryAfterSeconds != null) {
            map.put("retry_after_secs", retryAfterSeconds);
        }
        if (!details.isEmpty()) {
            map.put("details", details);
        }
        return map;
    }

    public Kind getKind() { return kind; }
    public Long getRetryAfterSeconds() { return retryAfterSeconds; }
    public Map<String, Object> getDetails() { return details; }
}
