package com.syncbridge.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Opaque, provider-defined progress marker for incremental sync.
 *
 * The durable copy lives in {@code connections.metadata.sync.cursor}; a job carries its
 * handoff copy wrapped as {@code {"value": <cursor>}}.
 */
public final class Cursor {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String VALUE_KEY = "value";

    private final JsonNode value;

    private Cursor(JsonNode value) {
        this.value = Objects.requireNonNull(value, "Cursor value cannot be null");
    }

    public static Cursor of(JsonNode value) {
        return new Cursor(value);
    }

    public static Cursor ofString(String value) {
        return new Cursor(JsonNodeFactory.instance.textNode(value));
    }

    public static Cursor ofLong(long value) {
        return new Cursor(JsonNodeFactory.instance.numberNode(value));
    }

    public static Cursor ofInstant(Instant instant) {
        return ofString(instant.toString());
    }

    /**
     * Builds a cursor from a value read out of a JSON column; null stays null.
     */
    public static Cursor fromObject(Object raw) {
        if (raw == null) {
            return null;
        }
        JsonNode node = MAPPER.valueToTree(raw);
        return node == null || node.isNull() ? null : new Cursor(node);
    }

    /**
     * Reads a job's cursor column, unwrapping {@code {"value": …}}.
     */
    public static Cursor fromJobPayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        if (payload.containsKey(VALUE_KEY)) {
            return fromObject(payload.get(VALUE_KEY));
        }
        return fromObject(payload);
    }

    public Map<String, Object> toJobPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(VALUE_KEY, toObject());
        return payload;
    }

    /**
     * Plain Java form (String, Number, Map, List) suitable for a JSON column.
     */
    public Object toObject() {
        return MAPPER.convertValue(value, Object.class);
    }

    public JsonNode value() {
        return value;
    }

    public Optional<String> asText() {
        return value.isValueNode() ? Optional.of(value.asText()) : Optional.empty();
    }

    public Optional<Instant> asInstant() {
        return asText().flatMap(Cursor::parseInstant);
    }

    public Optional<Long> asLong() {
        if (value.isIntegralNumber()) {
            return Optional.of(value.asLong());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * True when both cursors are comparable (timestamps or integers) and this one marks
     * less progress than {@code other}. Opaque tokens are never considered behind.
     */
    public boolean isBehind(Cursor other) {
        if (other == null) {
            return false;
        }
        Optional<Instant> thisInstant = asInstant();
        Optional<Instant> otherInstant = other.asInstant();
        if (thisInstant.isPresent() && otherInstant.isPresent()) {
            return thisInstant.get().isBefore(otherInstant.get());
        }
        Optional<BigInteger> thisNumber = asBigInteger();
        Optional<BigInteger> otherNumber = other.asBigInteger();
        if (thisNumber.isPresent() && otherNumber.isPresent()) {
            return thisNumber.get().compareTo(otherNumber.get()) < 0;
        }
        return false;
    }

    private Optional<BigInteger> asBigInteger() {
        if (value.isIntegralNumber()) {
            return Optional.of(value.bigIntegerValue());
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
                return Optional.of(new BigInteger(text));
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> parseInstant(String text) {
        if (text == null || text.length() < 10 || !text.contains("T")) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cursor other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
