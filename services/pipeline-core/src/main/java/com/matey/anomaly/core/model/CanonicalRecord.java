package com.matey.anomaly.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized event flowing from the feed to the detection API.
 *
 * <p>A flat, insertion-ordered mapping of field name to scalar value (string, number or
 * boolean). Every record carries an {@code id}, an ISO-8601 {@code timestamp}, a
 * {@code symbol} and a non-blank {@code message}; any other fields (price, quantity,
 * side, volume, ...) are passed through untouched.</p>
 *
 * <p>Serialized as a plain JSON object, so one record is one NDJSON line on the pipe
 * between the bridge and the detector.</p>
 */
public final class CanonicalRecord {

    public static final String ID = "id";
    public static final String TIMESTAMP = "timestamp";
    public static final String SYMBOL = "symbol";
    public static final String MESSAGE = "message";

    private final Map<String, Object> fields;

    private CanonicalRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Validates and copies the given fields into a record. Null values are dropped.
     *
     * @throws IllegalArgumentException if a required field is missing or blank, the
     *                                  timestamp is not ISO-8601, or a value is not a scalar
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CanonicalRecord of(Map<String, Object> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("Record fields must not be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((name, value) -> {
            if (value == null) {
                return;
            }
            if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new IllegalArgumentException("Field '" + name + "' is not a scalar: " + value.getClass().getSimpleName());
            }
            copy.put(name, value);
        });

        requireText(copy, ID);
        requireText(copy, SYMBOL);
        requireText(copy, MESSAGE);
        parseTimestamp(requireText(copy, TIMESTAMP));

        return new CanonicalRecord(copy);
    }

    private static String requireText(Map<String, Object> fields, String name) {
        Object value = fields.get(name);
        String text = value == null ? null : String.valueOf(value);
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Missing required field '" + name + "'");
        }
        return text;
    }

    private static Instant parseTimestamp(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException ignored) {
                throw new IllegalArgumentException("Unparseable timestamp '" + text + "'", e);
            }
        }
    }

    public String getId() {
        return String.valueOf(fields.get(ID));
    }

    public Instant getTimestamp() {
        return parseTimestamp(String.valueOf(fields.get(TIMESTAMP)));
    }

    public String getSymbol() {
        return String.valueOf(fields.get(SYMBOL));
    }

    public String getMessage() {
        return String.valueOf(fields.get(MESSAGE));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalRecord)) return false;
        return fields.equals(((CanonicalRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "CanonicalRecord" + fields;
    }
}
