package io.logtabulator.parser;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fields extracted from a single log line by a single parser.
 * <p>
 * A record holds at least one field. Field names are non-empty and single-line; values are restricted to
 * scalars ({@link String}, {@link Boolean}, integral and floating point numbers) or {@code null}, so that
 * they survive the records file round-trip unchanged.
 */
public record ParsedLogRecord(Map<String, Object> fields) {

    public ParsedLogRecord {
        Objects.requireNonNull(fields, "fields must not be null");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Record must have at least one field");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((name, value) -> {
            if (!isValidFieldName(name)) {
                throw new IllegalArgumentException("Field name must be non-empty and free of line breaks: '"
                        + name + "'");
            }
            if (!isScalar(value)) {
                throw new IllegalArgumentException("Field '" + name + "' has a non-scalar value of type "
                        + value.getClass().getName());
            }
            copy.put(name, value);
        });
        fields = Collections.unmodifiableMap(copy);
    }

    public static ParsedLogRecord of(Map<String, ?> fields) {
        return new ParsedLogRecord(new LinkedHashMap<>(fields));
    }

    public Set<String> keys() {
        return fields.keySet();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public static boolean isValidFieldName(String name) {
        return name != null && !name.isEmpty() && name.indexOf('\n') < 0 && name.indexOf('\r') < 0;
    }

    public static boolean isScalar(Object value) {
        return value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof Double
                || value instanceof Float
                || value instanceof BigInteger
                || value instanceof BigDecimal;
    }
}
