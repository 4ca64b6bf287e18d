package com.knowledge.extraction.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * One JSON object recovered from a model response. Field lookups accept several
 * aliases because models are inconsistent about key names.
 *
 * @param fields the object's top-level fields in document order
 */
public record ExtractedRecord(Map<String, Object> fields) {

    private static final Pattern NUMERIC = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    public ExtractedRecord {
        Objects.requireNonNull(fields, "fields is required");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Returns the first non-blank scalar value among the given keys, trimmed.
     */
    public Optional<String> text(String... keys) {
        for (String key : keys) {
            Object value = fields.get(key);
            if (value == null || value instanceof Map || value instanceof Iterable) {
                continue;
            }
            String s = value.toString().trim();
            if (!s.isEmpty()) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first numeric value among the given keys. Numeric strings are accepted.
     */
    public OptionalDouble number(String... keys) {
        for (String key : keys) {
            Object value = fields.get(key);
            if (value instanceof Number n) {
                return OptionalDouble.of(n.doubleValue());
            }
            if (value instanceof String s && NUMERIC.matcher(s.trim()).matches()) {
                return OptionalDouble.of(Double.parseDouble(s.trim()));
            }
        }
        return OptionalDouble.empty();
    }
}
