package com.knowledge.extraction.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns raw model output into records by trying an ordered chain of
 * {@link ParsingStrategy parsing strategies}; the first one that produces a
 * result wins.
 *
 * <p>Unparseable output is not an error: {@link #parse(String)} returns
 * {@link Optional#empty()} and the caller treats it as "zero records".</p>
 */
public class ResponseParser {
    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    private final Map<String, ParsingStrategy> strategies;

    public ResponseParser() {
        this(ParsingStrategies.defaults());
    }

    /**
     * @param strategies strategies keyed by name, iterated in map order
     */
    public ResponseParser(Map<String, ParsingStrategy> strategies) {
        Objects.requireNonNull(strategies, "strategies is required");
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one parsing strategy is required");
        }
        this.strategies = new LinkedHashMap<>(strategies);
    }

    public Optional<List<ExtractedRecord>> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (Map.Entry<String, ParsingStrategy> entry : strategies.entrySet()) {
            Optional<List<ExtractedRecord>> records = entry.getValue().parse(raw);
            if (records.isPresent()) {
                log.debug("parse.succeeded strategy={} records={}", entry.getKey(), records.get().size());
                return records;
            }
        }
        log.debug("parse.failed length={} preview='{}'", raw.length(), preview(raw));
        return Optional.empty();
    }

    private static String preview(String raw) {
        String flat = raw.replaceAll("\\s+", " ");
        return flat.length() > 120 ? flat.substring(0, 120) + "..." : flat;
    }
}
