package com.knowledge.extraction.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The built-in parsing strategies, in the order {@link ResponseParser} tries them.
 */
public final class ParsingStrategies {
    private static final Logger log = LoggerFactory.getLogger(ParsingStrategies.class);

    public static final String DIRECT = "direct";
    public static final String CODE_FENCE = "code-fence";
    public static final String REPAIR = "repair";
    public static final String RECORD_REGEX = "record-regex";

    private static final ObjectMapper STRICT = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private static final ObjectMapper LENIENT = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();
    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};

    private static final Pattern FENCE = Pattern.compile("```[a-zA-Z]*");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([\\]}])");
    private static final Pattern MISSING_COMMA = Pattern.compile("}\\s*\\{");
    private static final Pattern FLAT_OBJECT = Pattern.compile("\\{[^{}]*}");

    private ParsingStrategies() {
        // factory
    }

    /**
     * Returns the default strategy chain, keyed by strategy name in evaluation order.
     */
    public static Map<String, ParsingStrategy> defaults() {
        Map<String, ParsingStrategy> strategies = new LinkedHashMap<>();
        strategies.put(DIRECT, ParsingStrategies::direct);
        strategies.put(CODE_FENCE, ParsingStrategies::codeFence);
        strategies.put(REPAIR, ParsingStrategies::repair);
        strategies.put(RECORD_REGEX, ParsingStrategies::recordRegex);
        return strategies;
    }

    /**
     * Parses the trimmed text as a JSON array of objects, or as a single object.
     */
    public static Optional<List<ExtractedRecord>> direct(String raw) {
        return readRecords(STRICT, raw.trim());
    }

    /**
     * Strips markdown fences and any prose around the outermost array, then parses directly.
     */
    public static Optional<List<ExtractedRecord>> codeFence(String raw) {
        String candidate = outermostJson(FENCE.matcher(raw).replaceAll(""));
        return candidate == null ? Optional.empty() : readRecords(STRICT, candidate);
    }

    /**
     * Fixes the syntax errors small models commonly make and parses leniently.
     */
    public static Optional<List<ExtractedRecord>> repair(String raw) {
        String candidate = outermostJson(FENCE.matcher(raw).replaceAll(""));
        if (candidate == null) {
            return Optional.empty();
        }
        String repaired = candidate
                .replace('“', '"').replace('”', '"')
                .replace('‘', '\'').replace('’', '\'');
        repaired = TRAILING_COMMA.matcher(repaired).replaceAll("$1");
        repaired = MISSING_COMMA.matcher(repaired).replaceAll("},{");
        if (repaired.startsWith("{") && MISSING_COMMA.matcher(candidate).find()) {
            repaired = "[" + repaired + "]";
        }
        return readRecords(LENIENT, repaired);
    }

    /**
     * Extracts every flat object independently, discarding the ones that do not parse.
     */
    public static Optional<List<ExtractedRecord>> recordRegex(String raw) {
        List<ExtractedRecord> records = new ArrayList<>();
        Matcher matcher = FLAT_OBJECT.matcher(raw);
        while (matcher.find()) {
            try {
                JsonNode node = LENIENT.readTree(matcher.group());
                if (node != null && node.isObject()) {
                    records.add(toRecord(node));
                }
            } catch (JsonProcessingException e) {
                log.trace("parse.fragment.skipped error={}", e.getOriginalMessage());
            }
        }
        return records.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(records));
    }

    private static Optional<List<ExtractedRecord>> readRecords(ObjectMapper mapper, String json) {
        if (json.isEmpty()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null) {
            return Optional.empty();
        }
        if (root.isObject()) {
            return Optional.of(List.of(toRecord(root)));
        }
        if (!root.isArray()) {
            return Optional.empty();
        }
        List<ExtractedRecord> records = new ArrayList<>();
        for (JsonNode element : root) {
            if (element.isObject()) {
                records.add(toRecord(element));
            }
        }
        return Optional.of(List.copyOf(records));
    }

    private static ExtractedRecord toRecord(JsonNode node) {
        return new ExtractedRecord(STRICT.convertValue(node, FIELDS));
    }

    /**
     * Returns the text between the first '[' and the last ']', falling back to the
     * outermost braces when there is no array.
     */
    private static String outermostJson(String text) {
        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1).trim();
        }
        start = text.indexOf('{');
        end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1).trim();
        }
        return null;
    }
}
