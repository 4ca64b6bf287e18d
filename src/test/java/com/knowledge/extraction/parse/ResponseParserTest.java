package com.knowledge.extraction.parse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResponseParser Tests")
class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser();

    private static List<String> names(Optional<List<ExtractedRecord>> records) {
        return records.orElseThrow().stream().map(r -> r.text("name").orElse("?")).toList();
    }

    @Nested
    @DisplayName("Strategy chain")
    class ChainTests {

        @Test
        @DisplayName("Clean JSON array parses directly")
        void directArray() {
            assertEquals(List.of("A", "B"), names(parser.parse("[{\"name\": \"A\"}, {\"name\": \"B\"}]")));
            assertTrue(ParsingStrategies.direct("[{\"name\": \"A\"}]").isPresent());
        }

        @Test
        @DisplayName("A single object is one record")
        void singleObject() {
            assertEquals(List.of("A"), names(parser.parse("{\"name\": \"A\"}")));
        }

        @Test
        @DisplayName("Markdown fences and surrounding prose are stripped")
        void codeFence() {
            String raw = """
                    Here are the entities:
                    ```json
                    [{"name": "A"}, {"name": "B"}]
                    ```
                    Let me know if you need more.
                    """;

            assertTrue(ParsingStrategies.direct(raw).isEmpty());
            assertEquals(List.of("A", "B"), names(parser.parse(raw)));
        }

        @Test
        @DisplayName("Trailing commas, single quotes and missing commas are repaired")
        void repair() {
            String raw = "[{\"name\": \"A\",}, {'name': 'B'} {\"name\": \"C\"},]";

            assertTrue(ParsingStrategies.codeFence(raw).isEmpty());
            assertEquals(List.of("A", "B", "C"), names(parser.parse(raw)));
        }

        @Test
        @DisplayName("Smart quotes are repaired")
        void smartQuotes() {
            assertEquals(List.of("A"), names(parser.parse("[{“name”: “A”}]")));
        }

        @Test
        @DisplayName("Salvageable objects are recovered one by one from broken output")
        void recordRegex() {
            String raw = "{\"name\": \"A\"} then {\"name\": broken value} and finally {\"name\": \"C\"}";

            assertEquals(List.of("A", "C"), names(parser.parse(raw)));
        }

        @Test
        @DisplayName("An empty array is a valid empty answer")
        void emptyArray() {
            Optional<List<ExtractedRecord>> records = parser.parse("[]");

            assertTrue(records.isPresent());
            assertTrue(records.get().isEmpty());
        }

        @Test
        @DisplayName("Prose, blank and null input are unparseable")
        void unparseable() {
            assertTrue(parser.parse("I am sorry, I cannot extract anything from this text.").isEmpty());
            assertTrue(parser.parse("   ").isEmpty());
            assertTrue(parser.parse(null).isEmpty());
        }

        @Test
        @DisplayName("Non-object array elements are ignored")
        void nonObjectElements() {
            assertEquals(List.of("A"), names(parser.parse("[\"A\", 3, {\"name\": \"A\"}]")));
        }

        @Test
        @DisplayName("Custom strategies are tried in map order")
        void customStrategies() {
            Map<String, ParsingStrategy> strategies = new LinkedHashMap<>();
            strategies.put("never", raw -> Optional.empty());
            strategies.put("always", raw -> Optional.of(List.of(new ExtractedRecord(Map.of("name", raw)))));

            assertEquals(List.of("anything"), names(new ResponseParser(strategies).parse("anything")));
            assertThrows(IllegalArgumentException.class, () -> new ResponseParser(Map.of()));
        }
    }

    @Nested
    @DisplayName("Record field access")
    class RecordTests {

        @Test
        @DisplayName("Text lookup takes the first non-blank alias")
        void textAliases() {
            ExtractedRecord record = new ExtractedRecord(Map.of("entity", "  Acme ", "name", " "));

            assertEquals(Optional.of("Acme"), record.text("name", "entity"));
            assertTrue(record.text("missing").isEmpty());
        }

        @Test
        @DisplayName("Nested values are not text")
        void nestedNotText() {
            ExtractedRecord record = new ExtractedRecord(Map.of("name", List.of("a", "b")));

            assertTrue(record.text("name").isEmpty());
        }

        @Test
        @DisplayName("Numbers are read from numbers and numeric strings")
        void numbers() {
            ExtractedRecord record = new ExtractedRecord(Map.of("confidence", "0.8", "score", 3, "bad", "high"));

            assertEquals(0.8, record.number("confidence").getAsDouble());
            assertEquals(3.0, record.number("missing", "score").getAsDouble());
            assertTrue(record.number("bad").isEmpty());
        }
    }
}
