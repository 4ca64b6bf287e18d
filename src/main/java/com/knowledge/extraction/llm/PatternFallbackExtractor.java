package com.knowledge.extraction.llm;

import com.knowledge.extraction.core.model.CanonicalKeys;
import com.knowledge.extraction.core.model.ChunkInput;
import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.RelationTypes;
import com.knowledge.extraction.core.model.Relationship;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic fallback that treats capitalised phrases as entities and links
 * entities mentioned next to each other in the same sentence.
 *
 * <p>Quality is low on purpose: it only exists so the cascade always terminates
 * with something a human or the gleaning pass can build on.</p>
 */
public class PatternFallbackExtractor implements FallbackExtractor {

    static final String ENTITY_TYPE = "CONCEPT";
    static final double ENTITY_CONFIDENCE = 0.3;
    static final double RELATION_CONFIDENCE = 0.2;

    private static final Pattern CAPITALISED_PHRASE = Pattern.compile(
            "\\b\\p{Lu}[\\p{L}\\p{N}&'-]*(?:\\s+\\p{Lu}[\\p{L}\\p{N}&'-]*)*");
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "this", "that", "these", "those", "it", "its", "he", "she",
            "they", "we", "i", "you", "in", "on", "at", "by", "for", "of", "and", "but",
            "or", "if", "when", "while", "after", "before", "as", "with", "from", "to"
    );

    @Override
    public String getName() {
        return "pattern-fallback";
    }

    @Override
    public List<Entity> extractEntities(ChunkInput chunk) {
        Map<String, Entity> byKey = new LinkedHashMap<>();
        for (String phrase : phrases(chunk.text())) {
            byKey.putIfAbsent(CanonicalKeys.entityKey(phrase), Entity.builder()
                    .name(phrase)
                    .type(ENTITY_TYPE)
                    .confidence(ENTITY_CONFIDENCE)
                    .sourceChunkId(chunk.chunkId())
                    .build());
        }
        return List.copyOf(byKey.values());
    }

    @Override
    public List<Relationship> extractRelations(ChunkInput chunk, List<Entity> entities) {
        Map<String, Entity> known = new LinkedHashMap<>();
        entities.forEach(e -> known.putIfAbsent(e.getCanonicalKey(), e));

        Map<String, Relationship> relations = new LinkedHashMap<>();
        for (String sentence : SENTENCE_BOUNDARY.split(chunk.text())) {
            List<Entity> mentioned = new ArrayList<>();
            for (String phrase : phrases(sentence)) {
                Entity entity = known.get(CanonicalKeys.entityKey(phrase));
                if (entity != null && !mentioned.contains(entity)) {
                    mentioned.add(entity);
                }
            }
            for (int i = 0; i + 1 < mentioned.size(); i++) {
                Relationship relation = Relationship.builder()
                        .sourceEntityRef(mentioned.get(i).getName())
                        .targetEntityRef(mentioned.get(i + 1).getName())
                        .type(RelationTypes.GENERIC)
                        .description(sentence.trim())
                        .confidence(RELATION_CONFIDENCE)
                        .sourceChunkId(chunk.chunkId())
                        .build();
                relations.putIfAbsent(relation.getMergeKey(), relation);
            }
        }
        return List.copyOf(relations.values());
    }

    private List<String> phrases(String text) {
        List<String> phrases = new ArrayList<>();
        Matcher matcher = CAPITALISED_PHRASE.matcher(text);
        while (matcher.find()) {
            String phrase = stripLeadingStopwords(matcher.group());
            if (phrase.length() > 1) {
                phrases.add(phrase);
            }
        }
        return phrases;
    }

    private String stripLeadingStopwords(String phrase) {
        String[] words = phrase.split("\\s+");
        int start = 0;
        while (start < words.length && STOPWORDS.contains(words[start].toLowerCase(Locale.ROOT))) {
            start++;
        }
        return String.join(" ", Arrays.copyOfRange(words, start, words.length));
    }
}
