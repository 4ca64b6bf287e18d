package com.knowledge.extraction.maintenance;

import com.knowledge.extraction.core.model.RelationTypes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Infers a relationship type from its evidence description using an ordered
 * table of phrase patterns.
 *
 * <p>Types are checked in declaration order and, within a type, patterns in
 * declaration order. The first case-insensitive match wins. A description that
 * matches nothing yields {@link #GENERIC_TYPE}.</p>
 */
public class RelationTypeInferrer {

    public static final String GENERIC_TYPE = RelationTypes.GENERIC;

    private final List<TypeRule> rules;

    public RelationTypeInferrer() {
        this(defaultTable());
    }

    /**
     * @param table type to phrase list, iterated in the map's order
     */
    public RelationTypeInferrer(Map<String, List<String>> table) {
        Objects.requireNonNull(table, "table is required");
        List<TypeRule> compiled = new ArrayList<>();
        table.forEach((type, phrases) -> {
            List<Pattern> patterns = phrases.stream()
                    .map(phrase -> Pattern.compile("\\b" + Pattern.quote(phrase.toLowerCase(Locale.ROOT)) + "\\b"))
                    .toList();
            compiled.add(new TypeRule(type, patterns));
        });
        this.rules = List.copyOf(compiled);
    }

    /**
     * Returns the inferred type for the description; never null.
     */
    public String infer(String description) {
        if (description == null || description.isBlank()) {
            return GENERIC_TYPE;
        }
        String text = description.toLowerCase(Locale.ROOT);
        for (TypeRule rule : rules) {
            for (Pattern pattern : rule.patterns()) {
                if (pattern.matcher(text).find()) {
                    return rule.type();
                }
            }
        }
        return GENERIC_TYPE;
    }

    /**
     * The built-in table. Location phrases come first so that "headquartered in"
     * is not claimed by a broader organisational rule.
     */
    public static Map<String, List<String>> defaultTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("LOCATED_IN", List.of("headquartered in", "located in", "based in", "situated in",
                "head office in", "resides in", "lives in"));
        table.put("FOUNDED_BY", List.of("founded by", "co-founded by", "established by", "founder of",
                "co-founder of"));
        table.put("EMPLOYS", List.of("works for", "works at", "employed by", "employee of", "employs",
                "hired by"));
        table.put("MANAGES", List.of("ceo of", "manages", "managed by", "head of", "director of",
                "president of", "chair of"));
        table.put("OWNS", List.of("owns", "owned by", "acquired", "subsidiary of", "bought"));
        table.put("PART_OF", List.of("part of", "member of", "belongs to", "division of", "component of"));
        table.put("CONTAINS", List.of("contains", "includes", "consists of", "comprises"));
        table.put("CREATES", List.of("created", "developed", "invented", "designed", "produces",
                "manufactures"));
        table.put("USES", List.of("uses", "utilizes", "relies on", "based on", "powered by"));
        table.put("CAUSES", List.of("causes", "caused by", "results in", "leads to", "triggers"));
        table.put("REQUIRES", List.of("requires", "depends on"));
        table.put("PRECEDES", List.of("precedes", "preceded", "predecessor of"));
        table.put("FOLLOWS", List.of("follows", "successor of", "succeeded"));
        table.put("SIMILAR_TO", List.of("similar to", "resembles", "comparable to"));
        return table;
    }

    private record TypeRule(String type, List<Pattern> patterns) {
    }
}
