package com.knowledge.extraction.llm;

import com.knowledge.extraction.core.model.ChunkInput;
import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.core.model.Relationship;

import java.util.List;

/**
 * Rank-3 extractor of the cascade. Implementations are deterministic, make no
 * network calls, always terminate and may return empty lists.
 */
public interface FallbackExtractor {

    String getName();

    List<Entity> extractEntities(ChunkInput chunk);

    List<Relationship> extractRelations(ChunkInput chunk, List<Entity> entities);
}
