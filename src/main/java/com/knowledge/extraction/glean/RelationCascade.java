package com.knowledge.extraction.glean;

import com.knowledge.extraction.core.model.CancellationToken;
import com.knowledge.extraction.core.model.ChunkInput;
import com.knowledge.extraction.core.model.Entity;
import com.knowledge.extraction.extract.RelationExtraction;

import java.util.List;

/**
 * Runs the ranked relation cascade with a caller-supplied prompt.
 */
@FunctionalInterface
public interface RelationCascade {

    RelationExtraction extractRelations(ChunkInput chunk, List<Entity> entities, String prompt,
                                        CancellationToken token);
}
