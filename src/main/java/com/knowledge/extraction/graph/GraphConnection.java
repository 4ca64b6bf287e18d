package com.knowledge.extraction.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database holding the extracted knowledge graph.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows as maps keyed by column alias.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes the extraction graph relies on, if missing.
     */
    void createIndexes();

    @Override
    void close();
}
