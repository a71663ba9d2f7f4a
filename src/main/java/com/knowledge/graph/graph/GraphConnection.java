package com.knowledge.graph.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database that holds the knowledge graph.
 * Queries are Cypher with {@code $name} parameters.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement
     * @param params statement parameters
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows.
     *
     * @param query  the Cypher query
     * @param params query parameters
     * @return one map per row, keyed by column alias
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes lookups rely on, ignoring ones that already exist.
     */
    void createIndexes();

    @Override
    void close();
}
