package com.scheduler.lifecycle.graph;

import java.util.List;
import java.util.Map;

/**
 * Interface for graph database connection management.
 * Abstracts the underlying graph database holding operational, archive and run-state nodes.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher query that modifies the graph.
     *
     * @param query  the Cypher query
     * @param params query parameters; lists and maps are bound as Cypher literals
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns results.
     *
     * @param query  the Cypher query
     * @param params query parameters
     * @return list of result records as maps
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    /**
     * Checks if the connection is alive.
     */
    boolean isConnected();

    /**
     * Gets the name of the graph being used.
     */
    String getGraphName();

    /**
     * Creates the lifecycle indexes if they don't exist.
     */
    void createIndexes();

    @Override
    void close();
}
