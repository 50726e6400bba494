package com.team.identity.graph;

import java.util.List;
import java.util.Map;

/**
 * Narrow contract to the graph store holding learned mappings and the attempt log.
 * Each call runs a single Cypher statement, which is the unit of atomicity.
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
     * Executes a Cypher query and returns its rows keyed by column alias.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    @Override
    void close();
}
