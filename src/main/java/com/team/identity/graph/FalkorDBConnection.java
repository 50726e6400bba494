package com.team.identity.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GraphConnection} backed by FalkorDB through the JFalkorDB client.
 * Driver failures are rethrown as {@link PersistenceUnavailableException}.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection opened for graph '{}' at {}:{}", graphName, host, port);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String statement = bind(query, params);
        log.debug("Executing: {}", statement);
        try {
            graph.query(statement);
        } catch (RuntimeException e) {
            throw new PersistenceUnavailableException("Graph write failed on " + graphName, e);
        }
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String statement = bind(query, params);
        log.debug("Querying: {}", statement);

        ResultSet resultSet;
        try {
            resultSet = graph.query(statement);
        } catch (RuntimeException e) {
            throw new PersistenceUnavailableException("Graph query failed on " + graphName, e);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("FalkorDB liveness check failed for graph '{}'", graphName, e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    /**
     * Inlines {@code $name} placeholders as Cypher literals. Longer keys are bound first
     * so {@code $source} never clobbers {@code $sourceName}.
     */
    static String bind(String query, Map<String, Object> params) {
        String result = query;
        List<String> keys = new ArrayList<>(params.keySet());
        keys.sort((a, b) -> Integer.compare(b.length(), a.length()));
        for (String key : keys) {
            result = result.replace("$" + key, literal(params.get(key)));
        }
        return result;
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection for graph '{}'", graphName, e);
        }
        log.info("FalkorDB connection closed for graph '{}'", graphName);
    }
}
