package com.scheduler.lifecycle.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import com.scheduler.lifecycle.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * FalkorDB-specific implementation using the JFalkorDB client.
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
        log.info("FalkorDB connection initialized for graph: {}", graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = CypherLiterals.bind(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = CypherLiterals.bind(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();

        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} results", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating lifecycle indexes...");

        for (EntityKind kind : EntityKind.values()) {
            safeExecute("CREATE INDEX FOR (n:" + kind.operationalLabel() + ") ON (n.id)");
            safeExecute("CREATE INDEX FOR (n:" + kind.operationalLabel() + ") ON (n." + kind.ageField() + ")");
            safeExecute("CREATE INDEX FOR (a:" + kind.archiveLabel() + ") ON (a.sourceId)");
            safeExecute("CREATE INDEX FOR (a:" + kind.archiveLabel() + ") ON (a.archivedAt)");
        }
        safeExecute("CREATE INDEX FOR (r:OrchestrationRun) ON (r.requestId)");
        safeExecute("CREATE INDEX FOR (r:OrchestrationRun) ON (r.requestedAt)");

        log.info("Index creation complete");
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // Index might already exist
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public void close() {
        if (driver != null) {
            try {
                driver.close();
            } catch (Exception e) {
                log.warn("Error closing FalkorDB connection", e);
            }
        }
        log.info("FalkorDB connection closed");
    }

    /**
     * Substitutes {@code $param} placeholders with Cypher literals.
     * Longer names are substituted first so {@code $ids} never clobbers {@code $idsToKeep}.
     */
    static final class CypherLiterals {

        private CypherLiterals() {
        }

        static String bind(String query, Map<String, Object> params) {
            String result = query;
            List<String> names = new ArrayList<>(params.keySet());
            names.sort((a, b) -> Integer.compare(b.length(), a.length()));
            for (String name : names) {
                result = result.replace("$" + name, format(params.get(name)));
            }
            return result;
        }

        static String format(Object value) {
            if (value == null) {
                return "null";
            }
            if (value instanceof Number || value instanceof Boolean) {
                return value.toString();
            }
            if (value instanceof Collection<?> collection) {
                StringJoiner joiner = new StringJoiner(", ", "[", "]");
                for (Object element : collection) {
                    joiner.add(format(element));
                }
                return joiner.toString();
            }
            if (value instanceof Map<?, ?> map) {
                StringJoiner joiner = new StringJoiner(", ", "{", "}");
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    joiner.add(entry.getKey() + ": " + format(entry.getValue()));
                }
                return joiner.toString();
            }
            return quote(value.toString());
        }

        private static String quote(String value) {
            return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
    }
}
