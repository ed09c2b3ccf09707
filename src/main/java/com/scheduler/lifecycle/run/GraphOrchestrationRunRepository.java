package com.scheduler.lifecycle.run;

import com.scheduler.lifecycle.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph-backed implementation of {@link OrchestrationRunRepository} using FalkorDB.
 * Stores runs as {@code :OrchestrationRun} nodes with timestamps in epoch milliseconds.
 * Each write is a single query, which FalkorDB executes atomically.
 */
public class GraphOrchestrationRunRepository implements OrchestrationRunRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphOrchestrationRunRepository.class);

    private final GraphConnection connection;

    public GraphOrchestrationRunRepository(GraphConnection connection) {
        this.connection = connection;
        createIndexes();
    }

    private void createIndexes() {
        try {
            connection.execute("CREATE INDEX FOR (r:OrchestrationRun) ON (r.requestId)");
        } catch (RuntimeException e) {
            log.debug("OrchestrationRun requestId index may already exist: {}", e.getMessage());
        }
        try {
            connection.execute("CREATE INDEX FOR (r:OrchestrationRun) ON (r.status)");
        } catch (RuntimeException e) {
            log.debug("OrchestrationRun status index may already exist: {}", e.getMessage());
        }
    }

    @Override
    public boolean insertIfNoneActive(OrchestrationRun run) {
        String query = """
                OPTIONAL MATCH (a:OrchestrationRun)
                WHERE a.status IN ['QUEUED', 'RUNNING']
                WITH count(a) as active
                WHERE active = 0
                CREATE (r:OrchestrationRun $props)
                RETURN r.requestId as requestId
                """;
        List<Map<String, Object>> results = connection.query(query, Map.of("props", toProperties(run)));
        boolean inserted = !results.isEmpty();
        log.debug("Run {} {}", run.requestId(), inserted ? "queued" : "rejected, another run is active");
        return inserted;
    }

    @Override
    public boolean compareAndSet(OrchestrationRun updated, RunStatus expectedStatus, long expectedVersion) {
        // Nodes written before versioning have no version property and count as version 0
        String query = """
                MATCH (r:OrchestrationRun {requestId: $requestId})
                WHERE r.status = $expected AND coalesce(r.version, 0) = $expectedVersion
                SET r = $props
                RETURN r.requestId as requestId
                """;
        List<Map<String, Object>> results = connection.query(query, Map.of(
                "requestId", updated.requestId(),
                "expected", expectedStatus.name(),
                "expectedVersion", expectedVersion,
                "props", toProperties(updated)
        ));
        return !results.isEmpty();
    }

    @Override
    public Optional<OrchestrationRun> findById(String requestId) {
        String query = """
                MATCH (r:OrchestrationRun {requestId: $requestId})
                RETURN properties(r) as props
                """;
        return first(connection.query(query, Map.of("requestId", requestId)));
    }

    @Override
    public Optional<OrchestrationRun> findLatest() {
        String query = """
                MATCH (r:OrchestrationRun)
                RETURN properties(r) as props
                ORDER BY r.requestedAt DESC
                LIMIT 1
                """;
        return first(connection.query(query));
    }

    @Override
    public Optional<OrchestrationRun> findLatestCompleted() {
        String query = """
                MATCH (r:OrchestrationRun)
                WHERE r.status = 'COMPLETED'
                RETURN properties(r) as props
                ORDER BY r.completedAt DESC
                LIMIT 1
                """;
        return first(connection.query(query));
    }

    @Override
    public List<OrchestrationRun> findActive() {
        String query = """
                MATCH (r:OrchestrationRun)
                WHERE r.status IN ['QUEUED', 'RUNNING']
                RETURN properties(r) as props
                ORDER BY r.requestedAt DESC
                """;
        return mapAll(connection.query(query));
    }

    @Override
    public List<OrchestrationRun> findRecent(int limit) {
        String query = """
                MATCH (r:OrchestrationRun)
                RETURN properties(r) as props
                ORDER BY r.requestedAt DESC
                LIMIT $limit
                """;
        return mapAll(connection.query(query, Map.of("limit", limit)));
    }

    private Optional<OrchestrationRun> first(List<Map<String, Object>> results) {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapToRun(results.get(0)));
    }

    private List<OrchestrationRun> mapAll(List<Map<String, Object>> results) {
        List<OrchestrationRun> runs = new ArrayList<>(results.size());
        for (Map<String, Object> row : results) {
            runs.add(mapToRun(row));
        }
        return runs;
    }

    /**
     * Null fields are left out so {@code SET r = $props} removes them from the node.
     */
    static Map<String, Object> toProperties(OrchestrationRun run) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("requestId", run.requestId());
        putIfPresent(props, "requestedBy", run.requestedBy());
        props.put("status", run.status().name());
        props.put("requestedAt", run.requestedAt().toEpochMilli());
        props.put("version", run.version());
        putIfPresent(props, "startedAt", run.startedAt() != null ? run.startedAt().toEpochMilli() : null);
        putIfPresent(props, "completedAt", run.completedAt() != null ? run.completedAt().toEpochMilli() : null);
        putIfPresent(props, "currentStep", run.currentStep());
        putIfPresent(props, "currentProgress", run.currentProgress());
        putIfPresent(props, "processedItems", run.processedItems());
        putIfPresent(props, "totalItems", run.totalItems());
        putIfPresent(props, "errorMessage", run.errorMessage());
        for (Map.Entry<RunCounter, Long> counter : run.counters().entrySet()) {
            props.put(counter.getKey().propertyName(), counter.getValue());
        }
        return props;
    }

    @SuppressWarnings("unchecked")
    static OrchestrationRun mapToRun(Map<String, Object> row) {
        Map<String, Object> props = (Map<String, Object>) row.get("props");
        Map<RunCounter, Long> counters = new EnumMap<>(RunCounter.class);
        Long version = toLong(props.get("version"));
        for (RunCounter counter : RunCounter.values()) {
            Long value = toLong(props.get(counter.propertyName()));
            if (value != null) {
                counters.put(counter, value);
            }
        }
        return new OrchestrationRun(
                (String) props.get("requestId"),
                (String) props.get("requestedBy"),
                RunStatus.valueOf((String) props.get("status")),
                toInstant(props.get("requestedAt")),
                toInstant(props.get("startedAt")),
                toInstant(props.get("completedAt")),
                (String) props.get("currentStep"),
                (String) props.get("currentProgress"),
                toLong(props.get("processedItems")),
                toLong(props.get("totalItems")),
                (String) props.get("errorMessage"),
                counters,
                version != null ? version : 0L
        );
    }

    private static void putIfPresent(Map<String, Object> props, String key, Object value) {
        if (value != null) {
            props.put(key, value);
        }
    }

    private static Long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        return null;
    }

    private static Instant toInstant(Object value) {
        Long millis = toLong(value);
        return millis != null ? Instant.ofEpochMilli(millis) : null;
    }
}
