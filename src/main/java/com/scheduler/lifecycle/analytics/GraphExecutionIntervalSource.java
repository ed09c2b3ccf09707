package com.scheduler.lifecycle.analytics;

import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.core.model.ExecutionInterval;
import com.scheduler.lifecycle.graph.GraphConnection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads job execution intervals from the graph.
 * Expects {@code startTime} and optional {@code endTime} in epoch milliseconds on
 * job execution nodes.
 */
public class GraphExecutionIntervalSource implements ExecutionIntervalSource {

    private final GraphConnection connection;

    public GraphExecutionIntervalSource(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public List<ExecutionInterval> findSince(Instant since) {
        String query = """
                MATCH (e:%s)
                WHERE e.startTime >= $since
                RETURN e.startTime as startTime, e.endTime as endTime
                ORDER BY e.startTime ASC
                """.formatted(EntityKind.JOB_EXECUTION.operationalLabel());
        List<Map<String, Object>> rows = connection.query(query, Map.of("since", since.toEpochMilli()));
        List<ExecutionInterval> intervals = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Instant start = Instant.ofEpochMilli(((Number) row.get("startTime")).longValue());
            Object end = row.get("endTime");
            intervals.add(end instanceof Number n
                    ? ExecutionInterval.closed(start, Instant.ofEpochMilli(n.longValue()))
                    : ExecutionInterval.open(start));
        }
        return intervals;
    }
}
