package com.scheduler.lifecycle.health;

import com.scheduler.lifecycle.graph.GraphConnection;

/**
 * Reports whether the graph holding operational, archive and run data answers queries.
 */
public class FalkorDBHealthCheck implements HealthCheck {

    private final GraphConnection connection;

    public FalkorDBHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "falkordb";
    }

    @Override
    public HealthStatus check() {
        long startNanos = System.nanoTime();
        try {
            connection.query("RETURN 1");
        } catch (RuntimeException e) {
            return HealthStatus.down("FalkorDB query failed: " + e.getMessage())
                    .withDetail("graphName", connection.getGraphName())
                    .withDetail("error", e.getClass().getSimpleName());
        }
        long latencyMs = (System.nanoTime() - startNanos) / 1_000_000;
        return HealthStatus.up("FalkorDB reachable")
                .withDetail("graphName", connection.getGraphName())
                .withDetail("latencyMs", latencyMs);
    }
}
