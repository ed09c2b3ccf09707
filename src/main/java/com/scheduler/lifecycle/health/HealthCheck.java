package com.scheduler.lifecycle.health;

/**
 * A single health check, such as the graph connection or the orchestrator schedule.
 */
public interface HealthCheck {

    String getName();

    /**
     * Runs the check. Implementations report failures through the returned status
     * rather than by throwing.
     */
    HealthStatus check();
}
