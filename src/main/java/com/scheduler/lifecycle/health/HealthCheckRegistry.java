package com.scheduler.lifecycle.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines registered checks into one status: the worst individual status wins,
 * and each check's result is reported as a detail under its name.
 * A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new ArrayList<>();

    public HealthCheckRegistry register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
        return this;
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus.Status worst = HealthStatus.Status.UP;
        String worstMessage = "OK";
        Map<String, Object> results = new LinkedHashMap<>();

        for (HealthCheck check : checks) {
            HealthStatus result;
            try {
                result = check.check();
            } catch (RuntimeException e) {
                log.error("health.checkFailed check={}", check.getName(), e);
                result = HealthStatus.down("Health check threw: " + e.getMessage());
            }
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message() != null ? result.message() : "",
                    "details", result.details()
            ));
            HealthStatus.Status combined = result.worst(worst);
            if (combined != worst) {
                worst = combined;
                worstMessage = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(worst, worstMessage, results);
    }

    public int size() {
        return checks.size();
    }
}
