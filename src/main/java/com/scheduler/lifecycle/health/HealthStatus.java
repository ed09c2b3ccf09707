package com.scheduler.lifecycle.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of a component: a status, a human-readable message and ordered details.
 * Null detail values are dropped.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Ordered from best to worst.
     */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        if (value == null) {
            return this;
        }
        Map<String, Object> newDetails = new LinkedHashMap<>(details);
        newDetails.put(key, value);
        return new HealthStatus(status, message, newDetails);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    /**
     * Returns the worse of this status and {@code other}.
     */
    Status worst(Status other) {
        return other.ordinal() > status.ordinal() ? other : status;
    }
}
