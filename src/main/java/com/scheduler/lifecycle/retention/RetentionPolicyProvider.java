package com.scheduler.lifecycle.retention;

/**
 * Source of the current retention configuration.
 * Called at the start of every maintenance run; implementations must not cache
 * values across calls, since the settings are editable while the system runs.
 */
@FunctionalInterface
public interface RetentionPolicyProvider {

    /**
     * Reads and validates the current policy.
     *
     * @throws IllegalArgumentException if the stored settings are invalid
     */
    RetentionPolicy current();

    static RetentionPolicyProvider fixed(RetentionPolicy policy) {
        return () -> policy;
    }
}
