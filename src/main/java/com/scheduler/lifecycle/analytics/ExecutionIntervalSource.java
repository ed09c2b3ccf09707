package com.scheduler.lifecycle.analytics;

import com.scheduler.lifecycle.core.model.ExecutionInterval;

import java.time.Instant;
import java.util.List;

/**
 * Supplies execution intervals for dashboard analysis.
 */
@FunctionalInterface
public interface ExecutionIntervalSource {

    /**
     * Returns executions that started at or after {@code since}.
     */
    List<ExecutionInterval> findSince(Instant since);
}
