package com.scheduler.lifecycle.analytics;

import java.time.Instant;

/**
 * Headline numbers for a dashboard window.
 */
public record ConcurrencySummary(
        Instant windowStart,
        Instant windowEnd,
        int totalExecutions,
        int runningExecutions,
        int peakConcurrent,
        double averageDurationSeconds
) {
}
