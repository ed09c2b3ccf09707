package com.scheduler.lifecycle.analytics;

import java.time.Instant;

/**
 * Aggregates for one time bucket of a dashboard window.
 *
 * @param bucketStart            inclusive start of the bucket
 * @param executionCount         executions that started inside the bucket
 * @param averageDurationSeconds mean duration of the finished executions that started inside the bucket
 * @param peakConcurrent         most executions running at once within the bucket
 */
public record ConcurrencyBucket(
        Instant bucketStart,
        int executionCount,
        double averageDurationSeconds,
        int peakConcurrent
) {
}
