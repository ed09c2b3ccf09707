package com.scheduler.lifecycle.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Start/end pair of one job execution. An execution that is still running has no end time.
 */
public record ExecutionInterval(Instant startTime, Instant endTime) {

    public ExecutionInterval {
        Objects.requireNonNull(startTime, "startTime is required");
        if (endTime != null && endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime must not precede startTime");
        }
    }

    public static ExecutionInterval closed(Instant startTime, Instant endTime) {
        return new ExecutionInterval(startTime, Objects.requireNonNull(endTime, "endTime is required"));
    }

    public static ExecutionInterval open(Instant startTime) {
        return new ExecutionInterval(startTime, null);
    }

    public boolean isOpen() {
        return endTime == null;
    }

    /**
     * End of the interval, with open intervals extended to the given observation end.
     */
    public Instant endOr(Instant observationEnd) {
        return endTime != null ? endTime : observationEnd;
    }

    /**
     * Duration of a finished execution; zero while still running.
     */
    public Duration duration() {
        return endTime != null ? Duration.between(startTime, endTime) : Duration.ZERO;
    }
}
