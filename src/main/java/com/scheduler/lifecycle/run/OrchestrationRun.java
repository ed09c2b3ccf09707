package com.scheduler.lifecycle.run;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one orchestration run.
 * Instances are immutable; every state change produces a new snapshot that
 * {@link RunStateTracker} swaps in with a compare-and-set on the stored status and version.
 *
 * @param requestId       unique run identifier
 * @param requestedBy     who requested the run
 * @param status          current state
 * @param requestedAt     when the run was queued
 * @param startedAt       when the run started, or null while queued
 * @param completedAt     when the run reached a terminal state, or null
 * @param currentStep     the step in progress, or null
 * @param currentProgress progress of the current step as {@code "processed/total"}, or null
 * @param processedItems  items processed in the current step, or null
 * @param totalItems      items to process in the current step, or null
 * @param errorMessage    failure reason for FAILED runs, or null
 * @param counters        per-step counters; absent counters read as zero
 * @param version         incremented by every stored change, starting at 0
 */
public record OrchestrationRun(
        String requestId,
        String requestedBy,
        RunStatus status,
        Instant requestedAt,
        Instant startedAt,
        Instant completedAt,
        String currentStep,
        String currentProgress,
        Long processedItems,
        Long totalItems,
        String errorMessage,
        Map<RunCounter, Long> counters,
        long version
) {
    public OrchestrationRun {
        Objects.requireNonNull(requestId, "requestId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(requestedAt, "requestedAt is required");
        if (status.isTerminal() != (completedAt != null)) {
            throw new IllegalArgumentException(
                    "completedAt must be set exactly when the run is terminal (status=" + status + ")");
        }
        counters = counters == null || counters.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(counters));
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
    }

    public static OrchestrationRun queued(String requestId, String requestedBy, Instant requestedAt) {
        return new OrchestrationRun(requestId, requestedBy, RunStatus.QUEUED, requestedAt,
                null, null, null, null, null, null, null, Map.of(), 0);
    }

    public boolean isActive() {
        return status.isActive();
    }

    public long counter(RunCounter counter) {
        return counters.getOrDefault(counter, 0L);
    }

    /**
     * Time from start to completion; null unless both are known.
     */
    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }

    public OrchestrationRun started(Instant at) {
        return new OrchestrationRun(requestId, requestedBy, RunStatus.RUNNING, requestedAt,
                at, null, null, null, null, null, null, counters, version);
    }

    OrchestrationRun progressed(String step, long processed, long total) {
        return new OrchestrationRun(requestId, requestedBy, status, requestedAt,
                startedAt, completedAt, step, processed + "/" + total, processed, total, errorMessage, counters, version);
    }

    OrchestrationRun withCounter(RunCounter counter, long value) {
        Map<RunCounter, Long> updated = new EnumMap<>(RunCounter.class);
        updated.putAll(counters);
        updated.put(counter, value);
        return new OrchestrationRun(requestId, requestedBy, status, requestedAt,
                startedAt, completedAt, currentStep, currentProgress, processedItems, totalItems,
                errorMessage, updated, version);
    }

    public OrchestrationRun completed(Instant at) {
        return new OrchestrationRun(requestId, requestedBy, RunStatus.COMPLETED, requestedAt,
                startedAt, at, null, null, processedItems, totalItems, null, counters, version);
    }

    public OrchestrationRun failed(Instant at, String error) {
        return new OrchestrationRun(requestId, requestedBy, RunStatus.FAILED, requestedAt,
                startedAt, at, null, null, processedItems, totalItems, error, counters, version);
    }

    OrchestrationRun nextVersion() {
        return new OrchestrationRun(requestId, requestedBy, status, requestedAt,
                startedAt, completedAt, currentStep, currentProgress, processedItems, totalItems,
                errorMessage, counters, version + 1);
    }
}
