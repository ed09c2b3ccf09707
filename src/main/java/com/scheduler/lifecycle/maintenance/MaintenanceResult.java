package com.scheduler.lifecycle.maintenance;

import com.scheduler.lifecycle.archival.ArchivalResult;
import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.logfiles.LogReapResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of one maintenance run.
 *
 * @param archivedByKind records archived per entity kind
 * @param purgedByKind   archive records purged per entity kind
 * @param logFilesDeleted log files deleted across all directories
 * @param logBytesFreed  bytes reclaimed by log cleanup
 * @param success        true when no step reported an error
 * @param errorMessage   every step error joined by {@code "; "}, or null
 * @param cancelled      whether the run stopped early on request
 * @param startedAt      when the run started
 * @param completedAt    when the run finished
 */
public record MaintenanceResult(
        Map<EntityKind, Long> archivedByKind,
        Map<EntityKind, Long> purgedByKind,
        long logFilesDeleted,
        long logBytesFreed,
        boolean success,
        String errorMessage,
        boolean cancelled,
        Instant startedAt,
        Instant completedAt
) {
    public MaintenanceResult {
        archivedByKind = copy(archivedByKind);
        purgedByKind = copy(purgedByKind);
    }

    private static Map<EntityKind, Long> copy(Map<EntityKind, Long> counts) {
        if (counts == null || counts.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    public long archived(EntityKind kind) {
        return archivedByKind.getOrDefault(kind, 0L);
    }

    public long purged(EntityKind kind) {
        return purgedByKind.getOrDefault(kind, 0L);
    }

    public long totalArchived() {
        return archivedByKind.values().stream().mapToLong(Long::longValue).sum();
    }

    public long totalPurged() {
        return purgedByKind.values().stream().mapToLong(Long::longValue).sum();
    }

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }

    public static Builder builder(Instant startedAt) {
        return new Builder(startedAt);
    }

    @Override
    public String toString() {
        return "MaintenanceResult{archived=" + totalArchived() +
                ", purged=" + totalPurged() +
                ", logFiles=" + logFilesDeleted +
                ", bytesFreed=" + logBytesFreed +
                ", success=" + success +
                (cancelled ? ", cancelled" : "") +
                (errorMessage != null ? ", error=" + errorMessage : "") + '}';
    }

    /**
     * Collects step outcomes while a run progresses.
     */
    public static class Builder {
        private final Instant startedAt;
        private final Map<EntityKind, Long> archived = new EnumMap<>(EntityKind.class);
        private final Map<EntityKind, Long> purged = new EnumMap<>(EntityKind.class);
        private final List<String> errors = new ArrayList<>();
        private LogReapResult logs = LogReapResult.empty();
        private boolean cancelled;

        private Builder(Instant startedAt) {
            this.startedAt = startedAt;
        }

        public Builder archival(ArchivalResult result) {
            archived.merge(result.kind(), result.count(), Long::sum);
            return outcome(result);
        }

        public Builder purge(ArchivalResult result) {
            purged.merge(result.kind(), result.count(), Long::sum);
            return outcome(result);
        }

        private Builder outcome(ArchivalResult result) {
            if (result.errorMessage() != null) {
                errors.add(result.errorMessage());
            }
            if (result.cancelled()) {
                cancelled = true;
            }
            return this;
        }

        public Builder logs(LogReapResult result) {
            logs = logs.plus(result);
            return this;
        }

        public Builder error(String message) {
            errors.add(message);
            return this;
        }

        public Builder cancelled() {
            this.cancelled = true;
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public MaintenanceResult build(Instant completedAt) {
            return new MaintenanceResult(archived, purged, logs.deletedCount(), logs.bytesFreed(),
                    errors.isEmpty(), errors.isEmpty() ? null : String.join("; ", errors),
                    cancelled, startedAt, completedAt);
        }
    }
}
