package com.scheduler.lifecycle.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Archived copy of an {@link ArchivableRecord}.
 * Owned by archive storage once written; removed only by the archive purge.
 */
public record ArchiveRecord(
        String sourceId,
        EntityKind kind,
        Instant ageTimestamp,
        Map<String, Object> payload,
        Instant archivedAt,
        String archivedBy
) {
    public ArchiveRecord {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(ageTimestamp, "ageTimestamp is required");
        Objects.requireNonNull(archivedAt, "archivedAt is required");
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static ArchiveRecord of(ArchivableRecord source, Instant archivedAt, String archivedBy) {
        return new ArchiveRecord(source.id(), source.kind(), source.ageTimestamp(),
                source.payload(), archivedAt, archivedBy);
    }

    public boolean isArchivedBefore(Instant cutoff) {
        return archivedAt.isBefore(cutoff);
    }
}
