package com.scheduler.lifecycle.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A row in the operational store that is eligible for archival once it ages past its cutoff.
 *
 * @param id           unique identifier within its kind
 * @param kind         the entity kind
 * @param ageTimestamp the timestamp that determines the record's age
 * @param payload      the remaining columns, carried opaquely into the archive
 */
public record ArchivableRecord(
        String id,
        EntityKind kind,
        Instant ageTimestamp,
        Map<String, Object> payload
) {
    public ArchivableRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(ageTimestamp, "ageTimestamp is required");
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    /**
     * Strictly older: a record stamped exactly at the cutoff is not eligible.
     */
    public boolean isOlderThan(Instant cutoff) {
        return ageTimestamp.isBefore(cutoff);
    }
}
