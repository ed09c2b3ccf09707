package com.scheduler.lifecycle.store;

import com.scheduler.lifecycle.core.model.ArchiveRecord;
import com.scheduler.lifecycle.core.model.EntityKind;

import java.time.Instant;
import java.util.List;

/**
 * Durable secondary storage for aged-out records.
 *
 * <p>Archive storage is append-only. The same source record may be written twice when an
 * operational delete fails after a successful copy; readers see one record per source id.</p>
 */
public interface ArchiveStore {

    /**
     * Writes archive copies. Returns only once the write is durable.
     *
     * @return the number of records written
     */
    int insertArchive(EntityKind kind, List<ArchiveRecord> records);

    /**
     * Permanently deletes up to {@code limit} archive records archived strictly before {@code cutoff}.
     *
     * @return the number of records removed
     */
    int deleteArchivedBefore(EntityKind kind, Instant cutoff, int limit);

    /**
     * Returns the archived records of a kind, one per source id.
     */
    List<ArchiveRecord> findAll(EntityKind kind);

    /**
     * Counts archived records of a kind, one per source id.
     */
    long count(EntityKind kind);
}
