package com.scheduler.lifecycle.store;

import com.scheduler.lifecycle.core.model.ArchivableRecord;
import com.scheduler.lifecycle.core.model.EntityKind;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Live tables holding current and recent records.
 * Each call is expected to be atomic on its own.
 */
public interface OperationalStore {

    /**
     * Returns records of the given kind whose age timestamp is strictly before {@code cutoff},
     * oldest first.
     *
     * @param kind   the entity kind
     * @param cutoff exclusive upper bound on the age timestamp
     * @param limit  maximum number of records to return
     * @param offset number of matching records to skip
     */
    List<ArchivableRecord> findAged(EntityKind kind, Instant cutoff, int limit, int offset);

    /**
     * Deletes the given records.
     *
     * @return the number of records actually removed
     */
    int deleteOperational(EntityKind kind, Collection<String> ids);
}
