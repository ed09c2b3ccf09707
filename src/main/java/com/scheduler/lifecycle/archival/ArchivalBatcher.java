package com.scheduler.lifecycle.archival;

import com.scheduler.lifecycle.core.model.ArchivableRecord;
import com.scheduler.lifecycle.core.model.ArchiveRecord;
import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.maintenance.CancellationToken;
import com.scheduler.lifecycle.store.ArchiveStore;
import com.scheduler.lifecycle.store.OperationalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Moves aged operational records into archive storage in bounded batches.
 *
 * <p>Each batch runs in two phases. The <em>stage</em> phase bulk-inserts archive copies;
 * the <em>commit</em> phase deletes the same ids from the operational store, and runs
 * only after the stage returned. A failed stage leaves the operational rows untouched.
 * A failed commit leaves duplicate copies in the archive, which readers deduplicate by
 * source id; no record is ever lost.</p>
 *
 * <p>Any failure stops the kind and returns the count archived so far with the error.</p>
 */
public class ArchivalBatcher {
    private static final Logger log = LoggerFactory.getLogger(ArchivalBatcher.class);

    public static final String DEFAULT_ARCHIVED_BY = "system";

    private final OperationalStore operationalStore;
    private final ArchiveStore archiveStore;
    private final Clock clock;
    private final String archivedBy;

    public ArchivalBatcher(OperationalStore operationalStore, ArchiveStore archiveStore) {
        this(operationalStore, archiveStore, Clock.systemUTC(), DEFAULT_ARCHIVED_BY);
    }

    public ArchivalBatcher(OperationalStore operationalStore, ArchiveStore archiveStore,
                           Clock clock, String archivedBy) {
        this.operationalStore = Objects.requireNonNull(operationalStore, "operationalStore is required");
        this.archiveStore = Objects.requireNonNull(archiveStore, "archiveStore is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.archivedBy = archivedBy;
    }

    public ArchivalResult archive(EntityKind kind, Instant cutoff, int batchSize) {
        return archive(kind, cutoff, batchSize, CancellationToken.NONE);
    }

    /**
     * Archives every record of {@code kind} strictly older than {@code cutoff}.
     *
     * @throws IllegalArgumentException if {@code batchSize <= 0}
     */
    public ArchivalResult archive(EntityKind kind, Instant cutoff, int batchSize, CancellationToken cancellation) {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(cutoff, "cutoff is required");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }

        long totalArchived = 0;
        int batchNumber = 0;
        while (true) {
            if (cancellation.isCancelled()) {
                log.info("archival.cancelled kind={} archived={}", kind, totalArchived);
                return ArchivalResult.cancelled(kind, totalArchived);
            }

            List<ArchivableRecord> batch;
            try {
                batch = operationalStore.findAged(kind, cutoff, batchSize, 0);
            } catch (RuntimeException e) {
                log.error("archival.queryFailed kind={} archived={}", kind, totalArchived, e);
                return ArchivalResult.failed(kind, totalArchived,
                        "Failed to read aged " + kind + " records: " + e.getMessage());
            }
            if (batch.isEmpty()) {
                break;
            }
            batchNumber++;

            // Stage: the copies must be durable before anything is removed
            Instant archivedAt = clock.instant();
            List<ArchiveRecord> copies = new ArrayList<>(batch.size());
            List<String> ids = new ArrayList<>(batch.size());
            for (ArchivableRecord record : batch) {
                copies.add(ArchiveRecord.of(record, archivedAt, archivedBy));
                ids.add(record.id());
            }
            try {
                archiveStore.insertArchive(kind, copies);
            } catch (RuntimeException e) {
                log.error("archival.stageFailed kind={} batch={} archived={}", kind, batchNumber, totalArchived, e);
                return ArchivalResult.failed(kind, totalArchived,
                        "Archive copy failed for " + kind + ": " + e.getMessage());
            }

            // Commit
            int removed;
            try {
                removed = operationalStore.deleteOperational(kind, ids);
            } catch (RuntimeException e) {
                log.error("archival.commitFailed kind={} batch={} archived={} staged={}",
                        kind, batchNumber, totalArchived, copies.size(), e);
                return ArchivalResult.failed(kind, totalArchived,
                        "Operational delete failed for " + kind + " after archive copy: " + e.getMessage());
            }
            if (removed == 0) {
                log.warn("archival.noProgress kind={} batch={} staged={}", kind, batchNumber, copies.size());
                return ArchivalResult.failed(kind, totalArchived,
                        "Operational delete removed no " + kind + " records; aborting to avoid reprocessing");
            }

            totalArchived += removed;
            log.debug("archival.batch kind={} batch={} removed={} total={}", kind, batchNumber, removed, totalArchived);

            if (batch.size() < batchSize) {
                break;
            }
        }

        log.info("archival.completed kind={} cutoff={} archived={}", kind, cutoff, totalArchived);
        return ArchivalResult.completed(kind, totalArchived);
    }
}
