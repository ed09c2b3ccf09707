package com.scheduler.lifecycle.archival;

import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.maintenance.CancellationToken;
import com.scheduler.lifecycle.store.ArchiveStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Permanently deletes archive records past the archive retention horizon.
 * Deletion is irreversible and processed in batches until a short batch is returned.
 */
public class ArchivePurger {
    private static final Logger log = LoggerFactory.getLogger(ArchivePurger.class);

    private final ArchiveStore archiveStore;

    public ArchivePurger(ArchiveStore archiveStore) {
        this.archiveStore = Objects.requireNonNull(archiveStore, "archiveStore is required");
    }

    public ArchivalResult purge(EntityKind kind, Instant cutoff, int batchSize) {
        return purge(kind, cutoff, batchSize, CancellationToken.NONE);
    }

    /**
     * Deletes archive records of {@code kind} archived strictly before {@code cutoff}.
     *
     * @throws IllegalArgumentException if {@code batchSize <= 0}
     */
    public ArchivalResult purge(EntityKind kind, Instant cutoff, int batchSize, CancellationToken cancellation) {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(cutoff, "cutoff is required");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }

        long totalPurged = 0;
        int deleted;
        do {
            if (cancellation.isCancelled()) {
                log.info("purge.cancelled kind={} purged={}", kind, totalPurged);
                return ArchivalResult.cancelled(kind, totalPurged);
            }
            try {
                deleted = archiveStore.deleteArchivedBefore(kind, cutoff, batchSize);
            } catch (RuntimeException e) {
                log.error("purge.failed kind={} purged={}", kind, totalPurged, e);
                return ArchivalResult.failed(kind, totalPurged,
                        "Archive purge failed for " + kind + ": " + e.getMessage());
            }
            totalPurged += deleted;
            if (deleted > 0) {
                log.debug("purge.batch kind={} batch={} total={}", kind, deleted, totalPurged);
            }
        } while (deleted >= batchSize);

        log.info("purge.completed kind={} cutoff={} purged={}", kind, cutoff, totalPurged);
        return ArchivalResult.completed(kind, totalPurged);
    }
}
