package com.scheduler.lifecycle.store;

import com.scheduler.lifecycle.core.model.ArchiveRecord;
import com.scheduler.lifecycle.core.model.EntityKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory, append-only implementation of ArchiveStore.
 * Duplicate copies of a source record are kept as written and collapsed on read.
 */
public class InMemoryArchiveStore implements ArchiveStore {

    private final Map<EntityKind, List<ArchiveRecord>> rows = new EnumMap<>(EntityKind.class);

    public InMemoryArchiveStore() {
        for (EntityKind kind : EntityKind.values()) {
            rows.put(kind, new ArrayList<>());
        }
    }

    @Override
    public synchronized int insertArchive(EntityKind kind, List<ArchiveRecord> records) {
        for (ArchiveRecord record : records) {
            if (record.kind() != kind) {
                throw new StoreException("Archive record " + record.sourceId() + " is " + record.kind()
                        + ", expected " + kind);
            }
        }
        rows.get(kind).addAll(records);
        return records.size();
    }

    @Override
    public synchronized int deleteArchivedBefore(EntityKind kind, Instant cutoff, int limit) {
        List<ArchiveRecord> candidates = rows.get(kind).stream()
                .filter(r -> r.isArchivedBefore(cutoff))
                .sorted(Comparator.comparing(ArchiveRecord::archivedAt))
                .limit(limit)
                .toList();
        int removed = 0;
        for (ArchiveRecord candidate : candidates) {
            Iterator<ArchiveRecord> it = rows.get(kind).iterator();
            while (it.hasNext()) {
                if (it.next() == candidate) {
                    it.remove();
                    removed++;
                    break;
                }
            }
        }
        return removed;
    }

    @Override
    public synchronized List<ArchiveRecord> findAll(EntityKind kind) {
        Map<String, ArchiveRecord> firstCopy = new LinkedHashMap<>();
        for (ArchiveRecord record : rows.get(kind)) {
            firstCopy.putIfAbsent(record.sourceId(), record);
        }
        return new ArrayList<>(firstCopy.values());
    }

    @Override
    public long count(EntityKind kind) {
        return findAll(kind).size();
    }

    /**
     * Number of physical rows, duplicates included.
     */
    public synchronized int rowCount(EntityKind kind) {
        return rows.get(kind).size();
    }
}
