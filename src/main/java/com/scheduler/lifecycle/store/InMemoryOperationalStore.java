package com.scheduler.lifecycle.store;

import com.scheduler.lifecycle.core.model.ArchivableRecord;
import com.scheduler.lifecycle.core.model.EntityKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory implementation of OperationalStore.
 * Thread-safe via synchronization on the store. Intended for tests and single-node setups.
 */
public class InMemoryOperationalStore implements OperationalStore {

    private static final Comparator<ArchivableRecord> OLDEST_FIRST =
            Comparator.comparing(ArchivableRecord::ageTimestamp).thenComparing(ArchivableRecord::id);

    private final Map<EntityKind, Map<String, ArchivableRecord>> records = new EnumMap<>(EntityKind.class);

    public InMemoryOperationalStore() {
        for (EntityKind kind : EntityKind.values()) {
            records.put(kind, new LinkedHashMap<>());
        }
    }

    public synchronized ArchivableRecord save(ArchivableRecord record) {
        records.get(record.kind()).put(record.id(), record);
        return record;
    }

    public void saveAll(Collection<ArchivableRecord> toSave) {
        toSave.forEach(this::save);
    }

    @Override
    public synchronized List<ArchivableRecord> findAged(EntityKind kind, Instant cutoff, int limit, int offset) {
        return records.get(kind).values().stream()
                .filter(r -> r.isOlderThan(cutoff))
                .sorted(OLDEST_FIRST)
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized int deleteOperational(EntityKind kind, Collection<String> ids) {
        Map<String, ArchivableRecord> byId = records.get(kind);
        Set<String> unique = new HashSet<>(ids);
        int removed = 0;
        for (String id : unique) {
            if (byId.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    public synchronized List<ArchivableRecord> findAll(EntityKind kind) {
        return new ArrayList<>(records.get(kind).values());
    }

    public synchronized int count(EntityKind kind) {
        return records.get(kind).size();
    }

    public synchronized boolean contains(EntityKind kind, String id) {
        return records.get(kind).containsKey(id);
    }
}
