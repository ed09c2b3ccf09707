package com.scheduler.lifecycle.store;

import com.scheduler.lifecycle.core.model.ArchivableRecord;
import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-backed OperationalStore.
 * Operational rows are nodes labelled per {@link EntityKind#operationalLabel()} with an
 * {@code id} property and the kind's age field stored as epoch milliseconds.
 */
public class GraphOperationalStore implements OperationalStore {
    private static final Logger log = LoggerFactory.getLogger(GraphOperationalStore.class);

    private final GraphConnection connection;

    public GraphOperationalStore(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public List<ArchivableRecord> findAged(EntityKind kind, Instant cutoff, int limit, int offset) {
        String age = "n." + kind.ageField();
        String query = """
                MATCH (n:%s)
                WHERE %s < $cutoff
                RETURN n.id as id, %s as age, properties(n) as props
                ORDER BY %s ASC, n.id ASC
                SKIP $offset LIMIT $limit
                """.formatted(kind.operationalLabel(), age, age, age);
        List<Map<String, Object>> rows;
        try {
            rows = connection.query(query, Map.of(
                    "cutoff", cutoff.toEpochMilli(),
                    "offset", offset,
                    "limit", limit
            ));
        } catch (RuntimeException e) {
            throw new StoreException("Failed to query aged " + kind + " records", e);
        }

        List<ArchivableRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(new ArchivableRecord(
                    GraphRows.string(row.get("id")),
                    kind,
                    GraphRows.instant(row.get("age")),
                    payload(kind, row.get("props"))));
        }
        log.debug("store.findAged kind={} cutoff={} returned={}", kind, cutoff, records.size());
        return records;
    }

    @Override
    public int deleteOperational(EntityKind kind, Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        String query = """
                MATCH (n:%s)
                WHERE n.id IN $ids
                DETACH DELETE n
                RETURN count(n) as deleted
                """.formatted(kind.operationalLabel());
        try {
            List<Map<String, Object>> results = connection.query(query, Map.of("ids", List.copyOf(ids)));
            return (int) GraphRows.count(results, "deleted");
        } catch (RuntimeException e) {
            throw new StoreException("Failed to delete " + ids.size() + " " + kind + " records", e);
        }
    }

    private Map<String, Object> payload(EntityKind kind, Object props) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (props instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (!key.equals("id") && !key.equals(kind.ageField()) && entry.getValue() != null) {
                    payload.put(key, entry.getValue());
                }
            }
        }
        return payload;
    }
}
