package com.scheduler.lifecycle.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scheduler.lifecycle.core.model.ArchiveRecord;
import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-backed ArchiveStore.
 * Archive rows are nodes labelled per {@link EntityKind#archiveLabel()}, keyed by
 * {@code sourceId} through MERGE so a re-copied source record is never stored twice.
 * Payloads are serialized as JSON strings.
 */
public class GraphArchiveStore implements ArchiveStore {
    private static final Logger log = LoggerFactory.getLogger(GraphArchiveStore.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphArchiveStore(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public int insertArchive(EntityKind kind, List<ArchiveRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (ArchiveRecord record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("sourceId", record.sourceId());
            row.put("ageTimestamp", record.ageTimestamp().toEpochMilli());
            row.put("payload", serializePayload(record.payload()));
            row.put("archivedAt", record.archivedAt().toEpochMilli());
            row.put("archivedBy", record.archivedBy() != null ? record.archivedBy() : "");
            rows.add(row);
        }
        String query = """
                UNWIND $rows AS row
                MERGE (a:%s {sourceId: row.sourceId})
                ON CREATE SET a.ageTimestamp = row.ageTimestamp,
                              a.payload = row.payload,
                              a.archivedAt = row.archivedAt,
                              a.archivedBy = row.archivedBy
                RETURN count(a) as inserted
                """.formatted(kind.archiveLabel());
        try {
            List<Map<String, Object>> results = connection.query(query, Map.of("rows", rows));
            int inserted = (int) GraphRows.count(results, "inserted");
            log.debug("store.archived kind={} count={}", kind, inserted);
            return inserted;
        } catch (RuntimeException e) {
            throw new StoreException("Failed to write " + records.size() + " " + kind + " archive records", e);
        }
    }

    @Override
    public int deleteArchivedBefore(EntityKind kind, Instant cutoff, int limit) {
        String query = """
                MATCH (a:%s)
                WHERE a.archivedAt < $cutoff
                WITH a ORDER BY a.archivedAt ASC LIMIT $limit
                DELETE a
                RETURN count(a) as deleted
                """.formatted(kind.archiveLabel());
        try {
            List<Map<String, Object>> results = connection.query(query, Map.of(
                    "cutoff", cutoff.toEpochMilli(),
                    "limit", limit
            ));
            return (int) GraphRows.count(results, "deleted");
        } catch (RuntimeException e) {
            throw new StoreException("Failed to purge " + kind + " archive records", e);
        }
    }

    @Override
    public List<ArchiveRecord> findAll(EntityKind kind) {
        String query = """
                MATCH (a:%s)
                RETURN a.sourceId as sourceId, a.ageTimestamp as ageTimestamp, a.payload as payload,
                       a.archivedAt as archivedAt, a.archivedBy as archivedBy
                ORDER BY a.archivedAt ASC
                """.formatted(kind.archiveLabel());
        Map<String, ArchiveRecord> bySource = new LinkedHashMap<>();
        for (Map<String, Object> row : connection.query(query)) {
            String sourceId = GraphRows.string(row.get("sourceId"));
            bySource.putIfAbsent(sourceId, new ArchiveRecord(
                    sourceId,
                    kind,
                    GraphRows.instant(row.get("ageTimestamp")),
                    deserializePayload(GraphRows.string(row.get("payload"))),
                    GraphRows.instant(row.get("archivedAt")),
                    GraphRows.string(row.get("archivedBy"))));
        }
        return new ArrayList<>(bySource.values());
    }

    @Override
    public long count(EntityKind kind) {
        String query = """
                MATCH (a:%s)
                RETURN count(DISTINCT a.sourceId) as total
                """.formatted(kind.archiveLabel());
        return GraphRows.count(connection.query(query), "total");
    }

    private String serializePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StoreException("Archive payload is not serializable", e);
        }
    }

    private Map<String, Object> deserializePayload(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize archive payload: {}", e.getMessage());
            return new HashMap<>();
        }
    }
}
