package com.scheduler.lifecycle.lock;

import com.scheduler.lifecycle.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FalkorDB MERGE-based run lock for multi-JVM deployments.
 *
 * <p>Uses a {@code :RunLock} node with atomic MERGE for check-and-set semantics.
 * Every acquisition writes a fresh owner token, so two callers sharing one instance
 * exclude each other the same way two JVMs do. A lock whose release never reached the
 * graph, or whose holder crashed, is reclaimed once its TTL expires.
 * Timestamps are stored as epoch milliseconds.</p>
 */
public class GraphRunLock implements RunLock {
    private static final Logger log = LoggerFactory.getLogger(GraphRunLock.class);

    private final GraphConnection connection;
    private final LockConfig config;
    private final Clock clock;
    private final String instanceId;
    private final AtomicLong acquisitions = new AtomicLong();
    private final Map<String, String> heldTokens = new ConcurrentHashMap<>();

    public GraphRunLock(GraphConnection connection) {
        this(connection, LockConfig.defaults(), Clock.systemUTC());
    }

    public GraphRunLock(GraphConnection connection, LockConfig config, Clock clock) {
        this.connection = connection;
        this.config = config;
        this.clock = clock;
        this.instanceId = generateInstanceId();
        createLockIndex();
    }

    @Override
    public boolean tryAcquire(String key) {
        if (heldTokens.containsKey(key)) {
            log.debug("Lock busy: {} (held by this instance)", key);
            return false;
        }
        String token = instanceId + "-" + acquisitions.incrementAndGet();
        RuntimeException lastFailure = null;
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            try {
                boolean acquired = attemptLock(key, token);
                if (acquired) {
                    heldTokens.put(key, token);
                }
                log.debug("Lock {}: {} (attempt {})", acquired ? "acquired" : "busy", key, attempt + 1);
                return acquired;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Lock acquisition attempt failed for {}: {}", key, e.getMessage());
            }

            if (attempt < config.maxRetries()) {
                try {
                    Thread.sleep(config.retryDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LockAcquisitionException("Interrupted while acquiring lock for: " + key, e);
                }
            }
        }

        throw new LockAcquisitionException(
                "Failed to query lock '" + key + "' after " + (config.maxRetries() + 1) + " attempts", lastFailure);
    }

    @Override
    public void release(String key) {
        String token = heldTokens.remove(key);
        if (token == null) {
            log.debug("Lock {} not held by this instance", key);
            return;
        }
        String query = """
                MATCH (l:RunLock {key: $key, owner: $owner})
                DELETE l
                """;
        try {
            connection.execute(query, Map.of("key", key, "owner", token));
            log.debug("Lock released: {}", key);
        } catch (RuntimeException e) {
            log.warn("Failed to release lock {}: {}", key, e.getMessage());
        }
    }

    String heldToken(String key) {
        return heldTokens.get(key);
    }

    private boolean attemptLock(String key, String token) {
        long now = clock.millis();
        long expiresAt = now + config.lockTtlSeconds() * 1000;

        // Create the lock node, or take it over if the previous owner's lease expired
        String query = """
                MERGE (l:RunLock {key: $key})
                ON CREATE SET l.owner = $owner, l.acquiredAt = $now, l.expiresAt = $expiresAt
                ON MATCH SET l.owner = CASE
                    WHEN l.expiresAt < $now THEN $owner
                    ELSE l.owner
                END,
                l.acquiredAt = CASE
                    WHEN l.expiresAt < $now THEN $now
                    ELSE l.acquiredAt
                END,
                l.expiresAt = CASE
                    WHEN l.expiresAt < $now THEN $expiresAt
                    ELSE l.expiresAt
                END
                RETURN l.owner as owner
                """;

        List<Map<String, Object>> results = connection.query(query, Map.of(
                "key", key,
                "owner", token,
                "now", now,
                "expiresAt", expiresAt
        ));
        if (results.isEmpty()) {
            return false;
        }
        return token.equals(results.get(0).get("owner"));
    }

    private void createLockIndex() {
        try {
            connection.execute("CREATE INDEX FOR (l:RunLock) ON (l.key)");
        } catch (RuntimeException e) {
            log.debug("Lock index creation: {}", e.getMessage());
        }
    }

    private String generateInstanceId() {
        return ProcessHandle.current().pid() + "-" + System.identityHashCode(this)
                + "-" + System.nanoTime();
    }
}
