package com.scheduler.lifecycle.integration;

import com.scheduler.lifecycle.archival.ArchivalBatcher;
import com.scheduler.lifecycle.archival.ArchivalResult;
import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.graph.FalkorDBConnection;
import com.scheduler.lifecycle.lock.GraphRunLock;
import com.scheduler.lifecycle.run.GraphOrchestrationRunRepository;
import com.scheduler.lifecycle.run.OrchestrationRun;
import com.scheduler.lifecycle.run.RunAlreadyActiveException;
import com.scheduler.lifecycle.run.RunStateTracker;
import com.scheduler.lifecycle.run.RunStatus;
import com.scheduler.lifecycle.store.GraphArchiveStore;
import com.scheduler.lifecycle.store.GraphOperationalStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Archival, locking and run tracking against a live FalkorDB instance.
 */
@Tag("integration")
class GraphMaintenanceIntegrationTest extends AbstractFalkorDBIntegrationTest {

    private FalkorDBConnection connection;

    @BeforeEach
    void setUp() {
        connection = createConnection("lifecycle");
    }

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.close();
        }
    }

    private void createJob(String id, Instant createdAt) {
        connection.execute("CREATE (:Job {id: $id, createdAt: $createdAt, name: $name})",
                Map.of("id", id, "createdAt", createdAt.toEpochMilli(), "name", "job " + id));
    }

    @Test
    @DisplayName("Aged jobs should move to the archive with their payload")
    void archivesAgedJobs() {
        Instant now = Instant.now();
        for (int i = 0; i < 7; i++) {
            createJob("old-" + i, now.minus(Duration.ofDays(400 + i)));
        }
        createJob("fresh", now.minus(Duration.ofDays(10)));

        GraphArchiveStore archive = new GraphArchiveStore(connection);
        ArchivalBatcher batcher = new ArchivalBatcher(new GraphOperationalStore(connection), archive);

        ArchivalResult result = batcher.archive(EntityKind.JOB, now.minus(Duration.ofDays(365)), 3);

        assertTrue(result.isSuccess());
        assertEquals(7, result.count());
        assertEquals(7, archive.count(EntityKind.JOB));
        assertEquals("job old-0", archive.findAll(EntityKind.JOB).stream()
                .filter(r -> r.sourceId().equals("old-0"))
                .findFirst().orElseThrow()
                .payload().get("name"));

        long remaining = ((Number) connection.query("MATCH (j:Job) RETURN count(j) as c").get(0).get("c")).longValue();
        assertEquals(1, remaining);

        assertEquals(0, batcher.archive(EntityKind.JOB, now.minus(Duration.ofDays(365)), 3).count());
    }

    @Test
    @DisplayName("Archived copies older than the cutoff should be purged")
    void purgesArchive() {
        Instant now = Instant.now();
        createJob("a", now.minus(Duration.ofDays(500)));
        GraphArchiveStore archive = new GraphArchiveStore(connection);
        new ArchivalBatcher(new GraphOperationalStore(connection), archive)
                .archive(EntityKind.JOB, now.minus(Duration.ofDays(365)), 10);

        assertEquals(0, archive.deleteArchivedBefore(EntityKind.JOB, now.minus(Duration.ofDays(1)), 10));
        assertEquals(1, archive.deleteArchivedBefore(EntityKind.JOB, now.plus(Duration.ofDays(1)), 10));
        assertEquals(0, archive.count(EntityKind.JOB));
    }

    @Test
    @DisplayName("Only one holder should acquire the maintenance lock at a time")
    void lockIsExclusive() {
        GraphRunLock first = new GraphRunLock(connection);
        GraphRunLock second = new GraphRunLock(connection);

        assertTrue(first.tryAcquire("maintenance"));
        assertFalse(second.tryAcquire("maintenance"));

        first.release("maintenance");
        assertTrue(second.tryAcquire("maintenance"));
        second.release("maintenance");
    }

    @Test
    @DisplayName("Run tracking should enforce a single active run")
    void singleActiveRun() {
        RunStateTracker tracker = new RunStateTracker(new GraphOrchestrationRunRepository(connection));

        OrchestrationRun run = tracker.request("scheduler");
        assertThrows(RunAlreadyActiveException.class, () -> tracker.request("api"));

        tracker.start(run.requestId());
        tracker.complete(run.requestId());

        assertEquals(RunStatus.COMPLETED, tracker.find(run.requestId()).orElseThrow().status());
        assertDoesNotThrow(() -> tracker.request("api"));
    }
}
