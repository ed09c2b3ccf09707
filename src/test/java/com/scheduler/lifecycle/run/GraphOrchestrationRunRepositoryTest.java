package com.scheduler.lifecycle.run;

import com.scheduler.lifecycle.testutil.StubGraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphOrchestrationRunRepository")
class GraphOrchestrationRunRepositoryTest {

    private static final Instant REQUESTED = Instant.parse("2024-06-01T02:00:00Z");

    private StubGraphConnection connection;
    private GraphOrchestrationRunRepository repository;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        repository = new GraphOrchestrationRunRepository(connection);
    }

    @Test
    @DisplayName("Should create indexes on construction")
    void createsIndexes() {
        assertTrue(connection.executedQueries.stream().anyMatch(q -> q.contains("ON (r.requestId)")));
        assertTrue(connection.executedQueries.stream().anyMatch(q -> q.contains("ON (r.status)")));
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("insertIfNoneActive should guard on active runs in the same query")
        void insertGuarded() {
            connection.thenReturn(Map.of("requestId", "r1"));

            assertTrue(repository.insertIfNoneActive(OrchestrationRun.queued("r1", "api", REQUESTED)));

            String query = connection.lastQuery();
            assertTrue(query.contains("WHERE a.status IN ['QUEUED', 'RUNNING']"));
            assertTrue(query.contains("WHERE active = 0"));
            assertTrue(query.contains("CREATE (r:OrchestrationRun $props)"));
        }

        @Test
        @DisplayName("insertIfNoneActive should report rejection when nothing was created")
        void insertRejected() {
            assertFalse(repository.insertIfNoneActive(OrchestrationRun.queued("r2", "api", REQUESTED)));
        }

        @Test
        @DisplayName("compareAndSet should match on the expected status and version")
        void compareAndSet() {
            OrchestrationRun started = OrchestrationRun.queued("r1", "api", REQUESTED)
                    .started(REQUESTED.plusSeconds(1))
                    .nextVersion();
            connection.thenReturn(Map.of("requestId", "r1"));

            assertTrue(repository.compareAndSet(started, RunStatus.QUEUED, 0));
            assertEquals("QUEUED", connection.lastParams().get("expected"));
            assertEquals(0L, connection.lastParams().get("expectedVersion"));
            assertTrue(connection.lastQuery().contains("WHERE r.status = $expected"));
            assertTrue(connection.lastQuery().contains("coalesce(r.version, 0) = $expectedVersion"));
            @SuppressWarnings("unchecked")
            Map<String, Object> props = (Map<String, Object>) connection.lastParams().get("props");
            assertEquals(1L, props.get("version"));

            assertFalse(repository.compareAndSet(started, RunStatus.QUEUED, 0));
        }
    }

    @Nested
    @DisplayName("Property mapping")
    class Mapping {

        @Test
        @DisplayName("Should store timestamps as epoch millis and omit nulls")
        void toProperties() {
            OrchestrationRun run = OrchestrationRun.queued("r1", "api", REQUESTED);

            Map<String, Object> props = GraphOrchestrationRunRepository.toProperties(run);

            assertEquals(REQUESTED.toEpochMilli(), props.get("requestedAt"));
            assertEquals("QUEUED", props.get("status"));
            assertFalse(props.containsKey("startedAt"));
            assertFalse(props.containsKey("errorMessage"));
        }

        @Test
        @DisplayName("Should read back every field and counter")
        void readsBack() {
            OrchestrationRun original = OrchestrationRun.queued("r1", "scheduler", REQUESTED)
                    .started(REQUESTED.plusSeconds(1))
                    .progressed("Step 1/3: Sync", 5, 10)
                    .withCounter(RunCounter.STATUSES_CHECKED, 12)
                    .failed(REQUESTED.plusSeconds(60), "timeout");
            connection.thenReturn(Map.of("props", GraphOrchestrationRunRepository.toProperties(original)));

            Optional<OrchestrationRun> found = repository.findById("r1");

            assertEquals(Optional.of(original), found);
            assertEquals(12, found.get().counter(RunCounter.STATUSES_CHECKED));
        }

        @Test
        @DisplayName("Should tolerate integer-typed numbers from the driver")
        void integerNumbers() {
            Map<String, Object> props = Map.of(
                    "requestId", "r1",
                    "status", "RUNNING",
                    "requestedAt", 1000,
                    "startedAt", 2000,
                    "jobsCreated", 3);

            OrchestrationRun run = GraphOrchestrationRunRepository.mapToRun(Map.of("props", props));

            assertEquals(Instant.ofEpochMilli(2000), run.startedAt());
            assertEquals(3, run.counter(RunCounter.JOBS_CREATED));
            assertEquals(0, run.version());
        }

        @Test
        @DisplayName("Should read the stored version")
        void readsVersion() {
            OrchestrationRun run = GraphOrchestrationRunRepository.mapToRun(Map.of("props", Map.of(
                    "requestId", "r1",
                    "status", "QUEUED",
                    "requestedAt", 1000L,
                    "version", 5)));

            assertEquals(5, run.version());
        }
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("findLatestCompleted should order by completion time")
        void latestCompleted() {
            assertTrue(repository.findLatestCompleted().isEmpty());

            String query = connection.lastQuery();
            assertTrue(query.contains("WHERE r.status = 'COMPLETED'"));
            assertTrue(query.contains("ORDER BY r.completedAt DESC"));
        }

        @Test
        @DisplayName("findActive should map every active run")
        void active() {
            connection.thenReturn(List.of(
                    Map.of("props", GraphOrchestrationRunRepository.toProperties(
                            OrchestrationRun.queued("r1", "api", REQUESTED)))));

            List<OrchestrationRun> active = repository.findActive();

            assertEquals(1, active.size());
            assertEquals(RunStatus.QUEUED, active.get(0).status());
        }

        @Test
        @DisplayName("findRecent should pass the limit")
        void recent() {
            repository.findRecent(5);
            assertEquals(5, connection.lastParams().get("limit"));
        }
    }
}
