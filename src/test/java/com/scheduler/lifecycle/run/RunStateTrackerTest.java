package com.scheduler.lifecycle.run;

import com.scheduler.lifecycle.metrics.MicrometerMetricsService;
import com.scheduler.lifecycle.metrics.NoOpMetricsService;
import com.scheduler.lifecycle.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunStateTracker")
class RunStateTrackerTest {

    private static final Instant START = Instant.parse("2024-06-01T02:00:00Z");

    private MutableClock clock;
    private InMemoryOrchestrationRunRepository repository;
    private SimpleMeterRegistry registry;
    private RunStateTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        repository = new InMemoryOrchestrationRunRepository();
        registry = new SimpleMeterRegistry();
        tracker = new RunStateTracker(repository, new MicrometerMetricsService(registry), clock);
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should move QUEUED -> RUNNING -> COMPLETED with timestamps")
        void happyPath() {
            OrchestrationRun queued = tracker.request("scheduler");
            assertEquals(RunStatus.QUEUED, queued.status());
            assertEquals(START, queued.requestedAt());
            assertNull(queued.startedAt());

            clock.advance(Duration.ofSeconds(5));
            OrchestrationRun running = tracker.start(queued.requestId());
            assertEquals(RunStatus.RUNNING, running.status());
            assertEquals(START.plusSeconds(5), running.startedAt());

            clock.advance(Duration.ofMinutes(2));
            OrchestrationRun completed = tracker.complete(queued.requestId());
            assertEquals(RunStatus.COMPLETED, completed.status());
            assertEquals(START.plusSeconds(125), completed.completedAt());
            assertEquals(Duration.ofMinutes(2), completed.duration());
            assertEquals(completed, tracker.find(queued.requestId()).orElseThrow());
            assertEquals(1, registry.get("lifecycle.orchestration.duration").tag("status", "COMPLETED").timer().count());
        }

        @Test
        @DisplayName("Should record progress and counters while running")
        void progressAndCounters() {
            String id = tracker.request("api").requestId();
            tracker.start(id);

            tracker.updateProgress(id, "Step 2/5: Sync accounts", 40, 100);
            OrchestrationRun run = tracker.recordCounter(id, RunCounter.SYNC_ACCOUNTS_TOTAL, 40);

            assertEquals("Step 2/5: Sync accounts", run.currentStep());
            assertEquals("40/100", run.currentProgress());
            assertEquals(40L, run.processedItems());
            assertEquals(100L, run.totalItems());
            assertEquals(40, run.counter(RunCounter.SYNC_ACCOUNTS_TOTAL));
            assertEquals(0, run.counter(RunCounter.JOBS_CREATED));
        }

        @Test
        @DisplayName("Completion should clear the current step but keep counters")
        void completionClearsStep() {
            String id = tracker.request("api").requestId();
            tracker.start(id);
            tracker.updateProgress(id, "Step 1/1: Jobs", 1, 1);
            tracker.recordCounter(id, RunCounter.JOBS_CREATED, 3);

            OrchestrationRun completed = tracker.complete(id);

            assertNull(completed.currentStep());
            assertNull(completed.currentProgress());
            assertEquals(3, completed.counter(RunCounter.JOBS_CREATED));
        }

        @Test
        @DisplayName("A queued run may fail before it starts")
        void failFromQueued() {
            String id = tracker.request("api").requestId();

            OrchestrationRun failed = tracker.fail(id, "Runner is shut down");

            assertEquals(RunStatus.FAILED, failed.status());
            assertEquals("Runner is shut down", failed.errorMessage());
            assertNotNull(failed.completedAt());
            assertNull(failed.duration());
        }
    }

    @Nested
    @DisplayName("Single flight")
    class SingleFlight {

        @Test
        @DisplayName("Should reject a request while another run is active")
        void rejectsSecondRequest() {
            OrchestrationRun first = tracker.request("scheduler");

            RunAlreadyActiveException e = assertThrows(RunAlreadyActiveException.class,
                    () -> tracker.request("api"));

            assertEquals(first.requestId(), e.getActiveRequestId());
            assertEquals(1, repository.findRecent(10).size());
        }

        @Test
        @DisplayName("Should accept a new request once the previous run finished")
        void acceptsAfterTerminal() {
            String id = tracker.request("scheduler").requestId();
            tracker.start(id);
            tracker.fail(id, "boom");

            assertDoesNotThrow(() -> tracker.request("api"));
        }
    }

    @Nested
    @DisplayName("Illegal transitions")
    class IllegalTransitions {

        @Test
        @DisplayName("Completing a QUEUED run should be rejected")
        void completeQueued() {
            String id = tracker.request("api").requestId();

            IllegalRunTransitionException e = assertThrows(IllegalRunTransitionException.class,
                    () -> tracker.complete(id));

            assertEquals(RunStatus.QUEUED, e.getCurrentStatus());
            assertEquals(id, e.getRequestId());
            assertEquals(RunStatus.QUEUED, tracker.find(id).orElseThrow().status());
        }

        @Test
        @DisplayName("Terminal states should be final")
        void terminalIsFinal() {
            String id = tracker.request("api").requestId();
            tracker.start(id);
            tracker.complete(id);

            assertThrows(IllegalRunTransitionException.class, () -> tracker.fail(id, "late"));
            assertThrows(IllegalRunTransitionException.class, () -> tracker.start(id));
            assertThrows(IllegalRunTransitionException.class, () -> tracker.updateProgress(id, "x", 1, 1));
            assertThrows(IllegalRunTransitionException.class,
                    () -> tracker.recordCounter(id, RunCounter.JOBS_SKIPPED, 1));
            assertEquals(RunStatus.COMPLETED, tracker.find(id).orElseThrow().status());
        }

        @Test
        @DisplayName("Starting twice should be rejected")
        void startTwice() {
            String id = tracker.request("api").requestId();
            tracker.start(id);

            assertThrows(IllegalRunTransitionException.class, () -> tracker.start(id));
        }

        @Test
        @DisplayName("Unknown runs should be reported as such")
        void unknownRun() {
            assertThrows(IllegalArgumentException.class, () -> tracker.start("missing"));
        }

        @Test
        @DisplayName("Negative progress should be rejected")
        void negativeProgress() {
            String id = tracker.request("api").requestId();
            tracker.start(id);

            assertThrows(IllegalArgumentException.class, () -> tracker.updateProgress(id, "x", -1, 10));
        }

        @Test
        @DisplayName("A lost compare-and-set should surface as an illegal transition")
        void lostRace() {
            String id = tracker.request("api").requestId();
            tracker.start(id);
            OrchestrationRunRepository racing = new InMemoryOrchestrationRunRepository() {
                @Override
                public synchronized Optional<OrchestrationRun> findById(String requestId) {
                    return repository.findById(requestId);
                }

                @Override
                public synchronized boolean compareAndSet(OrchestrationRun updated, RunStatus expectedStatus,
                                                          long expectedVersion) {
                    // Another worker finished the run first
                    OrchestrationRun stored = repository.findById(updated.requestId()).orElseThrow();
                    repository.compareAndSet(stored.completed(clock.instant()).nextVersion(),
                            RunStatus.RUNNING, stored.version());
                    return repository.compareAndSet(updated, expectedStatus, expectedVersion);
                }
            };

            RunStateTracker loser = new RunStateTracker(racing, new NoOpMetricsService(), clock);
            IllegalRunTransitionException e = assertThrows(IllegalRunTransitionException.class,
                    () -> loser.fail(id, "too late"));

            assertEquals(RunStatus.COMPLETED, e.getCurrentStatus());
        }
    }

    @Nested
    @DisplayName("Concurrent updates")
    class ConcurrentUpdates {

        @Test
        @DisplayName("Every write should bump the version")
        void versionPerWrite() {
            String id = tracker.request("api").requestId();
            assertEquals(0, tracker.find(id).orElseThrow().version());

            tracker.start(id);
            tracker.recordCounter(id, RunCounter.JOBS_CREATED, 1);
            tracker.updateProgress(id, "Step 1/3: Sync", 1, 2);

            assertEquals(3, tracker.find(id).orElseThrow().version());
        }

        @Test
        @DisplayName("A stale snapshot should not overwrite a newer write")
        void staleSnapshotRejected() {
            String id = tracker.request("api").requestId();
            OrchestrationRun running = tracker.start(id);
            tracker.recordCounter(id, RunCounter.JOBS_CREATED, 4);

            OrchestrationRun stale = running.withCounter(RunCounter.STATUSES_CHECKED, 9).nextVersion();

            assertFalse(repository.compareAndSet(stale, RunStatus.RUNNING, running.version()));
            assertEquals(4, tracker.find(id).orElseThrow().counter(RunCounter.JOBS_CREATED));
        }

        @Test
        @DisplayName("Interleaved counter writes should retry instead of losing an update")
        void interleavedCountersRetry() {
            String id = tracker.request("api").requestId();
            tracker.start(id);
            AtomicBoolean interleaved = new AtomicBoolean();
            OrchestrationRunRepository interleaving = new InMemoryOrchestrationRunRepository() {
                @Override
                public synchronized Optional<OrchestrationRun> findById(String requestId) {
                    return repository.findById(requestId);
                }

                @Override
                public synchronized boolean compareAndSet(OrchestrationRun updated, RunStatus expectedStatus,
                                                          long expectedVersion) {
                    if (interleaved.compareAndSet(false, true)) {
                        // Another step records its counter between our read and our write
                        tracker.recordCounter(id, RunCounter.JOBS_CREATED, 7);
                    }
                    return repository.compareAndSet(updated, expectedStatus, expectedVersion);
                }
            };
            RunStateTracker other = new RunStateTracker(interleaving, new NoOpMetricsService(), clock);

            other.recordCounter(id, RunCounter.STATUSES_CHECKED, 3);

            OrchestrationRun stored = tracker.find(id).orElseThrow();
            assertEquals(7, stored.counter(RunCounter.JOBS_CREATED));
            assertEquals(3, stored.counter(RunCounter.STATUSES_CHECKED));
        }

        @Test
        @DisplayName("Counters recorded from two threads should all survive")
        void twoThreadsKeepBothCounters() throws Exception {
            String id = tracker.request("api").requestId();
            tracker.start(id);
            int rounds = 200;
            CountDownLatch go = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<?> jobs = executor.submit(() -> recordRounds(go, id, RunCounter.JOBS_CREATED, rounds));
                Future<?> statuses = executor.submit(() -> recordRounds(go, id, RunCounter.STATUSES_CHECKED, rounds));
                go.countDown();
                jobs.get(10, TimeUnit.SECONDS);
                statuses.get(10, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            OrchestrationRun stored = tracker.find(id).orElseThrow();
            assertEquals(rounds, stored.counter(RunCounter.JOBS_CREATED));
            assertEquals(rounds, stored.counter(RunCounter.STATUSES_CHECKED));
            assertEquals(1 + 2L * rounds, stored.version());
        }

        private Void recordRounds(CountDownLatch go, String id, RunCounter counter, int rounds) throws Exception {
            go.await();
            for (int i = 1; i <= rounds; i++) {
                tracker.recordCounter(id, counter, i);
            }
            return null;
        }
    }

    @Nested
    @DisplayName("Recovery")
    class Recovery {

        @Test
        @DisplayName("Should fail runs left active longer than the max age")
        void recoversAbandoned() {
            String id = tracker.request("scheduler").requestId();
            tracker.start(id);
            clock.advance(Duration.ofHours(13));

            int recovered = tracker.recoverAbandoned(Duration.ofHours(12));

            assertEquals(1, recovered);
            OrchestrationRun run = tracker.find(id).orElseThrow();
            assertEquals(RunStatus.FAILED, run.status());
            assertTrue(run.errorMessage().startsWith("Abandoned"));
            assertDoesNotThrow(() -> tracker.request("api"));
        }

        @Test
        @DisplayName("Should leave recent active runs alone")
        void leavesRecentRuns() {
            String id = tracker.request("scheduler").requestId();
            clock.advance(Duration.ofHours(1));

            assertEquals(0, tracker.recoverAbandoned(Duration.ofHours(12)));
            assertEquals(RunStatus.QUEUED, tracker.find(id).orElseThrow().status());
        }
    }

    @Test
    @DisplayName("recent() should list newest first")
    void recentNewestFirst() {
        String first = tracker.request("a").requestId();
        tracker.fail(first, "x");
        clock.advance(Duration.ofMinutes(1));
        String second = tracker.request("b").requestId();

        List<OrchestrationRun> recent = tracker.recent(10);

        assertEquals(List.of(second, first), recent.stream().map(OrchestrationRun::requestId).toList());
    }

    @Test
    @DisplayName("A snapshot should require completedAt exactly when terminal")
    void snapshotValidation() {
        assertThrows(IllegalArgumentException.class, () -> new OrchestrationRun("r", "a", RunStatus.COMPLETED,
                START, START, null, null, null, null, null, null, null, 0));
        assertThrows(IllegalArgumentException.class, () -> new OrchestrationRun("r", "a", RunStatus.RUNNING,
                START, START, START, null, null, null, null, null, null, 0));
        assertThrows(IllegalArgumentException.class, () -> new OrchestrationRun("r", "a", RunStatus.RUNNING,
                START, START, null, null, null, null, null, null, null, -1));
    }
}
