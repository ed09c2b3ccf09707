package com.scheduler.lifecycle.run;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrchestrationRunner")
class OrchestrationRunnerTest {

    private InMemoryOrchestrationRunRepository repository;
    private RunStateTracker tracker;
    private OrchestrationRunner runner;

    @BeforeEach
    void setUp() {
        repository = new InMemoryOrchestrationRunRepository();
        tracker = new RunStateTracker(repository);
    }

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.close();
        }
    }

    @Test
    @DisplayName("Should run every step in order and complete the run")
    void runsStepsInOrder() throws Exception {
        List<String> executed = Collections.synchronizedList(new ArrayList<>());
        runner = new OrchestrationRunner(tracker, List.of(
                OrchestrationStep.of("Sync accounts", ctx -> {
                    executed.add(ctx.stepName());
                    ctx.reportProgress(10, 10);
                    ctx.recordCounter(RunCounter.SYNC_ACCOUNTS_TOTAL, 10);
                }),
                OrchestrationStep.of("Create jobs", ctx -> {
                    executed.add(ctx.stepName());
                    ctx.recordCounter(RunCounter.JOBS_CREATED, 4);
                })));

        OrchestrationRun run = runner.submitAndTrack("scheduler").get(10, TimeUnit.SECONDS);

        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals(List.of("Step 1/2: Sync accounts", "Step 2/2: Create jobs"), executed);
        assertEquals(10, run.counter(RunCounter.SYNC_ACCOUNTS_TOTAL));
        assertEquals(4, run.counter(RunCounter.JOBS_CREATED));
        assertNotNull(run.startedAt());
    }

    @Test
    @DisplayName("A throwing step should fail the run with its message and skip later steps")
    void failingStep() throws Exception {
        List<String> executed = Collections.synchronizedList(new ArrayList<>());
        runner = new OrchestrationRunner(tracker, List.of(
                OrchestrationStep.of("Verify credentials", ctx -> {
                    throw new IllegalStateException("credential store unavailable");
                }),
                OrchestrationStep.of("Request scraping", ctx -> executed.add(ctx.stepName()))));

        OrchestrationRun run = runner.submitAndTrack("api").get(10, TimeUnit.SECONDS);

        assertEquals(RunStatus.FAILED, run.status());
        assertEquals("credential store unavailable", run.errorMessage());
        assertTrue(executed.isEmpty());
    }

    @Test
    @DisplayName("Should reject a submission while a run is active")
    void rejectsWhileActive() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        runner = new OrchestrationRunner(tracker, List.of(
                OrchestrationStep.of("Long step", ctx -> {
                    started.countDown();
                    release.await(10, TimeUnit.SECONDS);
                })));

        Future<OrchestrationRun> first = runner.submitAndTrack("scheduler");
        assertTrue(started.await(10, TimeUnit.SECONDS));

        assertThrows(RunAlreadyActiveException.class, () -> runner.submit("api"));

        release.countDown();
        assertEquals(RunStatus.COMPLETED, first.get(10, TimeUnit.SECONDS).status());
        assertEquals(1, repository.findRecent(10).size());
    }

    @Test
    @DisplayName("Steps should see cancellation once the runner closes")
    void closeCancelsRun() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        runner = new OrchestrationRunner(tracker, List.of(
                OrchestrationStep.of("Poll", ctx -> {
                    started.countDown();
                    while (!ctx.isCancelled()) {
                        Thread.sleep(10);
                    }
                }),
                OrchestrationStep.of("Never reached", ctx -> fail("should not run"))));

        String requestId = runner.submit("scheduler").requestId();
        assertTrue(started.await(10, TimeUnit.SECONDS));
        runner.close();

        OrchestrationRun run = tracker.find(requestId).orElseThrow();
        assertEquals(RunStatus.FAILED, run.status());
        assertEquals(OrchestrationRunner.CANCELLED_MESSAGE, run.errorMessage());
    }

    @Test
    @DisplayName("Submitting after close should fail the queued run")
    void submitAfterClose() {
        runner = new OrchestrationRunner(tracker, List.of());
        runner.close();

        assertThrows(IllegalStateException.class, () -> runner.submit("api"));
        OrchestrationRun run = repository.findLatest().orElseThrow();
        assertEquals(RunStatus.FAILED, run.status());
        assertTrue(repository.findActive().isEmpty());
    }
}
