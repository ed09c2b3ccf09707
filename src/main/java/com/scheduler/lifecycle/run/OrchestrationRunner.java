package com.scheduler.lifecycle.run;

import com.scheduler.lifecycle.logging.LogContext;
import com.scheduler.lifecycle.maintenance.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Executes orchestration steps asynchronously for tracked runs.
 *
 * <p>{@link #submit(String)} queues a run through the {@link RunStateTracker} and hands it
 * to a single worker thread, which moves it to RUNNING, executes the steps in order and
 * finishes it as COMPLETED or FAILED. Runs never overlap.</p>
 */
public class OrchestrationRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OrchestrationRunner.class);

    static final String CANCELLED_MESSAGE = "Operation was cancelled";

    private final RunStateTracker tracker;
    private final List<OrchestrationStep> steps;
    private final ExecutorService executor;
    private final CancellationToken cancellation = CancellationToken.create();

    public OrchestrationRunner(RunStateTracker tracker, List<OrchestrationStep> steps) {
        this.tracker = Objects.requireNonNull(tracker, "tracker is required");
        this.steps = List.copyOf(steps);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "orchestration-runner");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Queues a run and schedules it for execution.
     *
     * @return the QUEUED run
     * @throws RunAlreadyActiveException if another run is active
     * @throws IllegalStateException     if the runner has been closed
     */
    public OrchestrationRun submit(String requestedBy) {
        OrchestrationRun run = tracker.request(requestedBy);
        try {
            executor.submit(() -> execute(run.requestId()));
        } catch (RejectedExecutionException e) {
            tracker.fail(run.requestId(), "Runner is shut down");
            throw new IllegalStateException("Orchestration runner is shut down", e);
        }
        return run;
    }

    /**
     * Like {@link #submit(String)}, returning a future that completes once the run is finished.
     */
    public Future<OrchestrationRun> submitAndTrack(String requestedBy) {
        OrchestrationRun run = tracker.request(requestedBy);
        try {
            return executor.submit(() -> {
                execute(run.requestId());
                return tracker.find(run.requestId()).orElseThrow();
            });
        } catch (RejectedExecutionException e) {
            tracker.fail(run.requestId(), "Runner is shut down");
            throw new IllegalStateException("Orchestration runner is shut down", e);
        }
    }

    void execute(String requestId) {
        try (LogContext ctx = LogContext.forOrchestration(requestId)) {
            tracker.start(requestId);
            int index = 0;
            for (OrchestrationStep step : steps) {
                if (cancellation.isCancelled()) {
                    tracker.fail(requestId, CANCELLED_MESSAGE);
                    return;
                }
                index++;
                String label = "Step " + index + "/" + steps.size() + ": " + step.name();
                tracker.updateProgress(requestId, label, index - 1, steps.size());
                log.info("orchestration.step requestId={} step={}", requestId, label);
                step.execute(new StepContext(tracker, requestId, label, cancellation));
            }
            if (cancellation.isCancelled()) {
                tracker.fail(requestId, CANCELLED_MESSAGE);
                return;
            }
            tracker.complete(requestId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failQuietly(requestId, CANCELLED_MESSAGE);
        } catch (Exception e) {
            log.error("orchestration.stepFailed requestId={}", requestId, e);
            failQuietly(requestId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void failQuietly(String requestId, String message) {
        try {
            tracker.fail(requestId, message);
        } catch (IllegalRunTransitionException e) {
            log.warn("Run {} already finished, could not record failure '{}': {}",
                    requestId, message, e.getMessage());
        }
    }

    @Override
    public void close() {
        cancellation.cancel();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
