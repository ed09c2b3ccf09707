package com.scheduler.lifecycle.run;

import com.scheduler.lifecycle.metrics.MetricsService;
import com.scheduler.lifecycle.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * State machine for orchestration runs.
 *
 * <pre>
 * QUEUED -&gt; RUNNING -&gt; COMPLETED
 *    |         |
 *    +---------+-----&gt; FAILED
 * </pre>
 *
 * <p>At most one run is QUEUED or RUNNING at a time. Every transition is a
 * compare-and-set on the stored status, so two callers racing on the same run
 * cannot both succeed. Terminal states are final.</p>
 */
public class RunStateTracker {
    private static final Logger log = LoggerFactory.getLogger(RunStateTracker.class);

    private static final Set<RunStatus> QUEUED_ONLY = EnumSet.of(RunStatus.QUEUED);
    private static final Set<RunStatus> RUNNING_ONLY = EnumSet.of(RunStatus.RUNNING);
    private static final Set<RunStatus> ACTIVE = EnumSet.of(RunStatus.QUEUED, RunStatus.RUNNING);

    private final OrchestrationRunRepository repository;
    private final MetricsService metricsService;
    private final Clock clock;

    public RunStateTracker(OrchestrationRunRepository repository) {
        this(repository, new NoOpMetricsService(), Clock.systemUTC());
    }

    public RunStateTracker(OrchestrationRunRepository repository, MetricsService metricsService, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Queues a new run.
     *
     * @throws RunAlreadyActiveException if another run is QUEUED or RUNNING
     */
    public OrchestrationRun request(String requestedBy) {
        OrchestrationRun run = OrchestrationRun.queued(UUID.randomUUID().toString(), requestedBy, clock.instant());
        if (!repository.insertIfNoneActive(run)) {
            String activeId = repository.findActive().stream()
                    .findFirst()
                    .map(OrchestrationRun::requestId)
                    .orElse(null);
            log.warn("orchestration.rejected requestedBy={} activeRun={}", requestedBy, activeId);
            throw new RunAlreadyActiveException(activeId);
        }
        log.info("orchestration.queued requestId={} requestedBy={}", run.requestId(), requestedBy);
        return run;
    }

    public OrchestrationRun start(String requestId) {
        OrchestrationRun run = transition(requestId, QUEUED_ONLY, "start", r -> r.started(clock.instant()));
        log.info("orchestration.started requestId={}", requestId);
        return run;
    }

    /**
     * Records progress of the current step as {@code "processed/total"}.
     */
    public OrchestrationRun updateProgress(String requestId, String step, long processed, long total) {
        if (processed < 0 || total < 0) {
            throw new IllegalArgumentException("processed and total must be >= 0");
        }
        return transition(requestId, RUNNING_ONLY, "update progress of",
                r -> r.progressed(step, processed, total));
    }

    public OrchestrationRun recordCounter(String requestId, RunCounter counter, long value) {
        Objects.requireNonNull(counter, "counter is required");
        return transition(requestId, RUNNING_ONLY, "record counters on", r -> r.withCounter(counter, value));
    }

    public OrchestrationRun complete(String requestId) {
        OrchestrationRun run = transition(requestId, RUNNING_ONLY, "complete", r -> r.completed(clock.instant()));
        log.info("orchestration.completed requestId={} duration={}", requestId, run.duration());
        recordTerminal(run);
        return run;
    }

    public OrchestrationRun fail(String requestId, String errorMessage) {
        OrchestrationRun run = transition(requestId, ACTIVE, "fail", r -> r.failed(clock.instant(), errorMessage));
        log.warn("orchestration.failed requestId={} error={}", requestId, errorMessage);
        recordTerminal(run);
        return run;
    }

    /**
     * Fails QUEUED or RUNNING runs requested more than {@code maxAge} ago.
     * A process that died mid-run would otherwise hold the single-flight slot forever.
     *
     * @return the number of runs recovered
     */
    public int recoverAbandoned(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int recovered = 0;
        for (OrchestrationRun run : repository.findActive()) {
            if (!run.requestedAt().isBefore(cutoff)) {
                continue;
            }
            try {
                fail(run.requestId(), "Abandoned: run was still " + run.status()
                        + " after " + maxAge + "; marked as failed by recovery");
                recovered++;
            } catch (IllegalRunTransitionException e) {
                log.debug("Run {} finished while being recovered: {}", run.requestId(), e.getMessage());
            }
        }
        if (recovered > 0) {
            log.warn("orchestration.recovered count={} cutoff={}", recovered, cutoff);
        }
        return recovered;
    }

    public Optional<OrchestrationRun> find(String requestId) {
        return repository.findById(requestId);
    }

    public List<OrchestrationRun> recent(int limit) {
        return repository.findRecent(limit);
    }

    /**
     * Applies {@code change} to the latest stored snapshot. A swap lost to a concurrent write is
     * retried against the newer snapshot, so progress and counter updates never overwrite each other;
     * the retry fails once the stored status no longer allows the operation.
     */
    private OrchestrationRun transition(String requestId, Set<RunStatus> allowedFrom, String operation,
                                        UnaryOperator<OrchestrationRun> change) {
        while (true) {
            OrchestrationRun current = repository.findById(requestId)
                    .orElseThrow(() -> new IllegalArgumentException("Orchestration run not found: " + requestId));
            if (!allowedFrom.contains(current.status())) {
                throw new IllegalRunTransitionException(requestId, current.status(), operation);
            }
            OrchestrationRun updated = change.apply(current).nextVersion();
            if (repository.compareAndSet(updated, current.status(), current.version())) {
                return updated;
            }
            log.debug("Run {} changed during {} (version {}), retrying", requestId, operation, current.version());
        }
    }

    private void recordTerminal(OrchestrationRun run) {
        Duration duration = run.duration() != null
                ? run.duration()
                : Duration.between(run.requestedAt(), run.completedAt());
        metricsService.recordOrchestrationRun(run.status(), duration);
    }
}
