package com.scheduler.lifecycle.health;

import com.scheduler.lifecycle.run.OrchestrationRun;
import com.scheduler.lifecycle.run.OrchestrationRunRepository;
import com.scheduler.lifecycle.run.RunCounter;
import com.scheduler.lifecycle.run.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Classifies orchestrator health from recorded runs.
 *
 * <ul>
 *   <li>A QUEUED or RUNNING run: UP, reported as in progress.</li>
 *   <li>No COMPLETED run ever: DEGRADED.</li>
 *   <li>Last completion older than the threshold: DEGRADED, with the last failure if any.</li>
 *   <li>Otherwise UP.</li>
 *   <li>Runs cannot be read: DOWN.</li>
 * </ul>
 */
public class OrchestrationHealthCheck implements HealthCheck {
    private static final Logger log = LoggerFactory.getLogger(OrchestrationHealthCheck.class);

    public static final Duration DEFAULT_THRESHOLD = Duration.ofHours(26);

    private final OrchestrationRunRepository repository;
    private final Duration defaultThreshold;
    private final Clock clock;

    public OrchestrationHealthCheck(OrchestrationRunRepository repository) {
        this(repository, DEFAULT_THRESHOLD, Clock.systemUTC());
    }

    public OrchestrationHealthCheck(OrchestrationRunRepository repository, Duration defaultThreshold, Clock clock) {
        if (defaultThreshold.isNegative() || defaultThreshold.isZero()) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        this.repository = repository;
        this.defaultThreshold = defaultThreshold;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "orchestrator";
    }

    @Override
    public HealthStatus check() {
        return check(defaultThreshold);
    }

    public HealthStatus check(Duration threshold) {
        Instant now = clock.instant();
        double thresholdHours = hours(threshold);

        List<OrchestrationRun> active;
        Optional<OrchestrationRun> lastRun;
        Optional<OrchestrationRun> lastSuccessful;
        try {
            active = repository.findActive();
            lastRun = repository.findLatest();
            lastSuccessful = repository.findLatestCompleted();
        } catch (RuntimeException e) {
            log.error("health.orchestrator.readFailed", e);
            return HealthStatus.down("Health check failed: " + e.getMessage())
                    .withDetail("maxHoursSinceLastRun", thresholdHours);
        }

        if (!active.isEmpty()) {
            OrchestrationRun current = active.get(0);
            return HealthStatus.up("Orchestrator is currently " + current.status().name().toLowerCase(Locale.ROOT))
                    .withDetail("isCurrentlyRunning", true)
                    .withDetail("currentRunRequestId", current.requestId())
                    .withDetail("currentRunStatus", current.status().name())
                    .withDetail("currentStep", current.currentStep())
                    .withDetail("currentProgress", current.currentProgress())
                    .withDetail("lastSuccessfulRunTime",
                            lastSuccessful.map(OrchestrationRun::completedAt).orElse(null))
                    .withDetail("maxHoursSinceLastRun", thresholdHours);
        }

        if (lastSuccessful.isEmpty()) {
            log.warn("health.orchestrator.noSuccessfulRuns");
            HealthStatus status = HealthStatus.degraded("No successful orchestration runs found")
                    .withDetail("isCurrentlyRunning", false)
                    .withDetail("maxHoursSinceLastRun", thresholdHours);
            if (lastRun.isPresent()) {
                status = status.withDetail("lastRunStatus", lastRun.get().status().name())
                        .withDetail("lastRunRequestId", lastRun.get().requestId())
                        .withDetail("lastRunErrorMessage", lastRun.get().errorMessage());
            }
            return status;
        }

        OrchestrationRun success = lastSuccessful.get();
        Instant lastSuccessTime = success.completedAt();
        double hoursSince = Math.round(hours(Duration.between(lastSuccessTime, now)) * 10.0) / 10.0;

        HealthStatus status;
        if (!lastSuccessTime.isBefore(now.minus(threshold))) {
            status = HealthStatus.up("Orchestrator ran successfully " + hoursSince + " hours ago");
        } else {
            log.warn("health.orchestrator.stale hoursSinceLastSuccess={} thresholdHours={}", hoursSince, thresholdHours);
            status = HealthStatus.degraded("Orchestrator has not run successfully in " + hoursSince
                    + " hours (threshold: " + thresholdHours + " hours)");
            if (lastRun.isPresent() && lastRun.get().status() == RunStatus.FAILED) {
                status = status.withDetail("lastRunErrorMessage", lastRun.get().errorMessage());
            }
        }

        status = status.withDetail("isCurrentlyRunning", false)
                .withDetail("lastSuccessfulRunTime", lastSuccessTime)
                .withDetail("hoursSinceLastSuccessfulRun", hoursSince)
                .withDetail("lastRunStatus", lastRun.map(r -> r.status().name()).orElse(null))
                .withDetail("lastRunRequestId", success.requestId())
                .withDetail("maxHoursSinceLastRun", thresholdHours);
        for (RunCounter counter : RunCounter.values()) {
            status = status.withDetail(counter.propertyName(), success.counter(counter));
        }
        return status;
    }

    private static double hours(Duration duration) {
        return duration.toMillis() / 3_600_000.0;
    }
}
