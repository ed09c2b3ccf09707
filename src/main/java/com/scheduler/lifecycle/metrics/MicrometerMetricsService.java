package com.scheduler.lifecycle.metrics;

import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.run.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code lifecycle.archived} (Counter, tag: entityKind)</li>
 *   <li>{@code lifecycle.purged} (Counter, tag: entityKind)</li>
 *   <li>{@code lifecycle.logs.deleted} (Counter)</li>
 *   <li>{@code lifecycle.logs.bytes.freed} (Counter, base unit bytes)</li>
 *   <li>{@code lifecycle.maintenance.duration} (Timer, tag: outcome)</li>
 *   <li>{@code lifecycle.maintenance.step.failures} (Counter, tag: step)</li>
 *   <li>{@code lifecycle.orchestration.duration} (Timer, tag: status)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter logFilesDeleted;
    private final Counter logBytesFreed;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.logFilesDeleted = Counter.builder("lifecycle.logs.deleted")
                .description("Number of log files deleted")
                .register(registry);
        this.logBytesFreed = Counter.builder("lifecycle.logs.bytes.freed")
                .description("Disk space reclaimed by log cleanup")
                .baseUnit("bytes")
                .register(registry);
    }

    @Override
    public void recordArchived(EntityKind kind, long count) {
        kindCounter("lifecycle.archived", "Records moved to archive storage", kind).increment(count);
    }

    @Override
    public void recordPurged(EntityKind kind, long count) {
        kindCounter("lifecycle.purged", "Archive records permanently deleted", kind).increment(count);
    }

    @Override
    public void recordLogFilesDeleted(long count, long bytesFreed) {
        logFilesDeleted.increment(count);
        logBytesFreed.increment(bytesFreed);
    }

    @Override
    public void recordMaintenanceRun(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("maintenance:" + outcome, k ->
                Timer.builder("lifecycle.maintenance.duration")
                        .description("Duration of maintenance runs")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementStepFailure(String step) {
        Counter counter = counterCache.computeIfAbsent("stepFailure:" + step, k ->
                Counter.builder("lifecycle.maintenance.step.failures")
                        .description("Maintenance steps that ended with an error")
                        .tag("step", step)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordOrchestrationRun(RunStatus status, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("orchestration:" + status.name(), k ->
                Timer.builder("lifecycle.orchestration.duration")
                        .description("Duration of orchestration runs")
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    private Counter kindCounter(String name, String description, EntityKind kind) {
        return counterCache.computeIfAbsent(name + ":" + kind.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("entityKind", kind.name())
                        .register(registry));
    }
}
