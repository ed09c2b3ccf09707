package com.scheduler.lifecycle.maintenance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Triggers {@link MaintenanceOrchestrator#runMaintenance(CancellationToken)} once a day at a
 * fixed UTC hour on a single background thread. If a run throws, the next attempt is made
 * after {@link #RETRY_DELAY} instead of waiting for the next day.
 */
public class MaintenanceScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    public static final int DEFAULT_HOUR_UTC = 2;
    public static final Duration RETRY_DELAY = Duration.ofHours(1);

    private final MaintenanceOrchestrator orchestrator;
    private final int dailyHourUtc;
    private final Clock clock;
    private final ScheduledExecutorService executor;
    private volatile CancellationToken currentRun;
    private volatile ScheduledFuture<?> nextRun;
    private volatile boolean closed;

    public MaintenanceScheduler(MaintenanceOrchestrator orchestrator) {
        this(orchestrator, DEFAULT_HOUR_UTC, Clock.systemUTC());
    }

    public MaintenanceScheduler(MaintenanceOrchestrator orchestrator, int dailyHourUtc, Clock clock) {
        if (dailyHourUtc < 0 || dailyHourUtc > 23) {
            throw new IllegalArgumentException("dailyHourUtc must be between 0 and 23");
        }
        this.orchestrator = orchestrator;
        this.dailyHourUtc = dailyHourUtc;
        this.clock = clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "maintenance-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        Duration delay = delayUntilNextRun();
        log.info("maintenance.scheduler.started hourUtc={} firstRunIn={}", dailyHourUtc, delay);
        schedule(delay);
    }

    /**
     * Time until the next occurrence of the configured hour, strictly in the future.
     */
    Duration delayUntilNextRun() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        ZonedDateTime next = now.toLocalDate().atTime(dailyHourUtc, 0).atZone(ZoneOffset.UTC);
        if (!next.isAfter(now)) {
            next = next.plusDays(1);
        }
        return Duration.between(now, next);
    }

    void runOnce() {
        CancellationToken token = CancellationToken.create();
        currentRun = token;
        Duration nextDelay;
        try {
            MaintenanceResult result = orchestrator.runMaintenance(token);
            log.info("maintenance.scheduler.runFinished result={}", result);
            nextDelay = delayUntilNextRun();
        } catch (RuntimeException e) {
            log.error("maintenance.scheduler.runFailed retryIn={}", RETRY_DELAY, e);
            nextDelay = RETRY_DELAY;
        } finally {
            currentRun = null;
        }
        schedule(nextDelay);
    }

    private void schedule(Duration delay) {
        if (closed) {
            return;
        }
        nextRun = executor.schedule(this::runOnce, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        closed = true;
        ScheduledFuture<?> pending = nextRun;
        if (pending != null) {
            pending.cancel(false);
        }
        CancellationToken running = currentRun;
        if (running != null) {
            running.cancel();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("maintenance.scheduler.stopped");
    }
}
