package com.scheduler.lifecycle.maintenance;

import com.scheduler.lifecycle.archival.ArchivalBatcher;
import com.scheduler.lifecycle.archival.ArchivalResult;
import com.scheduler.lifecycle.archival.ArchivePurger;
import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.lock.LocalRunLock;
import com.scheduler.lifecycle.lock.LockAcquisitionException;
import com.scheduler.lifecycle.lock.RunLock;
import com.scheduler.lifecycle.logfiles.LogFileReaper;
import com.scheduler.lifecycle.logfiles.LogReapResult;
import com.scheduler.lifecycle.logging.LogContext;
import com.scheduler.lifecycle.metrics.MetricsService;
import com.scheduler.lifecycle.metrics.NoOpMetricsService;
import com.scheduler.lifecycle.retention.RetentionPolicy;
import com.scheduler.lifecycle.retention.RetentionPolicyProvider;
import com.scheduler.lifecycle.store.ArchiveStore;
import com.scheduler.lifecycle.store.OperationalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Runs the full data-lifecycle pass: archive each entity kind, purge aged archives,
 * then reclaim old log files.
 *
 * <p>The retention policy is re-read from the provider at the start of every run.
 * A failing step is recorded in the result and the remaining steps still run.
 * Only one run may hold the maintenance lock at a time; a concurrent call returns
 * immediately with {@value #ALREADY_RUNNING}. This class never throws from
 * {@link #runMaintenance(CancellationToken)}.</p>
 */
public class MaintenanceOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceOrchestrator.class);

    public static final String LOCK_KEY = "scheduler-lifecycle:maintenance";
    public static final String ALREADY_RUNNING = "Maintenance already in progress";

    private final RetentionPolicyProvider policyProvider;
    private final ArchivalBatcher archivalBatcher;
    private final ArchivePurger archivePurger;
    private final LogFileReaper logFileReaper;
    private final RunLock runLock;
    private final MetricsService metricsService;
    private final Clock clock;

    public MaintenanceOrchestrator(RetentionPolicyProvider policyProvider,
                                   OperationalStore operationalStore,
                                   ArchiveStore archiveStore) {
        this(policyProvider,
                new ArchivalBatcher(operationalStore, archiveStore),
                new ArchivePurger(archiveStore),
                new LogFileReaper(),
                new LocalRunLock(),
                new NoOpMetricsService(),
                Clock.systemUTC());
    }

    public MaintenanceOrchestrator(RetentionPolicyProvider policyProvider,
                                   ArchivalBatcher archivalBatcher,
                                   ArchivePurger archivePurger,
                                   LogFileReaper logFileReaper,
                                   RunLock runLock,
                                   MetricsService metricsService,
                                   Clock clock) {
        this.policyProvider = Objects.requireNonNull(policyProvider, "policyProvider is required");
        this.archivalBatcher = Objects.requireNonNull(archivalBatcher, "archivalBatcher is required");
        this.archivePurger = Objects.requireNonNull(archivePurger, "archivePurger is required");
        this.logFileReaper = Objects.requireNonNull(logFileReaper, "logFileReaper is required");
        this.runLock = Objects.requireNonNull(runLock, "runLock is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public MaintenanceResult runMaintenance() {
        return runMaintenance(CancellationToken.NONE);
    }

    public MaintenanceResult runMaintenance(CancellationToken cancellation) {
        Instant startedAt = clock.instant();
        MaintenanceResult.Builder result = MaintenanceResult.builder(startedAt);

        try (LogContext ctx = LogContext.forMaintenance(LogContext.generateRunId())) {
            boolean acquired;
            try {
                acquired = runLock.tryAcquire(LOCK_KEY);
            } catch (LockAcquisitionException e) {
                log.error("maintenance.lockFailed", e);
                return finish(result.error("Could not acquire maintenance lock: " + e.getMessage()), "rejected");
            }
            if (!acquired) {
                log.warn("maintenance.rejected reason=alreadyRunning");
                return finish(result.error(ALREADY_RUNNING), "rejected");
            }

            try {
                log.info("maintenance.starting");
                execute(result, cancellation);
            } catch (RuntimeException e) {
                log.error("maintenance.unexpectedFailure", e);
                result.error("Maintenance failed: " + e.getMessage());
            } finally {
                runLock.release(LOCK_KEY);
            }

            if (cancellation.isCancelled()) {
                result.cancelled();
            }
            String outcome = result.hasErrors() ? "failure" : cancellation.isCancelled() ? "cancelled" : "success";
            return finish(result, outcome);
        }
    }

    private void execute(MaintenanceResult.Builder result, CancellationToken cancellation) {
        RetentionPolicy policy;
        try {
            policy = policyProvider.current();
        } catch (IllegalArgumentException e) {
            log.error("maintenance.invalidConfiguration error={}", e.getMessage());
            metricsService.incrementStepFailure("configuration");
            result.error("Invalid retention configuration: " + e.getMessage());
            return;
        }
        log.debug("maintenance.policy policy={}", policy);

        Instant now = clock.instant();
        if (policy.archivalEnabled()) {
            for (EntityKind kind : EntityKind.values()) {
                if (cancellation.isCancelled()) {
                    return;
                }
                Instant cutoff = now.minus(kind.retention(policy));
                try (LogContext kindCtx = LogContext.forArchival(kind.name(), "archive")) {
                    ArchivalResult archived = archivalBatcher.archive(kind, cutoff, policy.batchSize(), cancellation);
                    result.archival(archived);
                    metricsService.recordArchived(kind, archived.count());
                    if (!archived.isSuccess()) {
                        metricsService.incrementStepFailure("archive:" + kind.name());
                    }
                } catch (RuntimeException e) {
                    log.error("maintenance.archiveFailed kind={}", kind, e);
                    metricsService.incrementStepFailure("archive:" + kind.name());
                    result.error("Archiving " + kind + " failed: " + e.getMessage());
                }
            }

            Instant archiveCutoff = now.minus(policy.archiveRetention());
            for (EntityKind kind : EntityKind.values()) {
                if (cancellation.isCancelled()) {
                    return;
                }
                try (LogContext kindCtx = LogContext.forArchival(kind.name(), "purge")) {
                    ArchivalResult purged = archivePurger.purge(kind, archiveCutoff, policy.batchSize(), cancellation);
                    result.purge(purged);
                    metricsService.recordPurged(kind, purged.count());
                    if (!purged.isSuccess()) {
                        metricsService.incrementStepFailure("purge:" + kind.name());
                    }
                } catch (RuntimeException e) {
                    log.error("maintenance.purgeFailed kind={}", kind, e);
                    metricsService.incrementStepFailure("purge:" + kind.name());
                    result.error("Purging " + kind + " archives failed: " + e.getMessage());
                }
            }
        } else {
            log.info("maintenance.archivalDisabled");
        }

        Instant logCutoff = now.minus(policy.logRetention());
        for (Path directory : policy.logDirectories()) {
            if (cancellation.isCancelled()) {
                return;
            }
            try {
                LogReapResult reaped = logFileReaper.reap(directory, policy.logFilePatterns(), logCutoff, cancellation);
                result.logs(reaped);
                metricsService.recordLogFilesDeleted(reaped.deletedCount(), reaped.bytesFreed());
            } catch (RuntimeException e) {
                log.error("maintenance.logCleanupFailed directory={}", directory, e);
                metricsService.incrementStepFailure("logs");
                result.error("Log cleanup failed for " + directory + ": " + e.getMessage());
            }
        }
    }

    private MaintenanceResult finish(MaintenanceResult.Builder builder, String outcome) {
        MaintenanceResult result = builder.build(clock.instant());
        metricsService.recordMaintenanceRun(outcome, result.duration());
        if (result.success()) {
            log.info("maintenance.completed archived={} purged={} logFiles={} bytesFreed={} cancelled={} duration={}",
                    result.totalArchived(), result.totalPurged(), result.logFilesDeleted(),
                    result.logBytesFreed(), result.cancelled(), result.duration());
        } else {
            log.warn("maintenance.completedWithErrors archived={} purged={} logFiles={} errors={}",
                    result.totalArchived(), result.totalPurged(), result.logFilesDeleted(), result.errorMessage());
        }
        return result;
    }
}
