package com.scheduler.lifecycle.metrics;

import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.run.RunStatus;

import java.time.Duration;

/**
 * Interface for recording data-lifecycle metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a meter registry.
 */
public interface MetricsService {

    void recordArchived(EntityKind kind, long count);

    void recordPurged(EntityKind kind, long count);

    void recordLogFilesDeleted(long count, long bytesFreed);

    /**
     * @param outcome {@code success}, {@code failure}, {@code cancelled} or {@code rejected}
     */
    void recordMaintenanceRun(String outcome, Duration duration);

    void incrementStepFailure(String step);

    void recordOrchestrationRun(RunStatus status, Duration duration);
}
