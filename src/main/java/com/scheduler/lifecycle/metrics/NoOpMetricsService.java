package com.scheduler.lifecycle.metrics;

import com.scheduler.lifecycle.core.model.EntityKind;
import com.scheduler.lifecycle.run.RunStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordArchived(EntityKind kind, long count) {
    }

    @Override
    public void recordPurged(EntityKind kind, long count) {
    }

    @Override
    public void recordLogFilesDeleted(long count, long bytesFreed) {
    }

    @Override
    public void recordMaintenanceRun(String outcome, Duration duration) {
    }

    @Override
    public void incrementStepFailure(String step) {
    }

    @Override
    public void recordOrchestrationRun(RunStatus status, Duration duration) {
    }
}
