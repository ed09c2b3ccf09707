package com.scheduler.lifecycle.core.model;

import com.scheduler.lifecycle.retention.RetentionPolicy;

import java.time.Duration;
import java.util.function.Function;

/**
 * The operational record classes that age into archive storage.
 * Each kind supplies its store labels, the property that determines its age,
 * and the retention window that applies to it.
 */
public enum EntityKind {
    JOB("Job", "JobArchive", "createdAt", RetentionPolicy::jobRetention),
    JOB_EXECUTION("JobExecution", "JobExecutionArchive", "createdAt", RetentionPolicy::jobExecutionRetention),
    AUDIT_LOG("AuditLog", "AuditLogArchive", "timestamp", RetentionPolicy::auditLogRetention),
    // Schedule executions share the job-execution window
    SCHEDULE_EXECUTION("ScheduleExecution", "ScheduleExecutionArchive", "createdAt",
            RetentionPolicy::jobExecutionRetention);

    private final String operationalLabel;
    private final String archiveLabel;
    private final String ageField;
    private final Function<RetentionPolicy, Duration> retentionSelector;

    EntityKind(String operationalLabel, String archiveLabel, String ageField,
               Function<RetentionPolicy, Duration> retentionSelector) {
        this.operationalLabel = operationalLabel;
        this.archiveLabel = archiveLabel;
        this.ageField = ageField;
        this.retentionSelector = retentionSelector;
    }

    public String operationalLabel() {
        return operationalLabel;
    }

    public String archiveLabel() {
        return archiveLabel;
    }

    public String ageField() {
        return ageField;
    }

    /**
     * Returns how long records of this kind stay in the operational store.
     */
    public Duration retention(RetentionPolicy policy) {
        return retentionSelector.apply(policy);
    }
}
