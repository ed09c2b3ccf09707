package com.scheduler.lifecycle.retention;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for the data lifecycle.
 * Defines how long operational records stay live, how long archived copies are kept,
 * and how long log files survive on disk.
 *
 * @param jobRetention          how long to keep job definitions before archiving
 * @param jobExecutionRetention how long to keep job and schedule executions before archiving
 * @param auditLogRetention     how long to keep audit logs before archiving
 * @param archiveRetention      how long to keep archived records before permanent deletion
 * @param logRetention          how long to keep log files on disk
 * @param batchSize             records moved or deleted per batch
 * @param archivalEnabled       whether archival and archive purge run at all
 * @param logDirectories        directories scanned for log files
 * @param logFilePatterns       glob patterns selecting log files inside those directories
 */
public record RetentionPolicy(
        Duration jobRetention,
        Duration jobExecutionRetention,
        Duration auditLogRetention,
        Duration archiveRetention,
        Duration logRetention,
        int batchSize,
        boolean archivalEnabled,
        List<Path> logDirectories,
        List<String> logFilePatterns
) {
    public RetentionPolicy {
        requireNonNegative(jobRetention, "jobRetention");
        requireNonNegative(jobExecutionRetention, "jobExecutionRetention");
        requireNonNegative(auditLogRetention, "auditLogRetention");
        requireNonNegative(archiveRetention, "archiveRetention");
        requireNonNegative(logRetention, "logRetention");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        // Archives must outlive the operational copies they were made from
        requireLonger(archiveRetention, jobRetention, "jobRetention");
        requireLonger(archiveRetention, jobExecutionRetention, "jobExecutionRetention");
        requireLonger(archiveRetention, auditLogRetention, "auditLogRetention");
        logDirectories = logDirectories != null ? List.copyOf(logDirectories) : List.of();
        logFilePatterns = logFilePatterns != null && !logFilePatterns.isEmpty()
                ? List.copyOf(logFilePatterns) : DEFAULT_LOG_PATTERNS;
    }

    public static final List<String> DEFAULT_LOG_PATTERNS = List.of("*.log", "*.txt");

    private static void requireNonNegative(Duration duration, String name) {
        Objects.requireNonNull(duration, name + " is required");
        if (duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }

    private static void requireLonger(Duration archive, Duration operational, String name) {
        if (archive.compareTo(operational) <= 0) {
            throw new IllegalArgumentException(
                    "archiveRetention (" + archive + ") must be longer than " + name + " (" + operational + ")");
        }
    }

    /**
     * Creates the default policy.
     * - Jobs: 365 days
     * - Job and schedule executions: 365 days
     * - Audit logs: 90 days
     * - Archives: 7 years
     * - Log files: 30 days in ./logs
     * - Batches of 5000, archival enabled
     */
    public static RetentionPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration jobRetention = Duration.ofDays(365);
        private Duration jobExecutionRetention = Duration.ofDays(365);
        private Duration auditLogRetention = Duration.ofDays(90);
        private Duration archiveRetention = Duration.ofDays(2555);
        private Duration logRetention = Duration.ofDays(30);
        private int batchSize = 5000;
        private boolean archivalEnabled = true;
        private List<Path> logDirectories = List.of(Path.of("logs"));
        private List<String> logFilePatterns = DEFAULT_LOG_PATTERNS;

        public Builder jobRetention(Duration duration) {
            this.jobRetention = duration;
            return this;
        }

        public Builder jobExecutionRetention(Duration duration) {
            this.jobExecutionRetention = duration;
            return this;
        }

        public Builder auditLogRetention(Duration duration) {
            this.auditLogRetention = duration;
            return this;
        }

        public Builder archiveRetention(Duration duration) {
            this.archiveRetention = duration;
            return this;
        }

        public Builder logRetention(Duration duration) {
            this.logRetention = duration;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder archivalEnabled(boolean enabled) {
            this.archivalEnabled = enabled;
            return this;
        }

        public Builder logDirectories(List<Path> directories) {
            this.logDirectories = directories;
            return this;
        }

        public Builder logFilePatterns(List<String> patterns) {
            this.logFilePatterns = patterns;
            return this;
        }

        public RetentionPolicy build() {
            return new RetentionPolicy(jobRetention, jobExecutionRetention, auditLogRetention,
                    archiveRetention, logRetention, batchSize, archivalEnabled,
                    logDirectories, logFilePatterns);
        }
    }
}
