package com.scheduler.lifecycle.retention;

import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Reads the retention policy from MicroProfile Config on every call.
 *
 * <p>Durations are ISO-8601 strings ({@code P90D}, {@code PT12H}). Lists are comma separated.
 * Missing keys fall back to {@link RetentionPolicy#defaults()}.</p>
 *
 * <pre>
 * scheduler-lifecycle.retention.job=P365D
 * scheduler-lifecycle.retention.job-execution=P365D
 * scheduler-lifecycle.retention.audit-log=P90D
 * scheduler-lifecycle.retention.archive=P2555D
 * scheduler-lifecycle.retention.log-files=P30D
 * scheduler-lifecycle.archival.enabled=true
 * scheduler-lifecycle.archival.batch-size=5000
 * scheduler-lifecycle.logs.directories=logs,../logs
 * scheduler-lifecycle.logs.patterns=*.log,*.txt
 * </pre>
 */
public class MicroProfileRetentionPolicyProvider implements RetentionPolicyProvider {
    private static final Logger log = LoggerFactory.getLogger(MicroProfileRetentionPolicyProvider.class);

    static final String PREFIX = "scheduler-lifecycle.";

    private final Config config;

    public MicroProfileRetentionPolicyProvider(Config config) {
        this.config = config;
    }

    @Override
    public RetentionPolicy current() {
        RetentionPolicy defaults = RetentionPolicy.defaults();
        RetentionPolicy policy = RetentionPolicy.builder()
                .jobRetention(duration("retention.job", defaults.jobRetention()))
                .jobExecutionRetention(duration("retention.job-execution", defaults.jobExecutionRetention()))
                .auditLogRetention(duration("retention.audit-log", defaults.auditLogRetention()))
                .archiveRetention(duration("retention.archive", defaults.archiveRetention()))
                .logRetention(duration("retention.log-files", defaults.logRetention()))
                .batchSize(integer("archival.batch-size", defaults.batchSize()))
                .archivalEnabled(bool("archival.enabled", defaults.archivalEnabled()))
                .logDirectories(list("logs.directories")
                        .map(values -> values.stream().map(Path::of).toList())
                        .orElse(defaults.logDirectories()))
                .logFilePatterns(list("logs.patterns").orElse(defaults.logFilePatterns()))
                .build();
        log.debug("retention.policyLoaded policy={}", policy);
        return policy;
    }

    private Optional<String> raw(String key) {
        return config.getOptionalValue(PREFIX + key, String.class)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    private Duration duration(String key, Duration fallback) {
        Optional<String> value = raw(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Duration.parse(value.get());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an ISO-8601 duration: " + value.get(), e);
        }
    }

    private int integer(String key, int fallback) {
        Optional<String> value = raw(key);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.get());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: " + value.get(), e);
        }
    }

    private boolean bool(String key, boolean fallback) {
        return raw(key).map(Boolean::parseBoolean).orElse(fallback);
    }

    private Optional<List<String>> list(String key) {
        return raw(key).map(value -> Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList());
    }
}
