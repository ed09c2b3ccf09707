package com.scheduler.lifecycle.rest.dto;

import com.scheduler.lifecycle.retention.RetentionPolicy;

import java.nio.file.Path;
import java.util.List;

/**
 * Current retention settings as exposed over REST. Durations are ISO-8601 strings.
 */
public record RetentionSettingsResponse(
        String jobRetention,
        String jobExecutionRetention,
        String auditLogRetention,
        String archiveRetention,
        String logRetention,
        int batchSize,
        boolean archivalEnabled,
        List<String> logDirectories,
        List<String> logFilePatterns
) {
    public static RetentionSettingsResponse from(RetentionPolicy policy) {
        return new RetentionSettingsResponse(
                policy.jobRetention().toString(),
                policy.jobExecutionRetention().toString(),
                policy.auditLogRetention().toString(),
                policy.archiveRetention().toString(),
                policy.logRetention().toString(),
                policy.batchSize(),
                policy.archivalEnabled(),
                policy.logDirectories().stream().map(Path::toString).toList(),
                policy.logFilePatterns()
        );
    }
}
