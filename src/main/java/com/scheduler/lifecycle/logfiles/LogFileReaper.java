package com.scheduler.lifecycle.logfiles;

import com.scheduler.lifecycle.maintenance.CancellationToken;
import com.scheduler.lifecycle.retention.RetentionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Deletes log files older than a cutoff from a single directory.
 * Only regular files whose name matches one of the glob patterns are considered;
 * subdirectories are not descended into.
 */
public class LogFileReaper {
    private static final Logger log = LoggerFactory.getLogger(LogFileReaper.class);

    public LogReapResult reap(Path directory, Instant cutoff) {
        return reap(directory, RetentionPolicy.DEFAULT_LOG_PATTERNS, cutoff, CancellationToken.NONE);
    }

    /**
     * Deletes matching files last modified strictly before {@code cutoff}.
     * A missing directory yields an empty result. Files that cannot be deleted are logged and skipped.
     */
    public LogReapResult reap(Path directory, List<String> patterns, Instant cutoff, CancellationToken cancellation) {
        Objects.requireNonNull(directory, "directory is required");
        Objects.requireNonNull(cutoff, "cutoff is required");

        if (!Files.isDirectory(directory)) {
            log.debug("logs.directoryMissing directory={}", directory);
            return LogReapResult.empty();
        }

        List<PathMatcher> matchers = patterns.stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p))
                .toList();

        long deleted = 0;
        long bytesFreed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                if (cancellation.isCancelled()) {
                    log.info("logs.cancelled directory={} deleted={}", directory, deleted);
                    break;
                }
                if (!Files.isRegularFile(file) || !matches(matchers, file)) {
                    continue;
                }
                try {
                    Instant lastModified = Files.getLastModifiedTime(file).toInstant();
                    if (!lastModified.isBefore(cutoff)) {
                        continue;
                    }
                    long size = Files.size(file);
                    Files.delete(file);
                    deleted++;
                    bytesFreed += size;
                    log.debug("logs.deleted file={} bytes={}", file, size);
                } catch (IOException e) {
                    log.warn("logs.deleteFailed file={} error={}", file, e.getMessage());
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            log.error("logs.listFailed directory={} deleted={}", directory, deleted, e);
        }

        log.info("logs.completed directory={} deleted={} bytesFreed={}", directory, deleted, bytesFreed);
        return new LogReapResult(deleted, bytesFreed);
    }

    private boolean matches(List<PathMatcher> matchers, Path file) {
        Path name = file.getFileName();
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }
}
