package com.scheduler.lifecycle.logfiles;

/**
 * Result of a log-file cleanup.
 *
 * @param deletedCount number of files deleted
 * @param bytesFreed   total size of the deleted files
 */
public record LogReapResult(long deletedCount, long bytesFreed) {

    public static LogReapResult empty() {
        return new LogReapResult(0, 0);
    }

    public LogReapResult plus(LogReapResult other) {
        return new LogReapResult(deletedCount + other.deletedCount, bytesFreed + other.bytesFreed);
    }
}
