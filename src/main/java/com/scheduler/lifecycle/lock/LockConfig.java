package com.scheduler.lifecycle.lock;

/**
 * Configuration for run lock implementations.
 *
 * @param maxRetries     retries after a failed lock query before giving up
 * @param retryDelayMs   delay between retry attempts in milliseconds
 * @param lockTtlSeconds time after which an unreleased graph lock may be reclaimed
 */
public record LockConfig(int maxRetries, long retryDelayMs, long lockTtlSeconds) {

    public LockConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
        if (lockTtlSeconds <= 0) {
            throw new IllegalArgumentException("lockTtlSeconds must be > 0");
        }
    }

    /**
     * Default configuration: 2 retries, 200ms delay, 6 hour TTL.
     * The TTL must exceed the longest expected maintenance run.
     */
    public static LockConfig defaults() {
        return new LockConfig(2, 200, 6 * 60 * 60);
    }
}
