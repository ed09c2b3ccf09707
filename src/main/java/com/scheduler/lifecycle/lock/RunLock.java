package com.scheduler.lifecycle.lock;

/**
 * Single-flight guard for maintenance runs.
 * Acquisition never waits for the current holder to finish: a held lock is reported
 * immediately so the caller can reject the second run.
 */
public interface RunLock {

    /**
     * Attempts to acquire the lock for the given key.
     *
     * @param key the lock key
     * @return true if the lock was acquired, false if another run holds it
     * @throws LockAcquisitionException if the lock state could not be determined
     */
    boolean tryAcquire(String key);

    /**
     * Releases a lock previously acquired by this instance.
     *
     * @param key the lock key
     */
    void release(String key);
}
