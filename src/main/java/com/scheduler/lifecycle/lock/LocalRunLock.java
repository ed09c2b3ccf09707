package com.scheduler.lifecycle.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process run lock using {@link ReentrantLock}.
 * Suitable for single-JVM deployments. Not reentrant: a thread that already holds
 * the key is refused like any other caller.
 */
public class LocalRunLock implements RunLock {
    private static final Logger log = LoggerFactory.getLogger(LocalRunLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        if (lock.isHeldByCurrentThread()) {
            log.debug("Lock already held by current thread: {}", key);
            return false;
        }
        boolean acquired = lock.tryLock();
        log.debug("Lock {}: {}", acquired ? "acquired" : "busy", key);
        return acquired;
    }

    @Override
    public void release(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Lock released: {}", key);
        }
    }

    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
