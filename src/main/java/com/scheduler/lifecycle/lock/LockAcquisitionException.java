package com.scheduler.lifecycle.lock;

/**
 * Runtime exception thrown when the state of a run lock cannot be determined,
 * for instance because the lock store is unreachable.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
