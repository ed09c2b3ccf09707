package com.scheduler.lifecycle.store;

/**
 * Runtime exception raised when an operational or archive store cannot complete a unit of work.
 * Treated as transient by the maintenance run: it fails the current entity kind only.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
