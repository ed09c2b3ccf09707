package com.scheduler.lifecycle.maintenance;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for maintenance work.
 * Checked at batch, entity-kind, phase and file boundaries; work in progress is never interrupted.
 */
public final class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
