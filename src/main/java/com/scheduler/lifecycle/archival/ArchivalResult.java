package com.scheduler.lifecycle.archival;

import com.scheduler.lifecycle.core.model.EntityKind;

/**
 * Outcome of archiving or purging one entity kind.
 *
 * @param kind         the entity kind processed
 * @param count        records archived (or purged) before the run stopped
 * @param errorMessage the failure that stopped the kind early, or null
 * @param cancelled    whether the kind stopped because cancellation was requested
 */
public record ArchivalResult(EntityKind kind, long count, String errorMessage, boolean cancelled) {

    public static ArchivalResult completed(EntityKind kind, long count) {
        return new ArchivalResult(kind, count, null, false);
    }

    public static ArchivalResult failed(EntityKind kind, long count, String errorMessage) {
        return new ArchivalResult(kind, count, errorMessage, false);
    }

    public static ArchivalResult cancelled(EntityKind kind, long count) {
        return new ArchivalResult(kind, count, null, true);
    }

    public boolean isSuccess() {
        return errorMessage == null;
    }

    @Override
    public String toString() {
        return "ArchivalResult{kind=" + kind +
                ", count=" + count +
                (errorMessage != null ? ", error=" + errorMessage : "") +
                (cancelled ? ", cancelled" : "") + '}';
    }
}
