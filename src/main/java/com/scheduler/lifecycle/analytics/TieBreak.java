package com.scheduler.lifecycle.analytics;

/**
 * Ordering of start and end events that fall on the same instant.
 */
public enum TieBreak {
    /**
     * An execution ending at t and another starting at t never overlap.
     */
    END_BEFORE_START,
    /**
     * An execution ending at t and another starting at t count as simultaneous for that instant.
     */
    START_BEFORE_END
}
