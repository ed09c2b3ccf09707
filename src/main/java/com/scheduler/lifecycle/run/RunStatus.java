package com.scheduler.lifecycle.run;

/**
 * Lifecycle states of an orchestration run.
 */
public enum RunStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    /**
     * Returns true for states that occupy the single-flight slot.
     */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
