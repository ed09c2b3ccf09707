package com.scheduler.lifecycle.run;

/**
 * Thrown when a run is requested while another run is QUEUED or RUNNING.
 */
public class RunAlreadyActiveException extends IllegalStateException {

    private final String activeRequestId;

    public RunAlreadyActiveException(String activeRequestId) {
        super("An orchestration run is already active"
                + (activeRequestId != null ? ": " + activeRequestId : ""));
        this.activeRequestId = activeRequestId;
    }

    /**
     * The run holding the single-flight slot, or null if it finished before it could be read.
     */
    public String getActiveRequestId() {
        return activeRequestId;
    }
}
