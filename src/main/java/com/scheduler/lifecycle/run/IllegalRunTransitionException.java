package com.scheduler.lifecycle.run;

/**
 * Thrown when an operation is not allowed in the run's current state,
 * for instance any change to a run that already completed or failed.
 */
public class IllegalRunTransitionException extends IllegalStateException {

    private final String requestId;
    private final RunStatus currentStatus;

    public IllegalRunTransitionException(String requestId, RunStatus currentStatus, String operation) {
        super("Cannot " + operation + " run " + requestId + " in status " + currentStatus);
        this.requestId = requestId;
        this.currentStatus = currentStatus;
    }

    public String getRequestId() {
        return requestId;
    }

    public RunStatus getCurrentStatus() {
        return currentStatus;
    }
}
