package com.scheduler.lifecycle.run;

import com.scheduler.lifecycle.maintenance.CancellationToken;

/**
 * Handle given to a running {@link OrchestrationStep} for reporting progress and counters.
 */
public class StepContext {

    private final RunStateTracker tracker;
    private final String requestId;
    private final String stepName;
    private final CancellationToken cancellation;

    StepContext(RunStateTracker tracker, String requestId, String stepName, CancellationToken cancellation) {
        this.tracker = tracker;
        this.requestId = requestId;
        this.stepName = stepName;
        this.cancellation = cancellation;
    }

    public String requestId() {
        return requestId;
    }

    public String stepName() {
        return stepName;
    }

    public void reportProgress(long processed, long total) {
        tracker.updateProgress(requestId, stepName, processed, total);
    }

    public void recordCounter(RunCounter counter, long value) {
        tracker.recordCounter(requestId, counter, value);
    }

    /**
     * Steps should stop early, returning normally, once this is true.
     */
    public boolean isCancelled() {
        return cancellation.isCancelled();
    }
}
